package com.example.slideshow_backend.playlist;

public enum UnitType {
    SINGLE,
    MOSAIC
}
