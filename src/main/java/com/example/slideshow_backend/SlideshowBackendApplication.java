package com.example.slideshow_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SlideshowBackendApplication {

	public static void main(String[] args) {
		SpringApplication.run(SlideshowBackendApplication.class, args);
	}

}
