package com.example.slideshow_backend.service;

import com.example.slideshow_backend.config.PlaylistProperties;
import com.example.slideshow_backend.dto.NextCandidateResponse;
import com.example.slideshow_backend.dto.PlaylistResponse;
import com.example.slideshow_backend.playlist.AspectClassifier;
import com.example.slideshow_backend.playlist.CategoryPartitioner;
import com.example.slideshow_backend.playlist.ComposerSettings;
import com.example.slideshow_backend.playlist.FairnessOrderer;
import com.example.slideshow_backend.playlist.IdExtractor;
import com.example.slideshow_backend.playlist.ImageDimensions;
import com.example.slideshow_backend.playlist.MosaicBatcher;
import com.example.slideshow_backend.playlist.Playlist;
import com.example.slideshow_backend.playlist.PlaylistComposer;
import com.example.slideshow_backend.playlist.RoundRobinPlaylistComposer;
import com.example.slideshow_backend.playlist.ShapeCategory;
import com.example.slideshow_backend.playlist.Submission;
import com.example.slideshow_backend.playlist.UnitType;
import com.example.slideshow_backend.service.impl.PlaylistServiceImpl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;

/**
 * Unit tests for {@link PlaylistServiceImpl} covering limits, exclusions and empty outcomes.
 */
class PlaylistServiceImplTest {
    private static final Instant BASE = Instant.parse("2025-06-01T12:00:00Z");

    private PlaylistProperties props;
    private PlaylistService service;

    @BeforeEach
    void setup() {
        props = new PlaylistProperties();
        props.setDefaultLimit(4);
        props.setMaxLimit(6);
        ComposerSettings settings = ComposerSettings.defaults();
        PlaylistComposer composer = new RoundRobinPlaylistComposer(
                new CategoryPartitioner(new AspectClassifier()), new FairnessOrderer(), new MosaicBatcher(), settings);
        service = new PlaylistServiceImpl(composer, new IdExtractor(), props, settings);
    }

    @Test
    void usesConfiguredDefaultLimitWhenAbsent() {
        PlaylistResponse response = service.generate(landscapes(10), null, null);

        assertThat(response.count()).isEqualTo(4);
        assertThat(response.totalSubmissions()).isEqualTo(10);
        assertThat(response.submissionIds()).containsExactly("l0", "l1", "l2", "l3");
        assertThat(response.message()).isNull();
    }

    @Test
    void capsRequestedLimitAtMaximum() {
        PlaylistResponse response = service.generate(landscapes(10), 100, List.of());

        assertThat(response.count()).isEqualTo(6);
    }

    @Test
    void nonPositiveLimitProducesEmptyPlaylist() {
        PlaylistResponse response = service.generate(landscapes(3), 0, null);

        assertThat(response.playlist()).isEmpty();
        assertThat(response.submissionIds()).isEmpty();
        assertThat(response.totalSubmissions()).isEqualTo(3);
    }

    @Test
    void excludedIdsAreNotScheduled() {
        PlaylistResponse response = service.generate(landscapes(5), 5, List.of("l0", " l2 ", ""));

        assertThat(response.submissionIds()).containsExactly("l1", "l3", "l4");
        assertThat(response.totalSubmissions()).isEqualTo(3);
    }

    @Test
    void emptyPoolReturnsMessage() {
        PlaylistResponse response = service.generate(List.of(), 5, null);

        assertThat(response.count()).isZero();
        assertThat(response.message()).isEqualTo("No submissions available");
    }

    @Test
    void nextCandidateReturnsFirstUnitOutsideBuffer() {
        List<Submission> pool = new ArrayList<>(landscapes(2));
        for (int i = 0; i < 3; i++) {
            pool.add(new Submission("p" + i, "u", null, ImageDimensions.of(1080, 1920), 0, BASE.plusSeconds(i)));
        }

        NextCandidateResponse response = service.nextCandidate(pool, List.of("l0", "l1"));

        assertThat(response.candidate()).isNotNull();
        assertThat(response.candidate().type()).isEqualTo(UnitType.MOSAIC);
        assertThat(response.candidate().category()).isEqualTo(ShapeCategory.PORTRAIT);
        assertThat(response.submissionIds()).containsExactly("p0", "p1", "p2");
        assertThat(response.totalAvailable()).isEqualTo(3);
    }

    @Test
    void nextCandidateReportsWhenEverythingIsBuffered() {
        NextCandidateResponse response = service.nextCandidate(landscapes(1), List.of("l0"));

        assertThat(response.candidate()).isNull();
        assertThat(response.message()).isEqualTo("No new submissions available");
    }

    @Test
    void nextCandidateReportsWhenNoCompleteUnitExists() {
        List<Submission> pool = List.of(
                new Submission("s0", "u", null, ImageDimensions.of(1000, 1000), 0, BASE));

        NextCandidateResponse response = service.nextCandidate(pool, null);

        assertThat(response.candidate()).isNull();
        assertThat(response.totalAvailable()).isEqualTo(1);
        assertThat(response.message()).isEqualTo("No valid candidate found");
    }

    @Test
    void delegatesToComposerWithSingleSlotForNextCandidate() {
        PlaylistComposer composer = Mockito.mock(PlaylistComposer.class);
        Mockito.when(composer.compose(anyList(), anyInt())).thenReturn(Playlist.empty());
        PlaylistService mocked = new PlaylistServiceImpl(composer, new IdExtractor(), props, ComposerSettings.defaults());

        mocked.nextCandidate(landscapes(3), null);

        Mockito.verify(composer).compose(anyList(), eq(1));
    }

    private static List<Submission> landscapes(int count) {
        List<Submission> pool = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            pool.add(new Submission("l" + i, "https://img.example/l" + i + ".jpg", null,
                    ImageDimensions.of(1920, 1080), i, BASE.plusSeconds(i)));
        }
        return pool;
    }
}
