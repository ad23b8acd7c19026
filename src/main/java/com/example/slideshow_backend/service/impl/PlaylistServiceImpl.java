package com.example.slideshow_backend.service.impl;

import com.example.slideshow_backend.config.PlaylistProperties;
import com.example.slideshow_backend.dto.NextCandidateResponse;
import com.example.slideshow_backend.dto.PlaylistResponse;
import com.example.slideshow_backend.playlist.ComposerSettings;
import com.example.slideshow_backend.playlist.IdExtractor;
import com.example.slideshow_backend.playlist.Playlist;
import com.example.slideshow_backend.playlist.PlaylistComposer;
import com.example.slideshow_backend.playlist.SlideImage;
import com.example.slideshow_backend.playlist.Submission;
import com.example.slideshow_backend.service.PlaylistService;
import jakarta.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Default implementation of {@link PlaylistService}.
 */
@Service
public class PlaylistServiceImpl implements PlaylistService {
    private static final Logger LOGGER = LoggerFactory.getLogger(PlaylistServiceImpl.class);
    static final String NO_SUBMISSIONS = "No submissions available";
    static final String NO_NEW_SUBMISSIONS = "No new submissions available";
    static final String NO_CANDIDATE = "No valid candidate found";

    private final PlaylistComposer composer;
    private final IdExtractor idExtractor;
    private final PlaylistProperties props;
    private final ComposerSettings settings;

    public PlaylistServiceImpl(PlaylistComposer composer,
                               IdExtractor idExtractor,
                               PlaylistProperties props,
                               ComposerSettings settings) {
        this.composer = composer;
        this.idExtractor = idExtractor;
        this.props = props;
        this.settings = settings;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public PlaylistResponse generate(List<Submission> pool, @Nullable Integer limit, @Nullable Collection<String> excludeIds) {
        Objects.requireNonNull(pool, "pool");
        long started = System.nanoTime();
        int effectiveLimit = resolveLimit(limit);
        List<Submission> available = exclude(pool, excludeIds);
        logHead(available);

        if (available.isEmpty()) {
            LOGGER.info("PlaylistService empty pool={} excluded={}", pool.size(), pool.size() - available.size());
            return new PlaylistResponse(0, 0, List.of(), List.of(), NO_SUBMISSIONS);
        }

        Playlist playlist = composer.compose(available, effectiveLimit);
        List<String> ids = idExtractor.extract(playlist);
        long durationMs = Duration.ofNanos(System.nanoTime() - started).toMillis();
        LOGGER.info("PlaylistService done pool={} available={} limit={} units={} ids={} durMs={}",
                pool.size(), available.size(), effectiveLimit, playlist.size(), ids.size(), durationMs);
        return new PlaylistResponse(playlist.size(), available.size(), playlist.units(), ids,
                playlist.isEmpty() ? NO_CANDIDATE : null);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public NextCandidateResponse nextCandidate(List<Submission> pool, @Nullable Collection<String> excludeIds) {
        Objects.requireNonNull(pool, "pool");
        List<Submission> available = exclude(pool, excludeIds);
        if (available.isEmpty()) {
            LOGGER.info("PlaylistService nextCandidate none pool={} buffered={}", pool.size(), pool.size() - available.size());
            return new NextCandidateResponse(null, List.of(), 0, NO_NEW_SUBMISSIONS);
        }
        Playlist playlist = composer.compose(available, 1);
        if (playlist.isEmpty()) {
            LOGGER.info("PlaylistService nextCandidate none available={} reason=no-complete-unit", available.size());
            return new NextCandidateResponse(null, List.of(), available.size(), NO_CANDIDATE);
        }
        List<String> ids = idExtractor.extract(playlist);
        LOGGER.info("PlaylistService nextCandidate available={} category={} ids={}",
                available.size(), playlist.units().get(0).category(), ids);
        return new NextCandidateResponse(playlist.units().get(0), ids, available.size(), null);
    }

    int resolveLimit(@Nullable Integer limit) {
        if (limit == null) {
            return Math.min(props.getDefaultLimit(), props.getMaxLimit());
        }
        return Math.min(limit, props.getMaxLimit());
    }

    private static List<Submission> exclude(List<Submission> pool, @Nullable Collection<String> excludeIds) {
        if (excludeIds == null || excludeIds.isEmpty()) {
            return pool;
        }
        Set<String> excluded = excludeIds.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(id -> !id.isEmpty())
                .collect(Collectors.toSet());
        if (excluded.isEmpty()) {
            return pool;
        }
        List<Submission> kept = pool.stream().filter(s -> !excluded.contains(s.id())).toList();
        LOGGER.debug("PlaylistService excluding {} buffered ids, kept={}", pool.size() - kept.size(), kept.size());
        return kept;
    }

    private void logHead(List<Submission> available) {
        if (!LOGGER.isDebugEnabled() || props.getLogHead() <= 0) {
            return;
        }
        int head = Math.min(props.getLogHead(), available.size());
        LOGGER.debug("PlaylistService first {} of {} submissions by input order:", head, available.size());
        for (int i = 0; i < head; i++) {
            Submission submission = available.get(i);
            SlideImage image = submission.toSlideImage(settings.fallbackWidth(), settings.fallbackHeight());
            LOGGER.debug("  {}. {} playCount={} {}x{} ({})", i + 1, submission.id(), submission.effectivePlayCount(),
                    image.width(), image.height(),
                    String.format(Locale.ROOT, "%.3f", (double) image.width() / image.height()));
        }
    }
}
