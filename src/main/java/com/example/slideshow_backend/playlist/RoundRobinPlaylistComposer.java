package com.example.slideshow_backend.playlist;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Interleaves categories round-robin: every round offers each category, in priority order, one slot.
 * A category only takes its slot when a full group is available.
 */
@Component
public class RoundRobinPlaylistComposer implements PlaylistComposer {
    private static final Logger LOGGER = LoggerFactory.getLogger(RoundRobinPlaylistComposer.class);

    private final CategoryPartitioner partitioner;
    private final FairnessOrderer orderer;
    private final MosaicBatcher batcher;
    private final ComposerSettings settings;

    public RoundRobinPlaylistComposer(CategoryPartitioner partitioner,
                                      FairnessOrderer orderer,
                                      MosaicBatcher batcher,
                                      ComposerSettings settings) {
        this.partitioner = partitioner;
        this.orderer = orderer;
        this.batcher = batcher;
        this.settings = settings;
    }

    @Override
    public Playlist compose(List<Submission> pool, int limit) {
        if (limit <= 0 || pool == null || pool.isEmpty()) {
            return Playlist.empty();
        }
        Partition partition = partitioner.partition(pool, settings);
        if (!partition.unclassified().isEmpty()) {
            LOGGER.warn("PlaylistComposer dropped unclassified={} ids={}",
                    partition.unclassified().size(),
                    partition.unclassified().stream().map(c -> c.submission().id()).toList());
        }
        if (partition.duplicates() > 0) {
            LOGGER.warn("PlaylistComposer skipped duplicates={}", partition.duplicates());
        }

        List<MosaicBatcher.Cursor> cursors = new ArrayList<>(settings.priority().size());
        for (ShapeCategory category : settings.priority()) {
            List<Candidate> ordered = orderer.order(partition.bucket(category));
            cursors.add(batcher.open(category, ordered, settings.groupSize(category)));
        }

        List<DisplayUnit> units = new ArrayList<>();
        int rounds = 0;
        while (units.size() < limit) {
            boolean emitted = false;
            for (MosaicBatcher.Cursor cursor : cursors) {
                if (units.size() >= limit) {
                    break;
                }
                if (cursor.hasNext()) {
                    DisplayUnit unit = cursor.next();
                    units.add(unit);
                    emitted = true;
                    LOGGER.trace("PlaylistComposer round={} emit category={} layout={} size={}",
                            rounds, unit.category(), unit.layout(), unit.submissions().size());
                }
            }
            if (!emitted) {
                break;
            }
            rounds++;
        }

        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("PlaylistComposer pool={} landscape={} portrait={} square={} limit={} rounds={} units={} leftover={}",
                    pool.size(),
                    partition.bucket(ShapeCategory.LANDSCAPE).size(),
                    partition.bucket(ShapeCategory.PORTRAIT).size(),
                    partition.bucket(ShapeCategory.SQUARE).size(),
                    limit, rounds, units.size(),
                    cursors.stream().mapToInt(MosaicBatcher.Cursor::remaining).sum());
        }
        return new Playlist(units);
    }
}
