package org.example.shortlinkes.service;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import org.example.shortlinkes.model.Event;
import org.example.shortlinkes.model.ShortenerException;
import org.example.shortlinkes.model.Slug;
import org.example.shortlinkes.model.Stats;
import org.example.shortlinkes.projection.Projector;
import org.example.shortlinkes.storage.EventStore;

/**
 * Answers queries from the materialized view, or from the log for {@link #history(Slug)}.
 *
 * <p>Reads hold the read lock shared with {@link CommandService} and return copies, so a query
 * sees the state either before or after a concurrent command, never in between. Queries may run
 * concurrently with each other.
 *
 * <p>The store may be appended to outside this service. Before reading the view, a query checks
 * whether the projector is behind the log and, if so, catches it up under the write lock.
 */
public class QueryService implements QueryHandler {

    private static final Comparator<Stats> BY_REDIRECTS_DESC =
            Comparator.comparingLong(Stats::redirects)
                    .reversed()
                    .thenComparing(s -> s.slug().value());

    private final EventStore store;
    private final Projector projector;
    private final Lock readLock;
    private final Lock writeLock;

    QueryService(EventStore store, Projector projector, ReadWriteLock lock) {
        this.store = Objects.requireNonNull(store, "store");
        this.projector = Objects.requireNonNull(projector, "projector");
        Objects.requireNonNull(lock, "lock");
        this.readLock = lock.readLock();
        this.writeLock = lock.writeLock();
    }

    @Override
    public Stats getStats(Slug slug) throws ShortenerException {
        Objects.requireNonNull(slug, "slug");
        catchUpIfBehind();
        readLock.lock();
        try {
            return projector.view().stats(slug).orElseThrow(() -> ShortenerException.slugNotFound(slug));
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public List<Event> history(Slug slug) {
        Objects.requireNonNull(slug, "slug");
        return store.all().stream().filter(e -> e.slug().equals(slug)).toList();
    }

    @Override
    public List<Stats> topByRedirects(int limit) {
        if (limit <= 0) return List.of();
        catchUpIfBehind();
        readLock.lock();
        try {
            return projector.view().allStats().stream()
                    .sorted(BY_REDIRECTS_DESC)
                    .limit(limit)
                    .toList();
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Applies events appended since the last projection. The read lock cannot be upgraded, so the
     * check and the catch-up use separate lock sections.
     */
    void catchUpIfBehind() {
        boolean behind;
        readLock.lock();
        try {
            behind = projector.position() < store.lastSequence();
        } finally {
            readLock.unlock();
        }
        if (!behind) return;
        writeLock.lock();
        try {
            projector.catchUp(store);
        } finally {
            writeLock.unlock();
        }
    }
}
