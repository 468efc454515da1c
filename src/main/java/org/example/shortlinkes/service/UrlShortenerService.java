package org.example.shortlinkes.service;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.example.shortlinkes.model.Event;
import org.example.shortlinkes.model.ShortLink;
import org.example.shortlinkes.model.ShortenerException;
import org.example.shortlinkes.model.Slug;
import org.example.shortlinkes.model.Stats;
import org.example.shortlinkes.model.Url;
import org.example.shortlinkes.projection.Projector;
import org.example.shortlinkes.storage.ConfigJson;
import org.example.shortlinkes.storage.EventStore;
import org.example.shortlinkes.storage.InMemoryEventStore;
import org.example.shortlinkes.storage.JsonLinesEventJournal;
import org.example.shortlinkes.util.RandomSlugGenerator;
import org.example.shortlinkes.util.SlugGenerator;
import org.example.shortlinkes.util.UrlPolicy;
import org.example.shortlinkes.util.UrlValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Short-link registry built on event sourcing, exposing both the command and the query side.
 *
 * <p>One instance owns one {@link EventStore}, one {@link Projector} and one {@link
 * ReentrantReadWriteLock}, and hands them to a {@link CommandService} and a {@link QueryService}.
 * Callers that should only read or only write can be given {@link #queries()} or {@link
 * #commands()} instead of the whole service.
 *
 * <p>On construction the projection is rebuilt by replaying the store from scratch, which is how a
 * journaled registry recovers its state after a restart.
 *
 * <p><strong>Thread-safety:</strong> safe for concurrent use. Commands are serialized; queries run
 * in parallel with each other.
 */
public class UrlShortenerService implements CommandHandler, QueryHandler {
    private static final Logger log = LoggerFactory.getLogger(UrlShortenerService.class);

    private final EventStore store;
    private final Projector projector = new Projector();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final CommandService commands;
    private final QueryService queries;

    /**
     * Creates a service over an existing store.
     *
     * @param store event log; may already contain history
     * @param urlPolicy URL validity predicate
     * @param slugGenerator source of random slugs
     * @param maxSlugAttempts how many generated candidates to try per create
     * @param validateChangedUrl whether changes apply {@code urlPolicy} too
     * @throws IllegalStateException if the existing history violates slug uniqueness
     */
    public UrlShortenerService(
            EventStore store,
            UrlPolicy urlPolicy,
            SlugGenerator slugGenerator,
            int maxSlugAttempts,
            boolean validateChangedUrl) {
        this.store = Objects.requireNonNull(store, "store");
        this.commands =
                new CommandService(
                        store,
                        projector,
                        lock,
                        urlPolicy,
                        slugGenerator,
                        maxSlugAttempts,
                        validateChangedUrl);
        this.queries = new QueryService(store, projector, lock);

        lock.writeLock().lock();
        try {
            projector.rebuild(store);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @return a service with default configuration and no journal
     */
    public static UrlShortenerService inMemory() {
        return fromConfig(new ConfigJson());
    }

    /**
     * Builds a service from configuration. When {@code journalEnabled} is set, the journal at
     * {@code journalFile} is recovered first and every new event is appended to it.
     *
     * @param cfg configuration; validated before use
     * @return a ready service
     * @throws IllegalArgumentException if the configuration is invalid
     * @throws java.io.UncheckedIOException if the journal cannot be read
     */
    public static UrlShortenerService fromConfig(ConfigJson cfg) {
        cfg.validate();
        EventStore store =
                cfg.journalEnabled
                        ? new InMemoryEventStore(new JsonLinesEventJournal(cfg.journalPath()))
                        : new InMemoryEventStore();
        UrlShortenerService service =
                new UrlShortenerService(
                        store,
                        UrlValidator.schemePrefix(cfg.allowedSchemes, cfg.maxUrlLength),
                        new RandomSlugGenerator(cfg.slugLength),
                        cfg.maxSlugAttempts,
                        cfg.validateChangedUrl);
        log.info(
                "Short-link registry ready: {} event(s), journal {}",
                store.lastSequence(),
                cfg.journalEnabled ? cfg.journalPath().toAbsolutePath() : "disabled");
        return service;
    }

    // ---------- Commands ----------

    @Override
    public ShortLink createShortLink(Url url, Slug slug) throws ShortenerException {
        return commands.createShortLink(url, slug);
    }

    @Override
    public ShortLink redirect(Slug slug) throws ShortenerException {
        return commands.redirect(slug);
    }

    @Override
    public ShortLink changeShortLink(Slug slug, Url newUrl) throws ShortenerException {
        return commands.changeShortLink(slug, newUrl);
    }

    // ---------- Queries ----------

    @Override
    public Stats getStats(Slug slug) throws ShortenerException {
        return queries.getStats(slug);
    }

    @Override
    public List<Event> history(Slug slug) {
        return queries.history(slug);
    }

    @Override
    public List<Stats> topByRedirects(int limit) {
        return queries.topByRedirects(limit);
    }

    // ---------- Capabilities & maintenance ----------

    public CommandHandler commands() {
        return commands;
    }

    public QueryHandler queries() {
        return queries;
    }

    /**
     * @return number of events recorded so far
     */
    public long eventCount() {
        return store.lastSequence();
    }

    /**
     * @return immutable snapshot of the whole log
     */
    public List<Event> events() {
        return store.all();
    }

    /**
     * Brings the view up to date, then replays the same prefix of the log from scratch and compares
     * the result with the incrementally maintained view.
     *
     * @return {@code true} if both agree
     */
    public boolean verifyProjection() {
        queries.catchUpIfBehind();
        lock.readLock().lock();
        try {
            List<Event> events = store.all();
            int position = (int) projector.position();
            if (position > events.size()) {
                throw new IllegalStateException(
                        "Projector position " + position + " is past the log end " + events.size());
            }
            boolean ok =
                    Projector.replay(events.subList(0, position))
                            .snapshot()
                            .equals(projector.view().snapshot());
            if (!ok) {
                log.error("Incremental projection diverged from full replay");
            }
            return ok;
        } finally {
            lock.readLock().unlock();
        }
    }
}
