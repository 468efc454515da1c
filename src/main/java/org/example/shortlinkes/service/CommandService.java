package org.example.shortlinkes.service;

import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import org.example.shortlinkes.model.Event;
import org.example.shortlinkes.model.ShortLink;
import org.example.shortlinkes.model.ShortenerException;
import org.example.shortlinkes.model.Slug;
import org.example.shortlinkes.model.Url;
import org.example.shortlinkes.projection.MaterializedView;
import org.example.shortlinkes.projection.Projector;
import org.example.shortlinkes.storage.EventStore;
import org.example.shortlinkes.util.SlugGenerator;
import org.example.shortlinkes.util.UrlPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates commands against the current projection and turns each accepted one into exactly one
 * appended event.
 *
 * <p>Every command runs under the write lock shared with {@link QueryService}: the existence or
 * uniqueness check, the append and the projection of the new event form one critical section.
 * This is what makes two concurrent creates of the same slug resolve to one success and one {@code
 * SLUG_ALREADY_IN_USE}, and what gives the log its total order.
 */
public class CommandService implements CommandHandler {
    private static final Logger log = LoggerFactory.getLogger(CommandService.class);

    private final EventStore store;
    private final Projector projector;
    private final Lock writeLock;
    private final UrlPolicy urlPolicy;
    private final SlugGenerator slugGenerator;
    private final int maxSlugAttempts;
    private final boolean validateChangedUrl;

    /**
     * @param store log to append to
     * @param projector projection of {@code store}
     * @param lock lock shared with the query side
     * @param urlPolicy URL validity predicate
     * @param slugGenerator source of random slugs
     * @param maxSlugAttempts how many generated candidates to try before giving up
     * @param validateChangedUrl whether {@link #changeShortLink(Slug, Url)} applies {@code urlPolicy}
     */
    CommandService(
            EventStore store,
            Projector projector,
            ReadWriteLock lock,
            UrlPolicy urlPolicy,
            SlugGenerator slugGenerator,
            int maxSlugAttempts,
            boolean validateChangedUrl) {
        if (maxSlugAttempts < 1) {
            throw new IllegalArgumentException("maxSlugAttempts must be >= 1");
        }
        this.store = Objects.requireNonNull(store, "store");
        this.projector = Objects.requireNonNull(projector, "projector");
        this.writeLock = Objects.requireNonNull(lock, "lock").writeLock();
        this.urlPolicy = Objects.requireNonNull(urlPolicy, "urlPolicy");
        this.slugGenerator = Objects.requireNonNull(slugGenerator, "slugGenerator");
        this.maxSlugAttempts = maxSlugAttempts;
        this.validateChangedUrl = validateChangedUrl;
    }

    @Override
    public ShortLink createShortLink(Url url, Slug slug) throws ShortenerException {
        Objects.requireNonNull(url, "url");
        if (!urlPolicy.isValid(url)) {
            log.debug("Rejected create: invalid URL '{}'", url);
            throw ShortenerException.invalidUrl(url);
        }

        writeLock.lock();
        try {
            MaterializedView view = currentView();
            Slug target;
            if (slug != null) {
                if (view.contains(slug)) {
                    log.debug("Rejected create: slug '{}' in use", slug);
                    throw ShortenerException.slugInUse(slug);
                }
                target = slug;
            } else {
                target = generateFreeSlug(view);
            }
            return commit(new Event.LinkCreated(target, url));
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public ShortLink redirect(Slug slug) throws ShortenerException {
        Objects.requireNonNull(slug, "slug");
        writeLock.lock();
        try {
            requireActive(slug);
            return commit(new Event.LinkAccessed(slug));
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public ShortLink changeShortLink(Slug slug, Url newUrl) throws ShortenerException {
        Objects.requireNonNull(slug, "slug");
        Objects.requireNonNull(newUrl, "newUrl");
        writeLock.lock();
        try {
            requireActive(slug);
            if (validateChangedUrl && !urlPolicy.isValid(newUrl)) {
                log.debug("Rejected change of '{}': invalid URL '{}'", slug, newUrl);
                throw ShortenerException.invalidUrl(newUrl);
            }
            return commit(new Event.UrlChanged(slug, newUrl));
        } finally {
            writeLock.unlock();
        }
    }

    // ---------- internals (write lock held) ----------

    private MaterializedView currentView() {
        projector.catchUp(store);
        return projector.view();
    }

    private void requireActive(Slug slug) throws ShortenerException {
        if (!currentView().contains(slug)) {
            log.debug("Rejected command: slug '{}' not found", slug);
            throw ShortenerException.slugNotFound(slug);
        }
    }

    /**
     * Asks the generator for candidates until one is free.
     *
     * @throws SlugExhaustedException after {@code maxSlugAttempts} collisions
     */
    private Slug generateFreeSlug(MaterializedView view) {
        for (int attempt = 1; attempt <= maxSlugAttempts; attempt++) {
            Slug candidate = Objects.requireNonNull(slugGenerator.next(), "generated slug");
            if (!view.contains(candidate)) {
                return candidate;
            }
            log.warn(
                    "Generated slug '{}' is taken (attempt {}/{})",
                    candidate,
                    attempt,
                    maxSlugAttempts);
        }
        throw new SlugExhaustedException(maxSlugAttempts);
    }

    /** Appends the event, projects it and returns the link it produced. */
    private ShortLink commit(Event event) {
        store.append(event);
        return currentView()
                .link(event.slug())
                .orElseThrow(
                        () -> new IllegalStateException("Projection lost slug '" + event.slug() + "'"));
    }
}
