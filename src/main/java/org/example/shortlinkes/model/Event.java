package org.example.shortlinkes.model;

import java.util.Objects;

/**
 * A domain event, the unit of history of the registry.
 *
 * <p>The event log is the only durable entity: links and counters are derived from it. Events are
 * immutable once appended. The set of variants is closed:
 *
 * <ul>
 *   <li>{@link LinkCreated} establishes a new link;
 *   <li>{@link LinkAccessed} records one redirect;
 *   <li>{@link UrlChanged} repoints an existing link.
 * </ul>
 */
public sealed interface Event permits Event.LinkCreated, Event.LinkAccessed, Event.UrlChanged {

  /**
   * @return the slug this event is about
   */
  Slug slug();

  /**
   * @return the tag of this variant
   */
  EventType type();

  /**
   * Establishes a new link. At most one such event may exist per slug.
   *
   * @param slug alias of the new link
   * @param url initial target
   */
  record LinkCreated(Slug slug, Url url) implements Event {
    public LinkCreated {
      Objects.requireNonNull(slug, "slug");
      Objects.requireNonNull(url, "url");
    }

    @Override
    public EventType type() {
      return EventType.LINK_CREATED;
    }
  }

  /**
   * Records one redirect through a link.
   *
   * @param slug alias that was followed
   */
  record LinkAccessed(Slug slug) implements Event {
    public LinkAccessed {
      Objects.requireNonNull(slug, "slug");
    }

    @Override
    public EventType type() {
      return EventType.LINK_ACCESSED;
    }
  }

  /**
   * Repoints an existing link. Does not touch its redirect counter.
   *
   * @param slug alias of the link
   * @param newUrl new target
   */
  record UrlChanged(Slug slug, Url newUrl) implements Event {
    public UrlChanged {
      Objects.requireNonNull(slug, "slug");
      Objects.requireNonNull(newUrl, "newUrl");
    }

    @Override
    public EventType type() {
      return EventType.URL_CHANGED;
    }
  }
}
