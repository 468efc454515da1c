package org.example.shortlinkes.storage;

import java.time.LocalDateTime;
import org.example.shortlinkes.model.Event;
import org.example.shortlinkes.model.EventType;
import org.example.shortlinkes.model.Slug;
import org.example.shortlinkes.model.Url;

/**
 * One line of the JSON event journal.
 *
 * <p>A flat data holder with public fields so Gson can map it without adapters. {@link #url} holds
 * the initial URL of {@code LINK_CREATED} and the new URL of {@code URL_CHANGED}; it is {@code
 * null} for {@code LINK_ACCESSED}. {@link #recordedAt} is informational only and plays no part in
 * replay.
 */
public class JournalEntry {
  /** Sequence number assigned by the event store. */
  public long seq;

  /** Variant of the event. */
  public EventType type;

  /** Slug the event is about. */
  public String slug;

  /** URL payload, see class docs. */
  public String url;

  /** Local time the event was written. */
  public LocalDateTime recordedAt;

  static JournalEntry of(long seq, Event event, LocalDateTime recordedAt) {
    JournalEntry e = new JournalEntry();
    e.seq = seq;
    e.type = event.type();
    e.slug = event.slug().value();
    if (event instanceof Event.LinkCreated created) {
      e.url = created.url().value();
    } else if (event instanceof Event.UrlChanged changed) {
      e.url = changed.newUrl().value();
    }
    e.recordedAt = recordedAt;
    return e;
  }

  /**
   * Rebuilds the domain event.
   *
   * @return the event this entry describes
   * @throws IllegalArgumentException if a required field is missing
   */
  Event toEvent() {
    if (type == null) throw new IllegalArgumentException("missing or unknown event type");
    if (slug == null) throw new IllegalArgumentException("missing slug");
    Slug s = new Slug(slug);
    return switch (type) {
      case LINK_CREATED -> new Event.LinkCreated(s, new Url(requireUrl()));
      case LINK_ACCESSED -> new Event.LinkAccessed(s);
      case URL_CHANGED -> new Event.UrlChanged(s, new Url(requireUrl()));
    };
  }

  private String requireUrl() {
    if (url == null) throw new IllegalArgumentException("missing url for " + type);
    return url;
  }
}
