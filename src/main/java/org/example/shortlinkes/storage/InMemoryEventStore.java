package org.example.shortlinkes.storage;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.example.shortlinkes.model.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link EventStore} keeping the log in a list, optionally backed by an {@link EventJournal}.
 *
 * <h2>Journal</h2>
 *
 * <ul>
 *   <li>On construction the journal's history is loaded as-is, without being written again.
 *   <li>{@link #append(Event)} writes to the journal first; only when that succeeds is the event
 *       added to memory. A journal failure surfaces as {@link UncheckedIOException} and leaves the
 *       log unchanged.
 * </ul>
 *
 * <h2>Thread-safety</h2>
 *
 * All methods are {@code synchronized}. Readers get immutable copies, so nobody outside this class
 * can alter recorded history.
 */
public final class InMemoryEventStore implements EventStore {
  private static final Logger log = LoggerFactory.getLogger(InMemoryEventStore.class);

  private final List<Event> events = new ArrayList<>();
  private final EventJournal journal;

  /** Creates an empty store without durability. */
  public InMemoryEventStore() {
    this.journal = null;
  }

  /**
   * Creates a store over {@code journal} and recovers everything it already holds.
   *
   * @param journal durable sink, not {@code null}
   * @throws UncheckedIOException if the journal cannot be read
   */
  public InMemoryEventStore(EventJournal journal) {
    this.journal = Objects.requireNonNull(journal, "journal");
    try {
      events.addAll(journal.readAll());
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to recover event journal", e);
    }
    log.info("Recovered {} event(s) from journal", events.size());
  }

  @Override
  public synchronized long append(Event event) {
    Objects.requireNonNull(event, "event");
    long sequence = events.size() + 1L;
    if (journal != null) {
      try {
        journal.write(sequence, event);
      } catch (IOException e) {
        throw new UncheckedIOException("Failed to journal event #" + sequence, e);
      }
    }
    events.add(event);
    log.debug("Appended #{} {}", sequence, event);
    return sequence;
  }

  @Override
  public synchronized List<Event> all() {
    return List.copyOf(events);
  }

  @Override
  public synchronized List<Event> since(long sequence) {
    if (sequence < 0) {
      throw new IllegalArgumentException("sequence must be >= 0, got " + sequence);
    }
    if (sequence >= events.size()) return List.of();
    return List.copyOf(events.subList((int) sequence, events.size()));
  }

  @Override
  public synchronized long lastSequence() {
    return events.size();
  }

  /**
   * @return {@code true} when appends are made durable through a journal
   */
  public boolean isJournaled() {
    return journal != null;
  }
}
