package org.example.shortlinkes.storage;

import java.util.List;
import org.example.shortlinkes.model.Event;

/**
 * Append-only, ordered log of {@link Event}s; the single source of truth of the registry.
 *
 * <p>{@link #append(Event)} is the only mutator. Sequence numbers start at {@code 1} and grow by
 * one per appended event; entries are never reordered or removed. The store performs no domain
 * validation: callers check invariants before appending.
 */
public interface EventStore {

  /**
   * Records an event at the end of the log.
   *
   * @param event fact to record
   * @return the sequence number assigned to {@code event}
   */
  long append(Event event);

  /**
   * @return immutable snapshot of the whole log at call time, in append order
   */
  List<Event> all();

  /**
   * @param sequence last sequence number the caller has already seen ({@code 0} for none)
   * @return immutable snapshot of events with a greater sequence number, in append order
   */
  List<Event> since(long sequence);

  /**
   * @return sequence number of the last appended event, {@code 0} when empty
   */
  long lastSequence();

  /**
   * @return number of events in the log
   */
  default int size() {
    return Math.toIntExact(lastSequence());
  }
}
