package org.example.shortlinkes.storage;

import java.io.IOException;
import java.util.List;
import org.example.shortlinkes.model.Event;

/**
 * Durable, append-only sink an {@link InMemoryEventStore} writes every event to before accepting
 * it, and recovers its history from on startup.
 */
public interface EventJournal {

  /**
   * Persists one event.
   *
   * @param sequence sequence number assigned by the store
   * @param event event to persist
   * @throws IOException if the event could not be made durable
   */
  void write(long sequence, Event event) throws IOException;

  /**
   * Reads the whole journal in order.
   *
   * @return recorded events, in sequence order (empty if nothing was recorded yet)
   * @throws IOException if the journal cannot be read or its content is not a valid history
   */
  List<Event> readAll() throws IOException;
}
