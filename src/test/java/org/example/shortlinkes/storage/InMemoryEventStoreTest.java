package org.example.shortlinkes.storage;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import org.example.shortlinkes.model.Event;
import org.example.shortlinkes.model.Slug;
import org.example.shortlinkes.model.Url;
import org.junit.jupiter.api.*;

/**
 * Tests for {@link InMemoryEventStore}.
 *
 * <p><b>Covered:</b>
 *
 * <ul>
 *   <li>sequence numbers start at 1 and increase by one
 *   <li>{@code all()} and {@code since()} return immutable snapshots
 *   <li>journal is written before memory; a failing journal leaves the log unchanged
 *   <li>history is recovered from the journal without being rewritten
 * </ul>
 */
public class InMemoryEventStoreTest {

  private static Event created(String slug) {
    return new Event.LinkCreated(Slug.of(slug), Url.of("https://" + slug + ".example"));
  }

  /** Journal kept in memory; can be switched to fail. */
  private static final class RecordingJournal implements EventJournal {
    final List<Event> written = new ArrayList<>();
    final List<Long> sequences = new ArrayList<>();
    boolean failing;

    @Override
    public void write(long sequence, Event event) throws IOException {
      if (failing) throw new IOException("disk full");
      sequences.add(sequence);
      written.add(event);
    }

    @Override
    public List<Event> readAll() {
      return new ArrayList<>(written);
    }
  }

  @Test
  @DisplayName("append() returns strictly increasing sequence numbers starting at 1")
  void append_assigns_sequences() {
    InMemoryEventStore store = new InMemoryEventStore();
    assertEquals(0, store.lastSequence());
    assertEquals(1, store.append(created("a")));
    assertEquals(2, store.append(new Event.LinkAccessed(Slug.of("a"))));
    assertEquals(3, store.append(created("b")));
    assertEquals(3, store.lastSequence());
    assertEquals(3, store.size());
  }

  @Test
  @DisplayName("all() keeps append order and is an immutable snapshot")
  void all_is_snapshot() {
    InMemoryEventStore store = new InMemoryEventStore();
    store.append(created("a"));
    List<Event> snapshot = store.all();
    store.append(created("b"));

    assertEquals(1, snapshot.size(), "Snapshot must not see later appends.");
    assertThrows(UnsupportedOperationException.class, () -> snapshot.add(created("x")));
    assertEquals(List.of(created("a"), created("b")), store.all());
  }

  @Test
  @DisplayName("since() returns only events after the given sequence")
  void since_returns_delta() {
    InMemoryEventStore store = new InMemoryEventStore();
    store.append(created("a"));
    store.append(created("b"));
    store.append(created("c"));

    assertEquals(3, store.since(0).size());
    assertEquals(List.of(created("c")), store.since(2));
    assertTrue(store.since(3).isEmpty());
    assertTrue(store.since(10).isEmpty());
    assertThrows(IllegalArgumentException.class, () -> store.since(-1));
  }

  @Test
  @DisplayName("Journal receives every event with its sequence number")
  void journal_receives_events() {
    RecordingJournal journal = new RecordingJournal();
    InMemoryEventStore store = new InMemoryEventStore(journal);
    store.append(created("a"));
    store.append(created("b"));

    assertTrue(store.isJournaled());
    assertEquals(List.of(1L, 2L), journal.sequences);
    assertEquals(store.all(), journal.written);
  }

  @Test
  @DisplayName("Failing journal: append throws and the log stays unchanged")
  void failing_journal_leaves_log_unchanged() {
    RecordingJournal journal = new RecordingJournal();
    InMemoryEventStore store = new InMemoryEventStore(journal);
    store.append(created("a"));

    journal.failing = true;
    UncheckedIOException ex =
        assertThrows(UncheckedIOException.class, () -> store.append(created("b")));
    assertTrue(ex.getMessage().contains("#2"));
    assertEquals(1, store.lastSequence(), "Failed append must not reach memory.");

    journal.failing = false;
    assertEquals(2, store.append(created("c")), "Sequence must not skip after a failure.");
  }

  @Test
  @DisplayName("Store recovers journal history without writing it again")
  void recovers_from_journal() {
    RecordingJournal journal = new RecordingJournal();
    journal.written.add(created("a"));
    journal.written.add(new Event.LinkAccessed(Slug.of("a")));

    InMemoryEventStore store = new InMemoryEventStore(journal);
    assertEquals(2, store.lastSequence());
    assertTrue(journal.sequences.isEmpty(), "Recovery must not rewrite the journal.");
    assertEquals(3, store.append(created("b")));
  }

  @Test
  @DisplayName("Unreadable journal fails construction")
  void unreadable_journal() {
    EventJournal broken =
        new EventJournal() {
          @Override
          public void write(long sequence, Event event) {}

          @Override
          public List<Event> readAll() throws IOException {
            throw new IOException("corrupted");
          }
        };
    assertThrows(UncheckedIOException.class, () -> new InMemoryEventStore(broken));
  }
}
