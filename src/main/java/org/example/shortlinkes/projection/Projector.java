package org.example.shortlinkes.projection;

import java.util.List;
import java.util.Objects;
import org.example.shortlinkes.model.Event;
import org.example.shortlinkes.storage.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maintains the {@link MaterializedView} of an {@link EventStore}.
 *
 * <p>The projector remembers the sequence number of the last event it applied. {@link
 * #catchUp(EventStore)} folds only the events appended since then, so keeping the view current
 * costs one event per command. {@link #replay(List)} and {@link #rebuild(EventStore)} fold the
 * whole log from an empty state; they serve bootstrap, recovery and verification.
 *
 * <p><b>Thread-safety:</b> none. The owning service guards the projector with the same lock that
 * serializes appends, so the view never runs ahead of or behind the log it is read against.
 */
public final class Projector {
  private static final Logger log = LoggerFactory.getLogger(Projector.class);

  private MaterializedView view = new MaterializedView();
  private long position;

  /**
   * Full replay from empty state.
   *
   * @param events log in append order
   * @return a fresh view
   * @throws IllegalStateException if the log violates slug uniqueness
   */
  public static MaterializedView replay(List<Event> events) {
    MaterializedView fresh = new MaterializedView();
    for (Event e : events) {
      fresh.apply(e);
    }
    return fresh;
  }

  /**
   * Applies the events appended to {@code store} since the last call.
   *
   * @param store log to follow; must be the same store on every call
   * @return number of events applied
   */
  public int catchUp(EventStore store) {
    List<Event> delta = store.since(position);
    for (Event e : delta) {
      view.apply(e);
      position++;
    }
    if (!delta.isEmpty()) {
      log.debug("Projected {} event(s), position now {}", delta.size(), position);
    }
    return delta.size();
  }

  /**
   * Discards the current view and replays {@code store} from scratch.
   *
   * @param store log to project
   */
  public void rebuild(EventStore store) {
    Objects.requireNonNull(store, "store");
    List<Event> events = store.all();
    this.view = replay(events);
    this.position = events.size();
    log.info("Rebuilt view from {} event(s): {} link(s)", events.size(), view.size());
  }

  /**
   * @return the live view; callers must hold the owning service's lock while reading it
   */
  public MaterializedView view() {
    return view;
  }

  /**
   * @return sequence number of the last applied event
   */
  public long position() {
    return position;
  }
}
