package org.example.shortlinkes.projection;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.example.shortlinkes.model.Event;
import org.example.shortlinkes.model.ShortLink;
import org.example.shortlinkes.model.Slug;
import org.example.shortlinkes.model.Stats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Current state of the registry derived from the event log: slug to link, and slug to redirect
 * count.
 *
 * <p>Both maps keep insertion order, i.e. the order in which links were created, which makes
 * listings stable across replays. The view is a cache and never the system of record.
 *
 * <p>Not thread-safe. Mutation goes through {@link #apply(Event)} only.
 */
public final class MaterializedView {
  private static final Logger log = LoggerFactory.getLogger(MaterializedView.class);

  private final Map<Slug, ShortLink> links = new LinkedHashMap<>();
  private final Map<Slug, Long> redirects = new LinkedHashMap<>();

  /**
   * Folds one event into the view.
   *
   * <ul>
   *   <li>{@code LinkCreated}: registers the link with zero redirects.
   *   <li>{@code LinkAccessed}: increments the counter; no-op for unknown slugs.
   *   <li>{@code UrlChanged}: replaces the target; no-op for unknown slugs.
   * </ul>
   *
   * @param event next event in append order
   * @throws IllegalStateException if a second {@code LinkCreated} arrives for an active slug; the
   *     log then violates slug uniqueness and no further projection is meaningful
   */
  void apply(Event event) {
    if (event instanceof Event.LinkCreated created) {
      Slug slug = created.slug();
      if (links.containsKey(slug)) {
        log.error("Integrity violation: duplicate LinkCreated for slug '{}'", slug);
        throw new IllegalStateException("Duplicate LinkCreated for active slug '" + slug + "'");
      }
      links.put(slug, new ShortLink(slug, created.url()));
      redirects.put(slug, 0L);
    } else if (event instanceof Event.LinkAccessed accessed) {
      redirects.computeIfPresent(accessed.slug(), (s, n) -> n + 1);
    } else if (event instanceof Event.UrlChanged changed) {
      links.computeIfPresent(changed.slug(), (s, link) -> link.withUrl(changed.newUrl()));
    }
  }

  public boolean contains(Slug slug) {
    return links.containsKey(slug);
  }

  public Optional<ShortLink> link(Slug slug) {
    return Optional.ofNullable(links.get(slug));
  }

  /**
   * @param slug link alias
   * @return statistics of the link, or empty if the slug is not active
   */
  public Optional<Stats> stats(Slug slug) {
    ShortLink link = links.get(slug);
    if (link == null) return Optional.empty();
    return Optional.of(new Stats(link, redirects.getOrDefault(slug, 0L)));
  }

  /**
   * @return statistics of every active link, in creation order
   */
  public List<Stats> allStats() {
    List<Stats> out = new ArrayList<>(links.size());
    for (ShortLink link : links.values()) {
      out.add(new Stats(link, redirects.getOrDefault(link.slug(), 0L)));
    }
    return out;
  }

  public int size() {
    return links.size();
  }

  /**
   * @return an immutable copy of the current state
   */
  public ViewSnapshot snapshot() {
    return new ViewSnapshot(
        Collections.unmodifiableMap(new LinkedHashMap<>(links)),
        Collections.unmodifiableMap(new LinkedHashMap<>(redirects)));
  }
}
