package org.example.shortlinkes.service;

import java.util.List;
import org.example.shortlinkes.model.Event;
import org.example.shortlinkes.model.ShortenerException;
import org.example.shortlinkes.model.Slug;
import org.example.shortlinkes.model.Stats;

/** Read side of the registry. Nothing here ever appends to the log. */
public interface QueryHandler {

  /**
   * @param slug alias of the link
   * @return a snapshot of the link and its redirect count
   * @throws ShortenerException {@code SLUG_NOT_FOUND} if no link has this slug
   */
  Stats getStats(Slug slug) throws ShortenerException;

  /**
   * @param slug alias of the link
   * @return every event recorded for the slug, in append order; empty for unknown slugs
   */
  List<Event> history(Slug slug);

  /**
   * @param limit maximum number of entries
   * @return most redirected links first, ties broken by slug; empty when {@code limit <= 0}
   */
  List<Stats> topByRedirects(int limit);
}
