package org.example.shortlinkes.model;

import java.util.Objects;

/**
 * Statistics of a {@link ShortLink}.
 *
 * @param link the link these statistics belong to, as it currently stands
 * @param redirects number of {@link Event.LinkAccessed} events recorded for the link
 */
public record Stats(ShortLink link, long redirects) {

  public Stats {
    Objects.requireNonNull(link, "link");
    if (redirects < 0) {
      throw new IllegalArgumentException("redirects must be >= 0, got " + redirects);
    }
  }

  public Slug slug() {
    return link.slug();
  }
}
