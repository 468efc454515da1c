package org.example.shortlinkes.model;

import java.util.Objects;

/**
 * A unique string (alias) that identifies a short link.
 *
 * <p>Two slugs are equal when their values are exactly equal; no case folding or trimming is
 * applied. A slug never changes once it has been assigned to a link.
 *
 * @param value the raw slug text, never {@code null} or blank
 */
public record Slug(String value) {

  public Slug {
    Objects.requireNonNull(value, "slug value");
    if (value.isBlank()) {
      throw new IllegalArgumentException("Slug must not be blank");
    }
  }

  /**
   * Shorthand factory used by callers and tests.
   *
   * @param value slug text
   * @return a new {@link Slug}
   */
  public static Slug of(String value) {
    return new Slug(value);
  }

  @Override
  public String toString() {
    return value;
  }
}
