package org.example.shortlinkes.model;

import java.util.Objects;

/**
 * The original address a short link points to.
 *
 * <p>The value is kept as given. Whether it is acceptable is decided by a {@link
 * org.example.shortlinkes.util.UrlPolicy} at command time, so an empty {@code Url} is a legal value
 * that the default policy rejects.
 *
 * @param value the raw URL text, never {@code null}
 */
public record Url(String value) {

  public Url {
    Objects.requireNonNull(value, "url value");
  }

  public static Url of(String value) {
    return new Url(value);
  }

  @Override
  public String toString() {
    return value;
  }
}
