package org.example.shortlinkes.model;

import java.util.Objects;

/**
 * Checked exception carrying a {@link ShortenerError}.
 *
 * <p>Every command and query method declares it, so callers have to deal with the three expected
 * outcomes explicitly. Internal-consistency failures are never reported through this type.
 */
public class ShortenerException extends Exception {
  private static final long serialVersionUID = 1L;

  private final ShortenerError error;

  public ShortenerException(ShortenerError error, String detail) {
    super(error.description() + ": " + detail);
    this.error = Objects.requireNonNull(error, "error");
  }

  /**
   * @return the kind of failure
   */
  public ShortenerError error() {
    return error;
  }

  public static ShortenerException invalidUrl(Url url) {
    return new ShortenerException(ShortenerError.INVALID_URL, "'" + url.value() + "'");
  }

  public static ShortenerException slugInUse(Slug slug) {
    return new ShortenerException(ShortenerError.SLUG_ALREADY_IN_USE, slug.value());
  }

  public static ShortenerException slugNotFound(Slug slug) {
    return new ShortenerException(ShortenerError.SLUG_NOT_FOUND, slug.value());
  }
}
