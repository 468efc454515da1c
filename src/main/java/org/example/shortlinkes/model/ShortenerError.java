package org.example.shortlinkes.model;

/**
 * All recoverable, caller-visible failures of the short-link service.
 *
 * <p>None of them indicates corruption and none of them leaves an event in the log.
 */
public enum ShortenerError {
  /** The provided {@link Url} failed the configured URL policy. */
  INVALID_URL("Invalid URL"),

  /** The requested {@link Slug} already belongs to a link. */
  SLUG_ALREADY_IN_USE("Slug is already in use"),

  /** The provided {@link Slug} does not map to any existing link. */
  SLUG_NOT_FOUND("Slug not found");

  private final String description;

  ShortenerError(String description) {
    this.description = description;
  }

  public String description() {
    return description;
  }
}
