package org.example.shortlinkes.service;

/**
 * Thrown when the slug generator keeps producing slugs that are already taken.
 *
 * <p>This is not an expected outcome of a command: it means the configured slug length is too
 * small for the number of links, and the registry has to be reconfigured.
 */
public class SlugExhaustedException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  public SlugExhaustedException(int attempts) {
    super("No free slug found after " + attempts + " attempt(s); increase slugLength");
  }
}
