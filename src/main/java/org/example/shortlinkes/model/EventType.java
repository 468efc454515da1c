package org.example.shortlinkes.model;

/**
 * Stable tags of the {@link Event} variants.
 *
 * <p>The tag is what the journal writes to disk, so renaming a constant breaks existing journals.
 */
public enum EventType {
  /** A new short link was registered. */
  LINK_CREATED,

  /** A short link was followed once. */
  LINK_ACCESSED,

  /** A short link was repointed to another URL. */
  URL_CHANGED
}
