package org.example.shortlinkes.util;

import org.example.shortlinkes.model.Slug;

/**
 * Source of candidate slugs for links created without an explicit alias.
 *
 * <p>Candidates are not required to be unique; the command side checks each one against the
 * current projection and asks again on collision.
 */
@FunctionalInterface
public interface SlugGenerator {

  /**
   * @return a fresh candidate slug
   */
  Slug next();
}
