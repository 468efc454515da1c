package org.example.shortlinkes.util;

import org.example.shortlinkes.model.Url;

/**
 * Pluggable URL-validity predicate consulted by the command side before a URL is recorded.
 *
 * <p>Implementations must be stateless or thread-safe: the policy is called while the writer lock
 * is held and must not block.
 */
@FunctionalInterface
public interface UrlPolicy {

  /**
   * @param url candidate target
   * @return {@code true} if the URL may be stored
   */
  boolean isValid(Url url);

  /**
   * @param other policy that must also accept the URL
   * @return a policy accepting only URLs accepted by both
   */
  default UrlPolicy and(UrlPolicy other) {
    return url -> isValid(url) && other.isValid(url);
  }
}
