package org.example.shortlinkes.service;

import org.example.shortlinkes.model.ShortLink;
import org.example.shortlinkes.model.ShortenerException;
import org.example.shortlinkes.model.Slug;
import org.example.shortlinkes.model.Url;

/**
 * Write side of the registry. Every successful call appends exactly one event to the log; a failed
 * call appends nothing.
 */
public interface CommandHandler {

  /**
   * Creates a new short link.
   *
   * <p>If {@code slug} is {@code null} a random one is generated, retrying on collision a bounded
   * number of times.
   *
   * @param url target of the link
   * @param slug requested alias, or {@code null} to generate one
   * @return the newly created link
   * @throws ShortenerException {@code INVALID_URL} if the URL is rejected, {@code
   *     SLUG_ALREADY_IN_USE} if the requested slug is taken
   * @throws SlugExhaustedException if no free slug was generated within the attempt limit
   */
  ShortLink createShortLink(Url url, Slug slug) throws ShortenerException;

  /**
   * Creates a new short link with a generated slug.
   *
   * @param url target of the link
   * @return the newly created link
   * @throws ShortenerException {@code INVALID_URL} if the URL is rejected
   */
  default ShortLink createShortLink(Url url) throws ShortenerException {
    return createShortLink(url, null);
  }

  /**
   * Follows a link once and counts the redirect.
   *
   * @param slug alias to resolve
   * @return the link as it currently stands
   * @throws ShortenerException {@code SLUG_NOT_FOUND} if no link has this slug
   */
  ShortLink redirect(Slug slug) throws ShortenerException;

  /**
   * Repoints an existing link. The redirect counter is kept.
   *
   * @param slug alias of the link
   * @param newUrl new target
   * @return the updated link
   * @throws ShortenerException {@code SLUG_NOT_FOUND} if no link has this slug, {@code INVALID_URL}
   *     if the new URL is rejected
   */
  ShortLink changeShortLink(Slug slug, Url newUrl) throws ShortenerException;
}
