package org.example.shortlinkes.model;

import java.util.Objects;

/**
 * Shortened URL representation: the current target of a slug.
 *
 * <p>This is a derived value. It is obtained by folding the {@link Event.LinkCreated} and {@link
 * Event.UrlChanged} events of a slug in append order, the last one winning. Instances are immutable;
 * {@link #withUrl(Url)} returns a copy.
 *
 * @param slug the alias of the link
 * @param url the address the link currently redirects to
 */
public record ShortLink(Slug slug, Url url) {

  public ShortLink {
    Objects.requireNonNull(slug, "slug");
    Objects.requireNonNull(url, "url");
  }

  /**
   * @param newUrl replacement target
   * @return a link with the same slug pointing to {@code newUrl}
   */
  public ShortLink withUrl(Url newUrl) {
    return new ShortLink(slug, newUrl);
  }
}
