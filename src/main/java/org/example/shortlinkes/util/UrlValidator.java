package org.example.shortlinkes.util;

import java.net.URI;
import java.util.List;
import java.util.Locale;
import org.example.shortlinkes.model.Url;

/**
 * Factories for the {@link UrlPolicy} implementations shipped with the registry.
 *
 * <p>This class is a static holder and is not meant to be instantiated.
 */
public final class UrlValidator {
  private UrlValidator() {}

  /** Schemes accepted by {@link #defaultPolicy(int)}. */
  public static final List<String> DEFAULT_SCHEMES = List.of("http://", "https://");

  /**
   * Accepts a URL when it is non-empty, not longer than {@code maxLen} and starts with one of the
   * given scheme prefixes (case-insensitive). This is the policy the service uses by default.
   *
   * @param schemes accepted prefixes, e.g. {@code "https://"}; must not be empty
   * @param maxLen maximum number of characters
   * @return the policy
   */
  public static UrlPolicy schemePrefix(List<String> schemes, int maxLen) {
    if (schemes == null || schemes.isEmpty()) {
      throw new IllegalArgumentException("At least one URL scheme must be configured");
    }
    List<String> prefixes = schemes.stream().map(s -> s.toLowerCase(Locale.ROOT)).toList();
    return url -> {
      String value = url.value();
      if (value.isEmpty() || value.length() > maxLen) return false;
      String lower = value.toLowerCase(Locale.ROOT);
      for (String p : prefixes) {
        if (lower.startsWith(p) && lower.length() > p.length()) return true;
      }
      return false;
    };
  }

  /**
   * @param maxLen maximum number of characters
   * @return {@link #schemePrefix(List, int)} over {@link #DEFAULT_SCHEMES}
   */
  public static UrlPolicy defaultPolicy(int maxLen) {
    return schemePrefix(DEFAULT_SCHEMES, maxLen);
  }

  /**
   * Stricter policy: the value must parse as a {@link URI} with an {@code http}/{@code https}
   * scheme and a non-blank host. Surrounding whitespace is rejected rather than trimmed, because
   * the stored URL is exactly the one that was validated.
   *
   * @param maxLen maximum number of characters
   * @return the policy
   */
  public static UrlPolicy strictHttp(int maxLen) {
    return url -> isValidHttpUrl(url.value(), maxLen);
  }

  static boolean isValidHttpUrl(String url, int maxLen) {
    if (url == null || url.isEmpty() || url.length() > maxLen) return false;
    if (!url.equals(url.trim())) return false;
    try {
      URI uri = URI.create(url);
      String scheme = uri.getScheme();
      if (scheme == null) return false;
      if (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https")) return false;
      String host = uri.getHost();
      return host != null && !host.isBlank();
    } catch (IllegalArgumentException e) {
      return false;
    }
  }
}
