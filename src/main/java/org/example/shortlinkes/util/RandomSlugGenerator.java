package org.example.shortlinkes.util;

import java.security.SecureRandom;
import java.util.Objects;
import java.util.Random;
import org.example.shortlinkes.model.Slug;

/**
 * {@link SlugGenerator} producing random Base62 tokens of a fixed length.
 *
 * <p>Thread-safe as long as the supplied {@link Random} is (both {@link Random} and {@link
 * SecureRandom} are).
 */
public final class RandomSlugGenerator implements SlugGenerator {

  private static final char[] B62 =
      "0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz".toCharArray();

  private final int length;
  private final Random rnd;

  public RandomSlugGenerator(int length) {
    this(length, new SecureRandom());
  }

  /**
   * @param length number of characters per slug, at least 1
   * @param rnd randomness source; pass a seeded {@link Random} for reproducible output
   */
  public RandomSlugGenerator(int length, Random rnd) {
    if (length < 1) {
      throw new IllegalArgumentException("Slug length must be positive, got " + length);
    }
    this.length = length;
    this.rnd = Objects.requireNonNull(rnd, "rnd");
  }

  @Override
  public Slug next() {
    char[] c = new char[length];
    for (int i = 0; i < length; i++) c[i] = B62[rnd.nextInt(B62.length)];
    return new Slug(new String(c));
  }

  public int length() {
    return length;
  }
}
