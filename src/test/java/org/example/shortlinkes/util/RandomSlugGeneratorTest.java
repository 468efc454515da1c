package org.example.shortlinkes.util;

import static org.junit.jupiter.api.Assertions.*;

import java.util.HashSet;
import java.util.Random;
import java.util.Set;
import org.example.shortlinkes.model.Slug;
import org.junit.jupiter.api.*;

/** Tests for {@link RandomSlugGenerator}. */
public class RandomSlugGeneratorTest {

  @Test
  @DisplayName("Slugs have the configured length and use the Base62 alphabet")
  void length_and_alphabet() {
    RandomSlugGenerator gen = new RandomSlugGenerator(6);
    for (int i = 0; i < 200; i++) {
      String s = gen.next().value();
      assertEquals(6, s.length());
      assertTrue(s.matches("[0-9A-Za-z]+"), "Unexpected character in slug: " + s);
    }
  }

  @Test
  @DisplayName("Same seed yields the same sequence")
  void seeded_is_reproducible() {
    RandomSlugGenerator a = new RandomSlugGenerator(8, new Random(42));
    RandomSlugGenerator b = new RandomSlugGenerator(8, new Random(42));
    for (int i = 0; i < 10; i++) {
      assertEquals(a.next(), b.next());
    }
  }

  @Test
  @DisplayName("Random slugs rarely collide")
  void mostly_distinct() {
    RandomSlugGenerator gen = new RandomSlugGenerator(8, new Random(7));
    Set<Slug> seen = new HashSet<>();
    for (int i = 0; i < 1000; i++) seen.add(gen.next());
    assertTrue(seen.size() > 990, "Too many collisions: " + (1000 - seen.size()));
  }

  @Test
  @DisplayName("Non-positive length is rejected")
  void invalid_length() {
    assertThrows(IllegalArgumentException.class, () -> new RandomSlugGenerator(0));
  }
}
