package org.example.shortlinkes.service;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import org.example.shortlinkes.model.ShortLink;
import org.example.shortlinkes.model.ShortenerError;
import org.example.shortlinkes.model.ShortenerException;
import org.example.shortlinkes.model.Slug;
import org.example.shortlinkes.model.Stats;
import org.example.shortlinkes.model.Url;
import org.example.shortlinkes.storage.ConfigJson;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

/**
 * End-to-end tests for {@link UrlShortenerService}.
 *
 * <p><b>Isolation:</b> journal files live under {@code @TempDir}; in-memory services share nothing.
 */
public class UrlShortenerServiceTest {

  @TempDir Path tempDir;

  private ConfigJson journaled() {
    ConfigJson cfg = new ConfigJson();
    cfg.journalEnabled = true;
    cfg.journalFile = tempDir.resolve("data").resolve("events.jsonl").toString();
    return cfg;
  }

  @Test
  @DisplayName("Create, three redirects, stats: {short, https://example.com, 3}")
  void three_redirects_scenario() throws ShortenerException {
    UrlShortenerService svc = UrlShortenerService.inMemory();
    Slug s = Slug.of("short");
    Url target = Url.of("https://example.com");

    svc.createShortLink(target, s);
    svc.redirect(s);
    svc.redirect(s);
    svc.redirect(s);

    assertEquals(new Stats(new ShortLink(s, target), 3), svc.getStats(s));
    assertEquals(4, svc.eventCount());
    assertTrue(svc.verifyProjection());
  }

  @Test
  @DisplayName("Default in-memory service generates slugs of the configured length")
  void in_memory_defaults() throws ShortenerException {
    UrlShortenerService svc = UrlShortenerService.inMemory();
    ShortLink link = svc.createShortLink(Url.of("https://example.com"));
    assertEquals(6, link.slug().value().length());
    assertEquals(1, svc.events().size());
  }

  @Test
  @DisplayName("Journaled service recovers links and counters after a restart")
  void journal_restart_recovery() throws ShortenerException {
    Slug s = Slug.of("keep");
    UrlShortenerService first = UrlShortenerService.fromConfig(journaled());
    first.createShortLink(Url.of("https://example.com"), s);
    first.redirect(s);
    first.changeShortLink(s, Url.of("https://example.org"));
    first.redirect(s);

    UrlShortenerService second = UrlShortenerService.fromConfig(journaled());
    assertEquals(4, second.eventCount());
    assertEquals(first.getStats(s), second.getStats(s));
    assertEquals(Url.of("https://example.org"), second.getStats(s).link().url());

    ShortenerException ex =
        assertThrows(
            ShortenerException.class,
            () -> second.createShortLink(Url.of("https://x.example"), s));
    assertEquals(ShortenerError.SLUG_ALREADY_IN_USE, ex.error());

    second.redirect(s);
    assertEquals(3, second.getStats(s).redirects());
    assertTrue(second.verifyProjection());
  }

  @Test
  @DisplayName("Configured schemes restrict accepted URLs")
  void configured_schemes() throws ShortenerException {
    ConfigJson cfg = new ConfigJson();
    cfg.allowedSchemes = java.util.List.of("https://");
    UrlShortenerService svc = UrlShortenerService.fromConfig(cfg);

    assertEquals(
        ShortenerError.INVALID_URL,
        assertThrows(
                ShortenerException.class, () -> svc.createShortLink(Url.of("http://example.com")))
            .error());
    assertNotNull(svc.createShortLink(Url.of("https://example.com")));
  }

  @Test
  @DisplayName("Invalid configuration is rejected before anything is built")
  void invalid_config() {
    ConfigJson cfg = new ConfigJson();
    cfg.slugLength = 0;
    assertThrows(IllegalArgumentException.class, () -> UrlShortenerService.fromConfig(cfg));
  }

  @Test
  @DisplayName("Command and query views share one registry")
  void split_handlers_share_state() throws ShortenerException {
    UrlShortenerService svc = UrlShortenerService.inMemory();
    CommandHandler commands = svc.commands();
    QueryHandler queries = svc.queries();

    commands.createShortLink(Url.of("https://example.com"), Slug.of("split"));
    commands.redirect(Slug.of("split"));

    assertEquals(1, queries.getStats(Slug.of("split")).redirects());
  }
}
