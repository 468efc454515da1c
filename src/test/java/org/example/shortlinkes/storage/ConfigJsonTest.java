package org.example.shortlinkes.storage;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.List;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

/**
 * Tests for {@link ConfigJson}.
 *
 * <p>All files are created under {@code @TempDir}; the default {@code data/config.json} location
 * is never touched.
 */
public class ConfigJsonTest {

  @TempDir Path tempDir;

  @Test
  @DisplayName("Missing file: defaults are returned and written to disk")
  void missing_file_creates_defaults() throws IOException {
    Path path = tempDir.resolve("data").resolve("config.json");

    ConfigJson cfg = ConfigJson.loadOrCreateDefault(path);

    assertTrue(Files.exists(path), "Default config must be written.");
    assertEquals(6, cfg.slugLength);
    assertEquals(16, cfg.maxSlugAttempts);
    assertEquals(List.of("http://", "https://"), cfg.allowedSchemes);
    assertTrue(cfg.validateChangedUrl);
    assertFalse(cfg.journalEnabled);

    String json = Files.readString(path, StandardCharsets.UTF_8);
    assertTrue(json.contains("\"slugLength\": 6"), json);
    assertFalse(json.contains("log"), "Static fields must not be serialized: " + json);
  }

  @Test
  @DisplayName("Existing file: values are read, missing fields keep defaults")
  void existing_file_is_read() throws IOException {
    Path path = tempDir.resolve("config.json");
    Files.writeString(
        path, "{ \"slugLength\": 9, \"validateChangedUrl\": false }", StandardCharsets.UTF_8);

    ConfigJson cfg = ConfigJson.loadOrCreateDefault(path);

    assertEquals(9, cfg.slugLength);
    assertFalse(cfg.validateChangedUrl);
    assertEquals(2048, cfg.maxUrlLength, "Absent field must keep its default.");
  }

  @Test
  @DisplayName("Malformed file: in-memory defaults, file left untouched")
  void malformed_file_falls_back() throws IOException {
    Path path = tempDir.resolve("config.json");
    Files.writeString(path, "{ broken", StandardCharsets.UTF_8);

    ConfigJson cfg = ConfigJson.loadOrCreateDefault(path);

    assertEquals(6, cfg.slugLength);
    assertEquals("{ broken", Files.readString(path, StandardCharsets.UTF_8));
  }

  @Test
  @DisplayName("save() then load round-trips custom values")
  void save_and_reload() throws IOException {
    Path path = tempDir.resolve("custom.json");
    ConfigJson cfg = new ConfigJson();
    cfg.journalEnabled = true;
    cfg.journalFile = tempDir.resolve("j.jsonl").toString();
    cfg.allowedSchemes = List.of("https://");
    cfg.save(path);

    ConfigJson loaded = ConfigJson.loadOrCreateDefault(path);
    assertTrue(loaded.journalEnabled);
    assertEquals(List.of("https://"), loaded.allowedSchemes);
    assertEquals(tempDir.resolve("j.jsonl"), loaded.journalPath());
  }

  @Test
  @DisplayName("validate() rejects unusable values")
  void validate_rejects() {
    assertDoesNotThrow(() -> new ConfigJson().validate());

    ConfigJson a = new ConfigJson();
    a.slugLength = 0;
    assertThrows(IllegalArgumentException.class, a::validate);

    ConfigJson b = new ConfigJson();
    b.maxSlugAttempts = 0;
    assertThrows(IllegalArgumentException.class, b::validate);

    ConfigJson c = new ConfigJson();
    c.allowedSchemes = List.of();
    assertThrows(IllegalArgumentException.class, c::validate);

    ConfigJson d = new ConfigJson();
    d.journalEnabled = true;
    d.journalFile = " ";
    assertThrows(IllegalArgumentException.class, d::validate);
  }
}
