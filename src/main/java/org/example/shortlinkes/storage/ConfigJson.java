package org.example.shortlinkes.storage;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.ArrayList;
import java.util.List;
import org.example.shortlinkes.util.JsonUtils;
import org.example.shortlinkes.util.UrlValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry configuration holder with load/save helpers.
 *
 * <p>All tunables of the short-link service live here and can be loaded from (or persisted to) a
 * pretty-printed JSON file, {@code data/config.json} by default. If the file is missing, defaults
 * are written to it; if it cannot be read or parsed, in-memory defaults are used and a warning is
 * logged.
 *
 * <p><b>Typical usage:</b>
 *
 * <pre>{@code
 * ConfigJson cfg = ConfigJson.loadOrCreateDefault();
 * UrlShortenerService service = UrlShortenerService.fromConfig(cfg);
 * }</pre>
 */
public class ConfigJson {
  private static final Logger log = LoggerFactory.getLogger(ConfigJson.class);

  /** Length of generated Base62 slugs. */
  public int slugLength = 6;

  /**
   * How many generated candidates are tried before giving up. Running out means the slug space is
   * too small for the registry and is treated as a fatal configuration error.
   */
  public int maxSlugAttempts = 16;

  /** Maximum accepted URL length (validation guard). */
  public int maxUrlLength = 2048;

  /** Scheme prefixes a URL must start with (case-insensitive). */
  public List<String> allowedSchemes = new ArrayList<>(UrlValidator.DEFAULT_SCHEMES);

  /**
   * When {@code true}, repointing a link applies the same URL policy as creation; when {@code
   * false}, any URL is accepted on change.
   */
  public boolean validateChangedUrl = true;

  /** Makes every appended event durable in {@link #journalFile} when {@code true}. */
  public boolean journalEnabled = false;

  /** Location of the event journal (used only when {@link #journalEnabled} is set). */
  public String journalFile = DataPaths.EVENTS_JOURNAL.toString();

  private static final Gson GSON = JsonUtils.gson();

  /**
   * Checks that the values make a usable configuration.
   *
   * @return this instance, for chaining
   * @throws IllegalArgumentException describing the first invalid field
   */
  public ConfigJson validate() {
    if (slugLength < 1) throw new IllegalArgumentException("slugLength must be >= 1");
    if (maxSlugAttempts < 1) throw new IllegalArgumentException("maxSlugAttempts must be >= 1");
    if (maxUrlLength < 1) throw new IllegalArgumentException("maxUrlLength must be >= 1");
    if (allowedSchemes == null || allowedSchemes.isEmpty()) {
      throw new IllegalArgumentException("allowedSchemes must not be empty");
    }
    if (journalEnabled && (journalFile == null || journalFile.isBlank())) {
      throw new IllegalArgumentException("journalFile is required when journalEnabled is set");
    }
    return this;
  }

  /**
   * @return {@link #journalFile} as a path
   */
  public Path journalPath() {
    return Paths.get(journalFile);
  }

  /**
   * Loads {@code data/config.json}, creating it with defaults if it does not exist.
   *
   * @return a non-null configuration
   */
  public static ConfigJson loadOrCreateDefault() {
    return loadOrCreateDefault(DataPaths.CONFIG_JSON);
  }

  /**
   * Loads configuration from {@code path}, creating the file with defaults if it does not exist.
   *
   * <p>Unreadable or malformed files fall back to in-memory defaults (the file is left untouched so
   * it can be fixed by hand). Fields missing from the file keep their defaults.
   *
   * @param path configuration file
   * @return a non-null configuration
   */
  public static ConfigJson loadOrCreateDefault(Path path) {
    try {
      ensureParentDir(path);
      if (Files.exists(path)) {
        try (BufferedReader br = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
          ConfigJson cfg = GSON.fromJson(br, ConfigJson.class);
          return (cfg != null) ? cfg : writeDefault(path);
        }
      } else {
        return writeDefault(path);
      }
    } catch (IOException | JsonParseException e) {
      log.warn("Failed to load {}, using in-memory defaults. Cause: {}", path, e.getMessage());
      return new ConfigJson();
    }
  }

  /**
   * Writes this configuration to {@code path} as pretty-printed JSON, replacing existing content.
   *
   * @param path destination
   * @throws IOException if the file cannot be written
   */
  public void save(Path path) throws IOException {
    ensureParentDir(path);
    try (BufferedWriter bw =
        Files.newBufferedWriter(
            path,
            StandardCharsets.UTF_8,
            StandardOpenOption.CREATE,
            StandardOpenOption.TRUNCATE_EXISTING,
            StandardOpenOption.WRITE)) {
      GSON.toJson(this, bw);
    }
  }

  private static ConfigJson writeDefault(Path path) throws IOException {
    ConfigJson def = new ConfigJson();
    def.save(path);
    log.info("Wrote default configuration to {}", path.toAbsolutePath());
    return def;
  }

  private static void ensureParentDir(Path p) throws IOException {
    Path parent = p.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
  }
}
