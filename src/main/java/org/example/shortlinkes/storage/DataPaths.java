package org.example.shortlinkes.storage;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Default file-system locations, relative to the working directory.
 *
 * <ul>
 *   <li>{@link #DATA_DIR} – root data folder.
 *   <li>{@link #CONFIG_JSON} – registry configuration.
 *   <li>{@link #EVENTS_JOURNAL} – append-only event journal.
 * </ul>
 */
public final class DataPaths {
  private DataPaths() {}

  /** Root directory for data files: {@code data/}. */
  public static final Path DATA_DIR = Paths.get("data");

  /** Configuration file: {@code data/config.json}. */
  public static final Path CONFIG_JSON = DATA_DIR.resolve("config.json");

  /** Event journal, one JSON object per line: {@code data/events.jsonl}. */
  public static final Path EVENTS_JOURNAL = DATA_DIR.resolve("events.jsonl");
}
