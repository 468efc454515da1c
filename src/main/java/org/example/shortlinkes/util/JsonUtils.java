package org.example.shortlinkes.util;

import com.google.gson.*;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * JSON utilities for the registry.
 *
 * <p>Two {@link Gson} flavours share the same type adapters:
 *
 * <ul>
 *   <li>{@link #gson()} pretty-prints, for human-edited files such as the configuration;
 *   <li>{@link #compactGson()} writes everything on one line, for the append-only event journal
 *       where one line holds exactly one event.
 * </ul>
 *
 * <p>{@link LocalDateTime} values are encoded as ISO-8601 strings like {@code
 * 2026-10-19T12:34:56.789}. Both instances are thread-safe and can be shared.
 */
public final class JsonUtils {
  private JsonUtils() {}

  private static final DateTimeFormatter ISO = DateTimeFormatter.ISO_LOCAL_DATE_TIME;

  private static final JsonSerializer<LocalDateTime> LDT_SER =
      (src, t, ctx) -> new JsonPrimitive(ISO.format(src));

  private static final JsonDeserializer<LocalDateTime> LDT_DES =
      (json, t, ctx) -> LocalDateTime.parse(json.getAsString(), ISO);

  private static final Gson PRETTY = builder().setPrettyPrinting().create();

  private static final Gson COMPACT = builder().create();

  /**
   * @return shared pretty-printing {@link Gson}
   */
  public static Gson gson() {
    return PRETTY;
  }

  /**
   * @return shared single-line {@link Gson}; never emits line breaks inside a value
   */
  public static Gson compactGson() {
    return COMPACT;
  }

  private static GsonBuilder builder() {
    return new GsonBuilder()
        .disableHtmlEscaping()
        .registerTypeAdapter(LocalDateTime.class, LDT_SER)
        .registerTypeAdapter(LocalDateTime.class, LDT_DES);
  }
}
