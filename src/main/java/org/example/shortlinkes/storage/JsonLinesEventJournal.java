package org.example.shortlinkes.storage;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.example.shortlinkes.model.Event;
import org.example.shortlinkes.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link EventJournal} storing one JSON object per line (see {@link JournalEntry}).
 *
 * <p>Lines are only ever added at the end of the file; existing lines are never rewritten. Parent
 * directories are created on demand. A missing file reads as an empty history.
 *
 * <p>Reading is strict: sequence numbers must start at 1 and increase by one per line, and every
 * line must decode into an event. Anything else is reported as {@link IOException} with the
 * offending line number. Blank lines are skipped.
 *
 * <p>A failed write truncates the file back to its previous length, so a retry with the same
 * sequence number starts on a fresh line. If that truncation fails too, the incomplete last line
 * (no trailing newline) is cut off before the next write.
 *
 * <p><b>Thread-safety:</b> {@link #write(long, Event)} is {@code synchronized}; a journal file must
 * not be shared between processes.
 */
public final class JsonLinesEventJournal implements EventJournal {
  private static final Logger log = LoggerFactory.getLogger(JsonLinesEventJournal.class);
  private static final Gson GSON = JsonUtils.compactGson();

  private final Path file;
  private final Clock clock;
  private boolean tailChecked;

  public JsonLinesEventJournal(Path file) {
    this(file, Clock.systemDefaultZone());
  }

  /**
   * @param file journal location
   * @param clock source of {@link JournalEntry#recordedAt}
   */
  public JsonLinesEventJournal(Path file, Clock clock) {
    this.file = Objects.requireNonNull(file, "file");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public synchronized void write(long sequence, Event event) throws IOException {
    ensureParent(file);
    String line = GSON.toJson(JournalEntry.of(sequence, event, LocalDateTime.now(clock))) + "\n";
    ByteBuffer buf = ByteBuffer.wrap(line.getBytes(StandardCharsets.UTF_8));
    try (FileChannel ch =
        FileChannel.open(
            file,
            StandardOpenOption.CREATE,
            StandardOpenOption.READ,
            StandardOpenOption.WRITE)) {
      if (!tailChecked) {
        dropTornTail(ch);
        tailChecked = true;
      }
      long goodLength = ch.size();
      try {
        ch.position(goodLength);
        while (buf.hasRemaining()) ch.write(buf);
        ch.force(false);
      } catch (IOException e) {
        try {
          ch.truncate(goodLength);
        } catch (IOException truncateFailure) {
          tailChecked = false;
          e.addSuppressed(truncateFailure);
        }
        throw e;
      }
    }
  }

  /** Cuts the file back to just after its last newline if the final line is incomplete. */
  private void dropTornTail(FileChannel ch) throws IOException {
    long size = ch.size();
    long keep = size;
    ByteBuffer one = ByteBuffer.allocate(1);
    while (keep > 0) {
      one.clear();
      ch.read(one, keep - 1);
      if (one.get(0) == '\n') break;
      keep--;
    }
    if (keep < size) {
      ch.truncate(keep);
      log.warn("Dropped {} byte(s) of an incomplete last line in {}", size - keep, file);
    }
  }

  @Override
  public synchronized List<Event> readAll() throws IOException {
    List<Event> out = new ArrayList<>();
    if (!Files.exists(file)) return out;

    try (BufferedReader br = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      String line;
      int lineNo = 0;
      while ((line = br.readLine()) != null) {
        lineNo++;
        if (line.isBlank()) continue;
        JournalEntry entry;
        Event event;
        try {
          entry = GSON.fromJson(line, JournalEntry.class);
          if (entry == null) throw new IllegalArgumentException("empty entry");
          event = entry.toEvent();
        } catch (JsonParseException | IllegalArgumentException e) {
          throw new IOException("Corrupted journal " + file + " at line " + lineNo, e);
        }
        long expected = out.size() + 1L;
        if (entry.seq != expected) {
          throw new IOException(
              "Out-of-order journal "
                  + file
                  + " at line "
                  + lineNo
                  + ": expected seq "
                  + expected
                  + " but found "
                  + entry.seq);
        }
        out.add(event);
      }
    }
    return out;
  }

  private static void ensureParent(Path p) throws IOException {
    Path parent = p.toAbsolutePath().getParent();
    if (parent != null) Files.createDirectories(parent);
  }
}
