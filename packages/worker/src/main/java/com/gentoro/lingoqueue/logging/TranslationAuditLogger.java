package com.gentoro.lingoqueue.logging;

import com.gentoro.lingoqueue.model.TranslationResult;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.text.StringEscapeUtils;
import org.slf4j.Logger;

/**
 * Best-effort CSV audit trail of translated jobs.
 *
 * <p>{@link #record(TranslationResult)} never blocks: results are queued and written by a single
 * background thread in small batches. Each day gets a {@code translations_<date>_all.csv} file and
 * split files {@code translations_<date>_<NNN>.csv} of at most {@code recordsPerFile} rows. Files
 * are UTF-8 with a byte order mark so spreadsheet tools pick the right encoding. One row is written
 * per target language; filtered jobs produce a single row without target language.
 *
 * <p>Write failures are logged and the affected batch is dropped.
 */
public class TranslationAuditLogger implements AutoCloseable {
  private static final Logger log = LoggingService.getLogger(TranslationAuditLogger.class);

  static final List<String> HEADER =
      List.of(
          "timestamp",
          "job_id",
          "original_text",
          "preprocessed_text",
          "source_language",
          "target_language",
          "translated_text",
          "processing_time_ms",
          "translate_processing_time_ms",
          "translate_llm_time_ms",
          "translate_cache_hit_time_ms",
          "filtered",
          "filter_reason");

  private static final char BOM = '\uFEFF';
  private static final long FLUSH_IDLE_MS = 100;
  private static final DateTimeFormatter FILE_DATE = DateTimeFormatter.BASIC_ISO_DATE;

  private final Path directory;
  private final int recordsPerFile;
  private final int batchSize;
  private final Clock clock;
  private final BlockingQueue<Entry> queue;
  private final Thread writerThread;
  private volatile boolean running = true;

  private LocalDate currentDate;
  private int splitIndex;
  private int rowsInSplit;

  private record Entry(Instant timestamp, TranslationResult result) {}

  public TranslationAuditLogger(
      Path directory, int recordsPerFile, int batchSize, int capacity, Clock clock) {
    if (recordsPerFile < 1 || batchSize < 1 || capacity < 1) {
      throw new IllegalArgumentException("audit sizes must be positive");
    }
    this.directory = directory;
    this.recordsPerFile = recordsPerFile;
    this.batchSize = batchSize;
    this.clock = clock;
    this.queue = new ArrayBlockingQueue<>(capacity);
    this.writerThread = new Thread(this::writeLoop, "translation-audit");
    this.writerThread.setDaemon(true);
    this.writerThread.start();
    log.info("Translation audit enabled, writing CSV files to {}", directory.toAbsolutePath());
  }

  /** Creates the audit logger from {@code audit.*}, or returns {@code null} when disabled. */
  public static TranslationAuditLogger create(Configuration configuration) {
    if (!configuration.getBoolean("audit.enabled", false)) {
      return null;
    }
    return new TranslationAuditLogger(
        Path.of(configuration.getString("audit.directory", "logs")),
        configuration.getInt("audit.records-per-file", 100),
        configuration.getInt("audit.batch-size", 10),
        configuration.getInt("audit.queue-capacity", 1000),
        Clock.systemDefaultZone());
  }

  /** Queues a result for writing. Returns false when the queue is full or the logger is closed. */
  public boolean record(TranslationResult result) {
    if (!running) {
      return false;
    }
    boolean accepted = queue.offer(new Entry(clock.instant(), result));
    if (!accepted) {
      log.warn("Audit queue full, dropping record of job {}", result.id());
    }
    return accepted;
  }

  private void writeLoop() {
    List<Entry> batch = new ArrayList<>(batchSize);
    while (running || !queue.isEmpty()) {
      try {
        Entry first = queue.poll(FLUSH_IDLE_MS, TimeUnit.MILLISECONDS);
        if (first == null) {
          continue;
        }
        batch.add(first);
        queue.drainTo(batch, batchSize - 1);
        write(batch);
      } catch (InterruptedException e) {
        // close() interrupts only after running is cleared; drain what is left
        running = false;
        queue.drainTo(batch);
        write(batch);
      } finally {
        batch.clear();
      }
    }
  }

  private void write(List<Entry> batch) {
    if (batch.isEmpty()) {
      return;
    }
    try {
      Files.createDirectories(directory);
      LocalDate today = LocalDate.now(clock);
      if (!today.equals(currentDate)) {
        currentDate = today;
        splitIndex = countSplitFiles(today);
        rowsInSplit = recordsPerFile;
      }

      List<String> rows = new ArrayList<>();
      for (Entry entry : batch) {
        rows.addAll(toRows(entry));
      }

      try (BufferedWriter all = open(directory.resolve(fileName(today, "all")))) {
        for (String row : rows) {
          all.write(row);
        }
      }

      int written = 0;
      while (written < rows.size()) {
        if (rowsInSplit >= recordsPerFile) {
          splitIndex++;
          rowsInSplit = 0;
        }
        String suffix = String.format(Locale.ROOT, "%03d", splitIndex);
        try (BufferedWriter split = open(directory.resolve(fileName(today, suffix)))) {
          while (written < rows.size() && rowsInSplit < recordsPerFile) {
            split.write(rows.get(written++));
            rowsInSplit++;
          }
        }
      }
    } catch (IOException | RuntimeException e) {
      log.warn("Could not write {} audit record(s): {}", batch.size(), e.getMessage());
    }
  }

  private int countSplitFiles(LocalDate date) throws IOException {
    int count = 0;
    String glob = "translations_" + FILE_DATE.format(date) + "_[0-9][0-9][0-9].csv";
    try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, glob)) {
      for (Path ignored : files) {
        count++;
      }
    }
    return count;
  }

  private static String fileName(LocalDate date, String suffix) {
    return "translations_" + FILE_DATE.format(date) + "_" + suffix + ".csv";
  }

  private static BufferedWriter open(Path file) throws IOException {
    boolean isNew = !Files.exists(file);
    BufferedWriter writer =
        Files.newBufferedWriter(
            file, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    if (isNew) {
      writer.write(BOM);
      writer.write(csvLine(HEADER));
    }
    return writer;
  }

  private static List<String> toRows(Entry entry) {
    TranslationResult r = entry.result();
    List<String> rows = new ArrayList<>();
    if (r.translations().isEmpty()) {
      rows.add(row(entry.timestamp(), r, "", ""));
    } else {
      for (Map.Entry<String, String> t : r.translations().entrySet()) {
        rows.add(row(entry.timestamp(), r, t.getKey(), t.getValue()));
      }
    }
    return rows;
  }

  private static String row(Instant timestamp, TranslationResult r, String lang, String text) {
    return csvLine(
        List.of(
            timestamp.toString(),
            nullToEmpty(r.id()),
            nullToEmpty(r.originalText()),
            nullToEmpty(r.preprocessedText()),
            nullToEmpty(r.detectedLanguage()),
            lang,
            nullToEmpty(text),
            String.format(Locale.ROOT, "%.1f", r.processingTime() * 1000),
            String.format(Locale.ROOT, "%.1f", r.translateProcessingTimeMs()),
            String.format(Locale.ROOT, "%.1f", r.translateLlmTimeMs()),
            String.format(Locale.ROOT, "%.1f", r.translateCacheHitTimeMs()),
            Boolean.toString(r.filtered()),
            nullToEmpty(r.filterReason())));
  }

  private static String csvLine(List<String> fields) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < fields.size(); i++) {
      if (i > 0) sb.append(',');
      sb.append(StringEscapeUtils.escapeCsv(fields.get(i)));
    }
    return sb.append("\r\n").toString();
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }

  /** Stops accepting records, writes what is queued and stops the writer thread. */
  @Override
  public void close() {
    running = false;
    try {
      writerThread.join(TimeUnit.SECONDS.toMillis(5));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    if (writerThread.isAlive()) {
      writerThread.interrupt();
    }
  }
}
