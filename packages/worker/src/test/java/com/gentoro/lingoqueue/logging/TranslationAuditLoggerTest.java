package com.gentoro.lingoqueue.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.gentoro.lingoqueue.model.TranslationResult;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TranslationAuditLoggerTest {

  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2026-10-17T10:00:00Z"), ZoneOffset.UTC);

  @TempDir Path dir;

  private static TranslationResult translated(String id, String text) {
    Map<String, String> translations = new LinkedHashMap<>();
    translations.put("en", "Hello, friend");
    translations.put("ja", "こんにちは");
    return new TranslationResult(id, text, text, translations, "ko", 0.5, false, null, 120, 100, 0);
  }

  private static TranslationResult filtered(String id) {
    return new TranslationResult(
        id, "ㅋㅋㅋ", "ㅋㅋㅋ", Map.of(), "unknown", 0.001, true, "Only consonants/vowels", 0, 0, 0);
  }

  private static List<String> lines(Path file) throws Exception {
    String content = Files.readString(file, StandardCharsets.UTF_8);
    assertEquals('\uFEFF', content.charAt(0));
    return List.of(content.substring(1).split("\r\n"));
  }

  @Test
  void writesDailyAndSplitFiles() throws Exception {
    TranslationAuditLogger audit = new TranslationAuditLogger(dir, 2, 10, 100, CLOCK);
    assertTrue(audit.record(translated("1", "안녕, 친구")));
    assertTrue(audit.record(filtered("2")));
    assertTrue(audit.record(translated("3", "반가워")));
    audit.close();

    List<String> all = lines(dir.resolve("translations_20261017_all.csv"));
    assertEquals(String.join(",", TranslationAuditLogger.HEADER), all.get(0));
    assertEquals(6, all.size());
    assertTrue(all.get(1).startsWith("2026-10-17T10:00:00Z,1,\"안녕, 친구\",\"안녕, 친구\",ko,en,\"Hello, friend\",500.0,120.0,100.0,0.0,false,"));
    assertTrue(all.get(2).contains(",ja,こんにちは,"));
    assertTrue(all.get(3).endsWith(",true,Only consonants/vowels"));

    assertEquals(3, lines(dir.resolve("translations_20261017_001.csv")).size());
    assertEquals(3, lines(dir.resolve("translations_20261017_002.csv")).size());
    assertFalse(Files.exists(dir.resolve("translations_20261017_003.csv")));
  }

  @Test
  void appendsToExistingFilesWithoutRepeatingHeader() throws Exception {
    TranslationAuditLogger first = new TranslationAuditLogger(dir, 100, 10, 100, CLOCK);
    first.record(filtered("1"));
    first.close();
    TranslationAuditLogger second = new TranslationAuditLogger(dir, 100, 10, 100, CLOCK);
    second.record(filtered("2"));
    second.close();

    assertEquals(3, lines(dir.resolve("translations_20261017_all.csv")).size());
    // a restarted logger opens a new split file
    assertTrue(Files.exists(dir.resolve("translations_20261017_002.csv")));
  }

  @Test
  void closedLoggerRejectsRecords() {
    TranslationAuditLogger audit = new TranslationAuditLogger(dir, 10, 10, 10, CLOCK);
    audit.close();

    assertFalse(audit.record(filtered("1")));
  }

  @Test
  void disabledByDefault() {
    assertNull(TranslationAuditLogger.create(new BaseConfiguration()));
  }
}
