package ca.gc.cra.scribe.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void loadMergesCommonAndCommandSections() throws IOException {
    Path yaml = tempDir.resolve("scribe.yaml");
    Files.writeString(yaml, """
        common:
          metricsExporter: none
          verbose: true
        extract:
          db: /data/chat.db
          verbose: false
          attachmentWorkers: 4
        inspect:
          db: /other/chat.db
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "extract").orElseThrow();

    assertEquals("none", map.get("metricsExporter"));
    assertEquals("/data/chat.db", map.get("db"));
    assertEquals("false", map.get("verbose"));
    assertEquals("4", map.get("attachmentWorkers"));
  }

  @Test
  void loadFlattensNestedMaps() throws IOException {
    Path yaml = tempDir.resolve("nested.yaml");
    Files.writeString(yaml, """
        extract:
          transcription:
            mode: fixed
            fixedText:
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "extract").orElseThrow();

    assertEquals("fixed", map.get("transcription.mode"));
    assertEquals("", map.get("transcription.fixedText"));
  }

  @Test
  void missingFileReturnsEmptyOptional() throws IOException {
    Optional<Map<String, String>> result = YamlConfigLoader.load(tempDir.resolve("absent.yaml"), "extract");

    assertFalse(result.isPresent());
  }

  @Test
  void emptyFileReturnsEmptyMap() throws IOException {
    Path yaml = Files.writeString(tempDir.resolve("empty.yaml"), "");

    assertTrue(YamlConfigLoader.load(yaml, "inspect").orElseThrow().isEmpty());
  }

  @Test
  void listsAreRejected() throws IOException {
    Path yaml = Files.writeString(tempDir.resolve("list.yaml"), """
        extract:
          db:
            - a
            - b
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "extract"));
  }

  @Test
  void malformedYamlIsRejected() throws IOException {
    Path yaml = Files.writeString(tempDir.resolve("bad.yaml"), "extract: [unclosed");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "extract"));
  }

  @Test
  void unknownCommandIsRejected() throws IOException {
    Path yaml = Files.writeString(tempDir.resolve("any.yaml"), "common: {}\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "common"));
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "capture"));
  }
}
