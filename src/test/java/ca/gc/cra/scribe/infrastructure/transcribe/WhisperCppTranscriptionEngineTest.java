package ca.gc.cra.scribe.infrastructure.transcribe;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

class WhisperCppTranscriptionEngineTest {
  @TempDir Path tempDir;

  @Test
  void commandPinsDeterministicFlags() {
    WhisperCppTranscriptionEngine engine = new WhisperCppTranscriptionEngine(
        Path.of("whisper"), Path.of("models", "ggml-base.en.bin"), "en", null, Duration.ofSeconds(5));

    List<String> command = engine.command(Path.of("in.wav"));

    assertEquals(List.of("whisper", "-m", Path.of("models", "ggml-base.en.bin").toString(), "-f", "in.wav",
        "-l", "en", "-nt", "-np", "-tp", "0", "-t", "1"), command);
    assertEquals("ggml-base.en.bin", engine.model());
    assertEquals("whisper.cpp", engine.name());
  }

  @Test
  @EnabledOnOs({OS.LINUX, OS.MAC})
  void joinsNonBlankOutputLines() throws Exception {
    Path binary = script("fake-whisper", "printf '  hello\\n\\n world  \\n'");
    WhisperCppTranscriptionEngine engine = new WhisperCppTranscriptionEngine(
        binary, tempDir.resolve("model.bin"), "en", null, Duration.ofSeconds(10));

    assertEquals(Optional.of("hello world"), engine.transcribe(tempDir.resolve("memo.wav")));
  }

  @Test
  @EnabledOnOs({OS.LINUX, OS.MAC})
  void emptyOutputYieldsNothing() throws Exception {
    Path binary = script("silent-whisper", "exit 0");
    WhisperCppTranscriptionEngine engine = new WhisperCppTranscriptionEngine(
        binary, tempDir.resolve("model.bin"), "en", null, Duration.ofSeconds(10));

    assertTrue(engine.transcribe(tempDir.resolve("memo.wav")).isEmpty());
  }

  @Test
  @EnabledOnOs({OS.LINUX, OS.MAC})
  void nonZeroExitFails() throws Exception {
    Path binary = script("broken-whisper", "exit 3");
    WhisperCppTranscriptionEngine engine = new WhisperCppTranscriptionEngine(
        binary, tempDir.resolve("model.bin"), "en", null, Duration.ofSeconds(10));

    IOException ex = assertThrows(IOException.class, () -> engine.transcribe(tempDir.resolve("memo.wav")));
    assertTrue(ex.getMessage().contains("exited with status 3"));
  }

  private Path script(String name, String body) throws IOException {
    Path script = tempDir.resolve(name);
    Files.writeString(script, "#!/bin/sh\n" + body + "\n", StandardCharsets.UTF_8);
    Files.setPosixFilePermissions(script, PosixFilePermissions.fromString("rwxr-xr-x"));
    return script;
  }
}
