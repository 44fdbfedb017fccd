package ca.gc.cra.scribe.infrastructure.transcribe;

import ca.gc.cra.scribe.application.port.TranscriptionEngine;
import ca.gc.cra.scribe.logging.Logs;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Runs a local whisper.cpp binary to transcribe one audio file.
 * <p><strong>Determinism:</strong> fixed model and language, temperature 0, a single thread, no timestamps and no
 * progress output. The binary is invoked with local files only.</p>
 * <p><strong>Pre-conversion:</strong> when an {@code ffmpeg} binary is configured, input is first converted to
 * 16 kHz mono PCM WAV in a private temporary directory.</p>
 * <p><strong>Thread-safety:</strong> Stateless per call; concurrent calls spawn independent processes.</p>
 *
 * @since 0.1.0
 */
public final class WhisperCppTranscriptionEngine implements TranscriptionEngine {
  private static final Logger log = LoggerFactory.getLogger(WhisperCppTranscriptionEngine.class);

  private final Path binary;
  private final Path model;
  private final String language;
  private final Path ffmpeg;
  private final Duration timeout;

  /**
   * Creates the engine.
   *
   * @param binary whisper.cpp executable
   * @param model model file
   * @param language spoken language code such as {@code en}
   * @param ffmpeg optional ffmpeg executable; {@code null} passes audio through unchanged
   * @param timeout bound for each process
   */
  public WhisperCppTranscriptionEngine(Path binary, Path model, String language, Path ffmpeg, Duration timeout) {
    this.binary = Objects.requireNonNull(binary, "binary");
    this.model = Objects.requireNonNull(model, "model");
    this.language = Objects.requireNonNull(language, "language");
    this.ffmpeg = ffmpeg;
    this.timeout = Objects.requireNonNull(timeout, "timeout");
  }

  @Override
  public String name() {
    return "whisper.cpp";
  }

  @Override
  public String model() {
    return model.getFileName().toString();
  }

  @Override
  public Optional<String> transcribe(Path audio) throws IOException, InterruptedException {
    Path scratch = Files.createTempDirectory("scribe-transcribe-");
    try {
      Path input = audio;
      if (ffmpeg != null) {
        input = scratch.resolve("input.wav");
        run(List.of(ffmpeg.toString(), "-nostdin", "-y", "-loglevel", "error", "-i", audio.toString(),
            "-ar", "16000", "-ac", "1", "-c:a", "pcm_s16le", input.toString()), scratch.resolve("ffmpeg.out"));
      }
      Path output = scratch.resolve("whisper.out");
      run(command(input), output);
      String text = Files.readAllLines(output, StandardCharsets.UTF_8).stream()
          .map(String::strip)
          .filter(line -> !line.isEmpty())
          .collect(Collectors.joining(" "));
      return text.isBlank() ? Optional.empty() : Optional.of(text);
    } finally {
      deleteScratch(scratch);
    }
  }

  List<String> command(Path input) {
    List<String> command = new ArrayList<>();
    command.add(binary.toString());
    command.add("-m");
    command.add(model.toString());
    command.add("-f");
    command.add(input.toString());
    command.add("-l");
    command.add(language);
    command.add("-nt");
    command.add("-np");
    command.add("-tp");
    command.add("0");
    command.add("-t");
    command.add("1");
    return command;
  }

  private void run(List<String> command, Path output) throws IOException, InterruptedException {
    ProcessBuilder builder = new ProcessBuilder(command)
        .redirectOutput(output.toFile())
        .redirectError(ProcessBuilder.Redirect.DISCARD)
        .redirectInput(ProcessBuilder.Redirect.from(nullDevice()));
    Process process = builder.start();
    try {
      if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
        throw new IOException(Path.of(command.get(0)).getFileName() + " timed out after " + timeout.toSeconds() + "s");
      }
      int exit = process.exitValue();
      if (exit != 0) {
        throw new IOException(Path.of(command.get(0)).getFileName() + " exited with status " + exit);
      }
    } finally {
      if (process.isAlive()) {
        process.destroyForcibly();
      }
    }
  }

  private static File nullDevice() {
    return new File(System.getProperty("os.name", "").startsWith("Windows") ? "NUL" : "/dev/null");
  }

  private static void deleteScratch(Path scratch) {
    try (Stream<Path> files = Files.list(scratch)) {
      for (Path file : files.toList()) {
        Files.deleteIfExists(file);
      }
      Files.deleteIfExists(scratch);
    } catch (IOException ex) {
      log.warn("Failed to delete transcription scratch {}", Logs.redactPath(scratch.toString()), ex);
    }
  }
}
