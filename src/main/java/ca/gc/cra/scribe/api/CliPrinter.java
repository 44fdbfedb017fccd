package ca.gc.cra.scribe.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * Console output helper for usage text, run summaries and problem documents.
 *
 * <p>Writes straight to the process file descriptors so CLI output never mixes with Logback's
 * stderr appender configuration. Summaries go to stdout, problem documents to stderr.</p>
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static final PrintWriter STDERR = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.err), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;
  private static volatile PrintWriter errorOverride;

  private CliPrinter() {
    // Utility
  }

  /**
   * Prints a single line to stdout.
   *
   * @param message line to emit
   */
  public static void println(String message) {
    writer().println(message);
  }

  /**
   * Prints zero or more lines to stdout.
   *
   * @param lines lines to emit
   */
  public static void printLines(String... lines) {
    if (lines == null) {
      return;
    }
    PrintWriter writer = writer();
    for (String line : lines) {
      writer.println(line);
    }
  }

  /**
   * Prints a single line to stderr.
   *
   * @param message line to emit
   */
  public static void printError(String message) {
    PrintWriter writer = errorOverride != null ? errorOverride : STDERR;
    writer.println(message);
    writer.flush();
  }

  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  static void setErrorWriterForTesting(PrintWriter writer) {
    errorOverride = writer;
  }

  static void clearTestWriter() {
    override = null;
    errorOverride = null;
  }

  private static PrintWriter writer() {
    return override != null ? override : STDOUT;
  }
}
