package ca.gc.cra.relay.api;

import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * Console output of the {@code relay} commands. Help text and {@code check} plans go to stdout; usage hints
 * after a rejected command line go to stderr, next to the log lines explaining the rejection. Stdout of
 * {@code run} stays empty so it can sit at the end of a pipeline.
 */
final class CliPrinter {
  private static volatile PrintWriter capture;

  private CliPrinter() {
    // Utility
  }

  /**
   * Prints lines to stdout.
   *
   * @param lines lines to emit
   */
  static void out(String... lines) {
    emit(System.out, lines);
  }

  /**
   * Prints lines to stderr.
   *
   * @param lines lines to emit
   */
  static void err(String... lines) {
    emit(System.err, lines);
  }

  /** Redirects both streams into {@code writer} until {@link #clearTestWriter()}. */
  static void setWriterForTesting(PrintWriter writer) {
    capture = writer;
  }

  static void clearTestWriter() {
    capture = null;
  }

  private static void emit(PrintStream stream, String[] lines) {
    PrintWriter target = capture;
    if (target == null) {
      target = new PrintWriter(new OutputStreamWriter(stream, StandardCharsets.UTF_8));
    }
    for (String line : lines) {
      target.println(line);
    }
    target.flush();
  }
}
