package ca.gc.cra.docket.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Writes user-facing CLI output to stdout in UTF-8; logging goes through SLF4J instead.
 *
 * @since 0.1.0
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;

  private CliPrinter() {
    // Utility
  }

  public static void println(String message) {
    PrintWriter writer = writer();
    writer.println(message);
    writer.flush();
  }

  /**
   * Prints a heading followed by one {@code label : value} row per entry, labels padded to the widest one.
   *
   * @param heading first line, printed as-is
   * @param rows labels and values in display order
   */
  public static void printSection(String heading, Map<String, String> rows) {
    PrintWriter writer = writer();
    writer.println(heading);
    int width = 1;
    for (String label : rows.keySet()) {
      width = Math.max(width, label.length());
    }
    for (Map.Entry<String, String> row : rows.entrySet()) {
      writer.printf(" %-" + width + "s : %s%n", row.getKey(), row.getValue());
    }
    writer.flush();
  }

  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  static void clearTestWriter() {
    override = null;
  }

  private static PrintWriter writer() {
    PrintWriter current = override;
    return current != null ? current : STDOUT;
  }
}
