package ca.gc.cra.docket.api;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class CliPrinterTest {

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void sectionPadsLabelsToWidest() {
    StringWriter buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
    Map<String, String> rows = new LinkedHashMap<>();
    rows.put("Project", "7");
    rows.put("Duplicates", "2");

    CliPrinter.printSection("Summary", rows);

    assertEquals(List.of("Summary", " Project    : 7", " Duplicates : 2"), buffer.toString().lines().toList());
  }
}
