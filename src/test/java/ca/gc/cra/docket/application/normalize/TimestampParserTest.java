package ca.gc.cra.docket.application.normalize;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class TimestampParserTest {

  @Test
  void parsesEpochMillisAsNumberOrDigits() {
    Instant expected = Instant.ofEpochMilli(1_700_000_000_000L);
    assertEquals(Optional.of(expected), TimestampParser.parse(1_700_000_000_000L));
    assertEquals(Optional.of(expected), TimestampParser.parse(" 1700000000000 "));
  }

  @Test
  void rejectsNonPositiveEpochs() {
    assertTrue(TimestampParser.parse(0).isEmpty());
    assertTrue(TimestampParser.parse(-5L).isEmpty());
    assertTrue(TimestampParser.parse("0").isEmpty());
  }

  @Test
  void parsesIsoVariants() {
    Instant expected = Instant.parse("2024-03-01T12:30:00Z");
    assertEquals(Optional.of(expected), TimestampParser.parse("2024-03-01T12:30:00Z"));
    assertEquals(Optional.of(expected), TimestampParser.parse("2024-03-01T07:30:00-05:00"));
    assertEquals(Optional.of(expected), TimestampParser.parse("2024-03-01T12:30:00Z[UTC]"));
    assertEquals(Optional.of(expected), TimestampParser.parse("2024-03-01T12:30:00"));
    assertEquals(Optional.of(expected), TimestampParser.parse("2024-03-01 12:30:00"));
  }

  @Test
  void plainDateIsUtcStartOfDay() {
    assertEquals(Optional.of(Instant.parse("2024-03-01T00:00:00Z")), TimestampParser.parse("2024-03-01"));
  }

  @Test
  void unrecognizedValuesAreEmpty() {
    assertTrue(TimestampParser.parse("yesterday").isEmpty());
    assertTrue(TimestampParser.parse("").isEmpty());
    assertTrue(TimestampParser.parse(null).isEmpty());
    assertTrue(TimestampParser.parse(List.of()).isEmpty());
    assertTrue(TimestampParser.parse(Boolean.TRUE).isEmpty());
  }

  @Test
  void rejectsInstantsOutsideEpochMillis() {
    assertTrue(TimestampParser.parse("+999999999-12-31T00:00:00Z").isEmpty());
    assertTrue(TimestampParser.parse("-999999999-01-01").isEmpty());
  }
}
