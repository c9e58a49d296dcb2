package ca.gc.cra.docket.domain.record;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.Instant;
import org.junit.jupiter.api.Test;

class CreatedAtTest {

  @Test
  void epochMinuteBucketsBySixtySeconds() {
    assertEquals(28_575_960L, CreatedAt.observed(Instant.parse("2024-05-01T10:00:59Z")).epochMinute());
    assertEquals(-1L, CreatedAt.observed(Instant.parse("1969-12-31T23:59:30Z")).epochMinute());
  }

  @Test
  void epochMinuteCoversTheWholeInstantRange() {
    assertEquals(Math.floorDiv(Instant.MAX.getEpochSecond(), 60L), CreatedAt.observed(Instant.MAX).epochMinute());
    assertEquals(Math.floorDiv(Instant.MIN.getEpochSecond(), 60L), CreatedAt.observed(Instant.MIN).epochMinute());
  }
}
