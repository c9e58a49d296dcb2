package ca.gc.cra.docket.api;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {
  @Test
  void parsesKeyValuePairs() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"projectId=42", " out = ./timeline "});
    assertEquals("42", map.get("projectId"));
    assertEquals("./timeline", map.get("out"));
  }

  @Test
  void lastValueWins() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"pageLimit=10", "pageLimit=20"});
    assertEquals("20", map.get("pageLimit"));
  }

  @Test
  void keepsEqualsInsideValue() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"otelResourceAttributes=team=docs,env=dev"});
    assertEquals("team=docs,env=dev", map.get("otelResourceAttributes"));
  }

  @Test
  void rejectsTokensWithoutValue() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"invalid", "key=value"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=value"}));
  }

  @Test
  void rejectsMalformedKeysAndControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"bad key=1"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"userId=a\u0007b"}));
  }

  @Test
  void nullArgsGiveEmptyMap() {
    assertTrue(CliArgsParser.toMap(null).isEmpty());
  }
}
