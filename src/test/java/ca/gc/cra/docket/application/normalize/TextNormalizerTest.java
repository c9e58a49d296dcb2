package ca.gc.cra.docket.application.normalize;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class TextNormalizerTest {

  @Test
  void normalizesLineEndingsAndWhitespace() {
    assertEquals("a b\nc\nd", TextNormalizer.normalize("  a \t  b\r\nc\rd \u0007 "));
    assertEquals("", TextNormalizer.normalize(null));
  }

  @Test
  void stripsHtmlAndDecodesEntities() {
    String html = "<p>Hello&nbsp;<b>there</b></p><div>Tom &amp; Jerry &lt;3</div><br/><br/><br/><br/>end";
    assertEquals("Hello there\nTom & Jerry <3\n\nend", TextNormalizer.stripHtml(html));
  }

  @Test
  void textAcceptsScalarsOnly() {
    assertEquals(Optional.of("x"), TextNormalizer.text("  x "));
    assertEquals(Optional.of("42"), TextNormalizer.text(42));
    assertEquals(Optional.of("true"), TextNormalizer.text(true));
    assertTrue(TextNormalizer.text("   ").isEmpty());
    assertTrue(TextNormalizer.text(Map.of("a", "b")).isEmpty());
    assertTrue(TextNormalizer.text(null).isEmpty());
  }
}
