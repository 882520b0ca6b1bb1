package cafe.woden.ircagent.normalize;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class IrcTextSanitizerTest {

  @Test
  void actionPayloadBecomesCleanText() {
    SanitizedText s = IrcTextSanitizer.sanitize("\u0001ACTION waves hello\u0001");

    assertTrue(s.outOfBand());
    assertTrue(s.isEmote());
    assertFalse(s.isDroppedCommand());
    assertEquals("ACTION", s.command());
    assertEquals("waves hello", s.cleanText());
  }

  @Test
  void actionWithoutClosingDelimiterIsStillRecognised() {
    SanitizedText s = IrcTextSanitizer.sanitize("\u0001ACTION shrugs");

    assertTrue(s.isEmote());
    assertEquals("shrugs", s.cleanText());
  }

  @Test
  void otherCtcpCommandsHaveEmptyCleanText() {
    SanitizedText version = IrcTextSanitizer.sanitize("\u0001VERSION\u0001");
    SanitizedText ping = IrcTextSanitizer.sanitize("\u0001PING 12345\u0001");

    assertTrue(version.isDroppedCommand());
    assertEquals("", version.cleanText());
    assertEquals("VERSION", version.command());

    assertTrue(ping.isDroppedCommand());
    assertEquals("", ping.cleanText());
    assertEquals("12345", ping.payload());
  }

  @Test
  void stripsColourAndFormattingCodes() {
    SanitizedText s = IrcTextSanitizer.sanitize("\u000304,01red\u0003 and \u0002bold\u0002 \u001Funder\u000F");

    assertFalse(s.outOfBand());
    assertNull(s.command());
    assertEquals("red and bold under", s.cleanText());
  }

  @Test
  void trimsSurroundingWhitespace() {
    assertEquals("hello", IrcTextSanitizer.sanitize("   hello \t").cleanText());
  }

  @Test
  void nullAndEmptyInputGiveEmptyPlainText() {
    assertEquals("", IrcTextSanitizer.sanitize(null).cleanText());
    assertFalse(IrcTextSanitizer.sanitize("").outOfBand());
  }

  @Test
  void contentValidity() {
    assertTrue(IrcTextSanitizer.isValidContent("hi"));
    assertFalse(IrcTextSanitizer.isValidContent(null));
    assertFalse(IrcTextSanitizer.isValidContent("   "));
    assertFalse(IrcTextSanitizer.isValidContent("a\0b"));
    assertTrue(IrcTextSanitizer.isValidContent("x".repeat(2000)));
    assertFalse(IrcTextSanitizer.isValidContent("x".repeat(2001)));
    assertFalse(IrcTextSanitizer.isValidContent("abcdef", 5));
  }
}
