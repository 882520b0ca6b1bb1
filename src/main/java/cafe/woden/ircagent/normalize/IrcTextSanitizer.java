package cafe.woden.ircagent.normalize;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Strips mIRC formatting and control bytes from inbound lines and recognises CTCP wrappers.
 *
 * <p>All methods are pure.
 */
public final class IrcTextSanitizer {

  private IrcTextSanitizer() {}

  public static final int DEFAULT_MAX_CONTENT_LENGTH = 2_000;

  private static final char CTCP_DELIM = 0x01;

  // \x01COMMAND payload\x01 ; some clients omit the closing delimiter.
  private static final Pattern CTCP = Pattern.compile("^\\x01([A-Z]+)\\s*(.*?)\\x01?$", Pattern.DOTALL);

  // ^C colour codes with optional fg[,bg].
  private static final Pattern COLOR = Pattern.compile("\\x03(\\d{1,2}(,\\d{1,2})?)?");

  // Bold, italics, underline, reverse, reset, etc. CR/LF and TAB survive until trim.
  private static final Pattern CONTROL = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");

  public static SanitizedText sanitize(String raw) {
    if (raw == null || raw.isEmpty()) return SanitizedText.plain("");

    if (raw.charAt(0) == CTCP_DELIM) {
      Matcher m = CTCP.matcher(raw);
      if (m.matches()) {
        String command = m.group(1);
        String payload = m.group(2);
        if (SanitizedText.ACTION.equals(command)) {
          return new SanitizedText(strip(payload), true, command, payload);
        }
        return new SanitizedText("", true, command, payload);
      }
    }

    return SanitizedText.plain(strip(raw));
  }

  public static boolean isValidContent(String text) {
    return isValidContent(text, DEFAULT_MAX_CONTENT_LENGTH);
  }

  public static boolean isValidContent(String text, int maxLength) {
    if (text == null || text.isBlank()) return false;
    if (text.length() > maxLength) return false;
    return text.indexOf('\0') < 0;
  }

  static String strip(String text) {
    if (text == null) return "";
    String out = COLOR.matcher(text).replaceAll("");
    out = CONTROL.matcher(out).replaceAll("");
    return out.trim();
  }
}
