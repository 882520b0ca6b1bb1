package cafe.woden.ircagent.outbound;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits reply text into PRIVMSG-sized pieces.
 *
 * <p>Prefers the last newline, then the last space, as long as it lies past 30% of the limit;
 * otherwise splits hard at the limit. Leading and inner whitespace is kept so indented content
 * survives; only trailing whitespace is trimmed off a split piece.
 */
public final class MessageChunker {

  private MessageChunker() {}

  public static final int DEFAULT_MAX_LENGTH = 450;

  private static final double BOUNDARY_THRESHOLD = 0.3;
  private static final Pattern LINE_BREAK = Pattern.compile("\\r\\n|\\n|\\r");

  public static List<String> chunk(String text) {
    return chunk(text, DEFAULT_MAX_LENGTH);
  }

  /** Text at or under the limit comes back as-is, untrimmed. */
  public static List<String> chunk(String text, int maxLength) {
    if (maxLength <= 0) throw new IllegalArgumentException("maxLength must be positive: " + maxLength);
    if (text == null || text.isEmpty()) return List.of();
    if (text.length() <= maxLength) return List.of(text);

    List<String> chunks = new ArrayList<>();
    String remaining = text;

    while (!remaining.isEmpty()) {
      if (remaining.length() <= maxLength) {
        String last = remaining.stripTrailing();
        if (!last.isEmpty()) chunks.add(last);
        break;
      }

      int split = findSplit(remaining, maxLength);

      String piece = remaining.substring(0, split).stripTrailing();
      if (!piece.isEmpty()) chunks.add(piece);

      // Drop the boundary character itself when it was a space or newline.
      char next = remaining.charAt(split);
      int skip = (next == ' ' || next == '\n') ? 1 : 0;
      remaining = remaining.substring(split + skip);
    }

    return chunks;
  }

  /**
   * Chunks a whole reply: splits on line breaks first, skips empty lines, chunks each line, and
   * drops any piece that is blank once trailing whitespace is removed.
   */
  public static List<String> chunkReply(String text, int maxLength) {
    if (text == null || text.isEmpty()) return List.of();
    List<String> out = new ArrayList<>();
    for (String line : LINE_BREAK.split(text, -1)) {
      if (line.isEmpty()) continue;
      for (String piece : chunk(line, maxLength)) {
        String trimmed = piece.stripTrailing();
        if (!trimmed.isEmpty()) out.add(trimmed);
      }
    }
    return out;
  }

  static int findSplit(String s, int maxLength) {
    double threshold = maxLength * BOUNDARY_THRESHOLD;

    int newline = s.lastIndexOf('\n', maxLength);
    if (newline > threshold) return newline;

    int space = s.lastIndexOf(' ', maxLength);
    if (space > threshold) return space;

    // Never cut a surrogate pair in half.
    if (maxLength > 1
        && Character.isHighSurrogate(s.charAt(maxLength - 1)) && Character.isLowSurrogate(s.charAt(maxLength))) {
      return maxLength - 1;
    }
    return maxLength;
  }
}
