package cafe.woden.ircagent.normalize;

import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * Result of {@link IrcTextSanitizer#sanitize(String)}.
 *
 * @param cleanText text with control and colour codes removed; empty for dropped CTCP requests
 * @param outOfBand true when the raw line was a CTCP-wrapped command
 * @param command CTCP command token (upper-case), or null
 * @param payload CTCP argument text, or null
 */
@ValueObject
public record SanitizedText(String cleanText, boolean outOfBand, String command, String payload) {

  public static final String ACTION = "ACTION";

  public SanitizedText {
    cleanText = Objects.toString(cleanText, "");
  }

  static SanitizedText plain(String cleanText) {
    return new SanitizedText(cleanText, false, null, null);
  }

  public boolean isEmote() {
    return outOfBand && ACTION.equals(command);
  }

  /** CTCP requests other than ACTION must never reach the agent. */
  public boolean isDroppedCommand() {
    return outOfBand && !isEmote();
  }
}
