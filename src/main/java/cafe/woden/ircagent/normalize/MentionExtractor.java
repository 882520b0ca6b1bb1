package cafe.woden.ircagent.normalize;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * Detects whether a line addresses the bot by nickname and strips the address from the text.
 *
 * <p>Recognised forms: a leading {@code @nick}, {@code nick:} or {@code nick,}; and an
 * {@code @nick} token anywhere. Matching is case-insensitive.
 */
public final class MentionExtractor {

  private MentionExtractor() {}

  @ValueObject
  public record Mention(boolean mentioned, String cleanText) {}

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  // Nicknames may end in []\`^{|}, so \b is not a usable end-of-nick boundary.
  private static final String NICK_END = "(?![A-Za-z0-9\\[\\]\\\\`_^{|}-])";

  public static Mention extract(String text, String nickname) {
    String input = Objects.toString(text, "");
    String nick = Objects.toString(nickname, "").trim();
    if (nick.isEmpty()) return new Mention(false, collapse(input));

    String q = Pattern.quote(nick);
    Pattern prefix = Pattern.compile("^\\s*(?:@" + q + NICK_END + "[,:]?|" + q + "[,:])\\s*", Pattern.CASE_INSENSITIVE);
    Pattern anywhere = Pattern.compile("(^|\\s)@" + q + NICK_END, Pattern.CASE_INSENSITIVE);

    boolean mentioned = false;
    String out = input;

    Matcher pm = prefix.matcher(out);
    if (pm.find()) {
      mentioned = true;
      out = out.substring(pm.end());
    }

    Matcher am = anywhere.matcher(out);
    if (am.find()) {
      mentioned = true;
      out = am.replaceAll("$1");
    }

    return new Mention(mentioned, collapse(out));
  }

  static String collapse(String text) {
    return WHITESPACE.matcher(text).replaceAll(" ").strip();
  }
}
