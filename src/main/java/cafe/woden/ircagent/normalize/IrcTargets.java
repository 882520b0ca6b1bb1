package cafe.woden.ircagent.normalize;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Structural checks and normalisation for IRC nicknames and channel names.
 *
 * <p>These are deliberately strict subsets of what servers accept; anything that fails here is
 * either rejected at configuration load or never sent on the wire.
 */
public final class IrcTargets {

  private IrcTargets() {}

  public static final int MAX_NICKNAME_LENGTH = 16;
  public static final int MIN_CHANNEL_LENGTH = 2;
  public static final int MAX_CHANNEL_LENGTH = 50;

  // First char: letter or one of []\`_^{|}. Rest: alnum, that set, or '-'.
  private static final Pattern NICKNAME =
      Pattern.compile("^[a-zA-Z\\[\\]\\\\`_^{|}][a-zA-Z0-9\\[\\]\\\\`_^{|}-]*$");

  // Whitespace, comma and BEL are never legal inside a channel name.
  private static final Pattern CHANNEL_FORBIDDEN = Pattern.compile("[\\s,\\x07]");

  public static boolean isChannel(String target) {
    if (target == null) return false;
    String t = target.trim();
    return t.startsWith("#") || t.startsWith("&");
  }

  public static boolean isValidNickname(String nick) {
    if (nick == null || nick.isEmpty() || nick.length() > MAX_NICKNAME_LENGTH) return false;
    return NICKNAME.matcher(nick).matches();
  }

  public static boolean isValidChannel(String channel) {
    if (channel == null) return false;
    if (channel.length() < MIN_CHANNEL_LENGTH || channel.length() > MAX_CHANNEL_LENGTH) return false;
    if (!isChannel(channel)) return false;
    return !CHANNEL_FORBIDDEN.matcher(channel).find();
  }

  /** Trims and lower-cases; used as a map key for senders and groups. */
  public static String normalizeTarget(String target) {
    if (target == null) return "";
    return target.trim().toLowerCase(Locale.ROOT);
  }

  /**
   * Trims a delivery target. Channel names are case-insensitive on the wire and are lower-cased;
   * nicknames keep the case the user chose.
   */
  public static String formatTarget(String target) {
    if (target == null) return "";
    String t = target.trim();
    return isChannel(t) ? t.toLowerCase(Locale.ROOT) : t;
  }
}
