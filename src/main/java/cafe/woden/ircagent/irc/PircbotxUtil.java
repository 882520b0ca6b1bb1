package cafe.woden.ircagent.irc;

import java.util.Locale;
import java.util.Objects;
import org.pircbotx.User;

/**
 * Small, boring helpers used by the PircBotX adapter.
 */
final class PircbotxUtil {

  private PircbotxUtil() {}

  static final char CTCP_DELIM = 0x01;

  static String sanitizeNick(String nick) {
    String n = Objects.requireNonNull(nick, "nick").trim();
    if (n.isEmpty()) throw new IllegalArgumentException("nick is blank");
    if (n.contains("\r") || n.contains("\n"))
      throw new IllegalArgumentException("nick contains CR/LF");
    if (n.contains(" "))
      throw new IllegalArgumentException("nick contains spaces");
    return n;
  }

  static String sanitizeChannel(String channel) {
    String c = Objects.requireNonNull(channel, "channel").trim();
    if (c.isEmpty()) throw new IllegalArgumentException("channel is blank");
    if (c.contains("\r") || c.contains("\n"))
      throw new IllegalArgumentException("channel contains CR/LF");
    if (c.contains(" "))
      throw new IllegalArgumentException("channel contains spaces");
    if (!(c.startsWith("#") || c.startsWith("&")))
      throw new IllegalArgumentException("channel must start with # or & (got: " + c + ")");
    return c;
  }

  static String sanitizeTarget(String target) {
    String t = Objects.requireNonNull(target, "target").trim();
    return (t.startsWith("#") || t.startsWith("&")) ? sanitizeChannel(t) : sanitizeNick(t);
  }

  /** A PRIVMSG body must be a single line. */
  static String sanitizeMessage(String text) {
    String s = Objects.toString(text, "");
    if (s.indexOf('\r') >= 0 || s.indexOf('\n') >= 0)
      throw new IllegalArgumentException("message contains CR/LF");
    return s;
  }

  @FunctionalInterface
  interface ThrowingSupplier<T> {
    T get() throws Exception;
  }

  static String safeStr(ThrowingSupplier<String> s, String def) {
    try {
      String v = s.get();
      return v == null ? def : v;
    } catch (Exception ignored) {
      return def;
    }
  }

  static String nickOf(User user) {
    if (user == null) return "";
    return safeStr(user::getNick, "");
  }

  /** Re-wraps a CTCP request so the core sees exactly what was on the wire. */
  static String ctcpWrap(String command, String argument) {
    String cmd = Objects.toString(command, "").trim().toUpperCase(Locale.ROOT);
    String arg = Objects.toString(argument, "").trim();
    return CTCP_DELIM + (arg.isEmpty() ? cmd : cmd + " " + arg) + CTCP_DELIM;
  }

  /** CTCP command implied by a PircBotX event class, e.g. {@code VersionEvent -> VERSION}. */
  static String ctcpCommandFromEvent(Object event) {
    if (event == null) return "CTCP";
    String simple = event.getClass().getSimpleName();
    String cmd = simple.endsWith("Event") ? simple.substring(0, simple.length() - "Event".length()) : simple;
    return cmd.toUpperCase(Locale.ROOT);
  }
}
