package cafe.woden.ircagent.auth;

import java.util.Locale;

/** How channel messages are admitted. */
public enum GroupPolicy {
  ALL,
  ALLOWLIST,
  DENYLIST,
  /** Any configured value we do not understand. Always denies. */
  UNRECOGNIZED;

  public static GroupPolicy parse(String raw) {
    if (raw == null) return UNRECOGNIZED;
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "all" -> ALL;
      case "allowlist" -> ALLOWLIST;
      case "denylist" -> DENYLIST;
      default -> UNRECOGNIZED;
    };
  }
}
