package cafe.woden.ircagent.auth;

import java.util.Locale;

/** How direct messages are admitted. */
public enum DmPolicy {
  DISABLED,
  OPEN,
  PAIRING,
  /** Any configured value we do not understand. Always denies. */
  UNRECOGNIZED;

  public static DmPolicy parse(String raw) {
    if (raw == null) return UNRECOGNIZED;
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "disabled" -> DISABLED;
      case "open" -> OPEN;
      case "pairing" -> PAIRING;
      default -> UNRECOGNIZED;
    };
  }
}
