package cafe.woden.ircagent.auth;

import org.jmolecules.ddd.annotation.ValueObject;

/**
 * Authorization decision. The reason is for logs only and is never shown to the sender.
 */
@ValueObject
public record AuthorizationResult(boolean authorized, String reason) {

  public static final String DMS_DISABLED = "DMs are disabled";
  public static final String NOT_PAIRED = "Not paired";
  public static final String CHANNEL_NOT_CONFIGURED = "Channel not configured";
  public static final String NOT_IN_ALLOWLIST = "Not in allowlist";
  public static final String IN_DENYLIST = "In denylist";
  public static final String UNKNOWN_POLICY = "Unknown policy";

  private static final AuthorizationResult ALLOW = new AuthorizationResult(true, null);

  public static AuthorizationResult allow() {
    return ALLOW;
  }

  public static AuthorizationResult deny(String reason) {
    return new AuthorizationResult(false, reason);
  }
}
