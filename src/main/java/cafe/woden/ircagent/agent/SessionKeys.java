package cafe.woden.ircagent.agent;

import java.util.Objects;

/**
 * Agent session keys: {@code irc:<accountId>:<chatId>} for channels and
 * {@code irc:<accountId>:<senderId>} for direct messages.
 */
public final class SessionKeys {

  private SessionKeys() {}

  public static final String PREFIX = "irc";

  public static String forChat(String accountId, boolean group, String chatId, String senderId) {
    return of(accountId, group ? chatId : senderId);
  }

  public static String of(String accountId, String conversationId) {
    String acct = Objects.requireNonNull(accountId, "accountId").trim();
    String conv = Objects.requireNonNull(conversationId, "conversationId").trim();
    return PREFIX + ":" + acct + ":" + conv;
  }
}
