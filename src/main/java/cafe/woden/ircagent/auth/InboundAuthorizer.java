package cafe.woden.ircagent.auth;

import cafe.woden.ircagent.config.IrcAgentProperties;
import cafe.woden.ircagent.normalize.IrcTargets;
import java.util.List;
import java.util.Objects;

/**
 * Decides whether an inbound line may reach the agent.
 *
 * <p>Stateless. Targets starting with {@code #} or {@code &} use the account's group policy;
 * everything else is a direct message. Unknown policies deny.
 */
public final class InboundAuthorizer {

  private InboundAuthorizer() {}

  public static final String WILDCARD = "*";

  public static AuthorizationResult authorize(String senderId, String target, IrcAgentProperties.Account account) {
    Objects.requireNonNull(account, "account");
    if (IrcTargets.isChannel(target)) {
      return authorizeGroup(senderId, target, account);
    }
    return authorizeDirect(senderId, account.dm());
  }

  public static AuthorizationResult authorizeDirect(String senderId, IrcAgentProperties.Account.Dm dm) {
    if (dm == null) return AuthorizationResult.deny(AuthorizationResult.UNKNOWN_POLICY);
    // Exhaustive on purpose: a new constant must be given a decision here.
    return switch (DmPolicy.parse(dm.policy())) {
      case DISABLED -> AuthorizationResult.deny(AuthorizationResult.DMS_DISABLED);
      case OPEN -> AuthorizationResult.allow();
      case PAIRING -> matches(dm.allowFrom(), senderId)
          ? AuthorizationResult.allow()
          : AuthorizationResult.deny(AuthorizationResult.NOT_PAIRED);
      case UNRECOGNIZED -> AuthorizationResult.deny(AuthorizationResult.UNKNOWN_POLICY);
    };
  }

  public static AuthorizationResult authorizeGroup(String senderId, String channel, IrcAgentProperties.Account account) {
    IrcAgentProperties.Account.Group group = account.group(channel);
    return switch (GroupPolicy.parse(account.groupPolicy())) {
      case ALL -> AuthorizationResult.allow();
      case ALLOWLIST -> {
        if (group == null) yield AuthorizationResult.deny(AuthorizationResult.CHANNEL_NOT_CONFIGURED);
        yield matches(group.users(), senderId)
            ? AuthorizationResult.allow()
            : AuthorizationResult.deny(AuthorizationResult.NOT_IN_ALLOWLIST);
      }
      case DENYLIST -> {
        // No entry means nothing is denied in that channel.
        if (group == null) yield AuthorizationResult.allow();
        yield matches(group.users(), senderId)
            ? AuthorizationResult.deny(AuthorizationResult.IN_DENYLIST)
            : AuthorizationResult.allow();
      }
      case UNRECOGNIZED -> AuthorizationResult.deny(AuthorizationResult.UNKNOWN_POLICY);
    };
  }

  /** Case-insensitive membership; a {@code *} entry matches everyone. Empty lists match nobody. */
  static boolean matches(List<String> entries, String senderId) {
    if (entries == null || entries.isEmpty()) return false;
    String sender = IrcTargets.normalizeTarget(senderId);
    for (String e : entries) {
      String entry = IrcTargets.normalizeTarget(e);
      if (WILDCARD.equals(entry)) return true;
      if (!sender.isEmpty() && entry.equals(sender)) return true;
    }
    return false;
  }
}
