package cafe.woden.ircagent.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Read-only registry of configured IRC accounts.
 *
 * <p>Accounts are loaded once from {@code irc.accounts} at startup and never change for the
 * lifetime of the process. Iteration order follows the configuration order.
 */
@Component
public class AccountCatalog {

  /** Host-facing summary of an account. Never carries credentials. */
  public record AccountDescription(
      String accountId,
      boolean enabled,
      boolean configured,
      String server,
      String nickname
  ) {}

  private final LinkedHashMap<String, IrcAgentProperties.Account> byId = new LinkedHashMap<>();

  public AccountCatalog(IrcAgentProperties props) {
    if (props != null) {
      for (IrcAgentProperties.Account a : props.accounts()) {
        if (a == null) continue;
        if (byId.putIfAbsent(a.id(), a) != null) {
          throw new IllegalStateException("Duplicate account id: " + a.id());
        }
      }
    }
  }

  public Set<String> ids() {
    return Collections.unmodifiableSet(new LinkedHashSet<>(byId.keySet()));
  }

  public List<IrcAgentProperties.Account> accounts() {
    return List.copyOf(byId.values());
  }

  public Optional<IrcAgentProperties.Account> find(String accountId) {
    String id = Objects.toString(accountId, "").trim();
    if (id.isEmpty()) return Optional.empty();
    return Optional.ofNullable(byId.get(id));
  }

  public IrcAgentProperties.Account require(String accountId) {
    return find(accountId).orElseThrow(() -> new IllegalArgumentException("Unknown account id: " + accountId));
  }

  public boolean containsId(String accountId) {
    return find(accountId).isPresent();
  }

  /** First configured account, or {@value IrcAgentProperties#DEFAULT_ACCOUNT_ID} when there is none. */
  public String defaultAccountId() {
    return byId.keySet().stream().findFirst().orElse(IrcAgentProperties.DEFAULT_ACCOUNT_ID);
  }

  public boolean isConfigured(IrcAgentProperties.Account account) {
    return account != null && account.configured();
  }

  public Optional<IrcAgentProperties.Account> resolveByNickname(String nickname) {
    String nick = Objects.toString(nickname, "").trim().toLowerCase(Locale.ROOT);
    if (nick.isEmpty()) return Optional.empty();
    return byId.values().stream()
        .filter(a -> a.nickname().toLowerCase(Locale.ROOT).equals(nick))
        .findFirst();
  }

  public Optional<IrcAgentProperties.Account> resolveByServer(String server) {
    String host = Objects.toString(server, "").trim().toLowerCase(Locale.ROOT);
    if (host.isEmpty()) return Optional.empty();
    return byId.values().stream()
        .filter(a -> a.server().toLowerCase(Locale.ROOT).equals(host))
        .findFirst();
  }

  public Optional<AccountDescription> describe(String accountId) {
    return find(accountId).map(a -> new AccountDescription(
        a.id(),
        a.enabled(),
        a.configured(),
        a.server(),
        a.nickname()
    ));
  }
}
