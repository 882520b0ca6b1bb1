package cafe.woden.ircagent.config;

import cafe.woden.ircagent.normalize.IrcTargets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * IRC agent bridge configuration.
 *
 * <p>Supports multiple accounts via {@code irc.accounts}. Every account owns exactly one
 * connection; the {@code irc.client} section holds settings shared by all of them.
 */
@ConfigurationProperties(prefix = "irc")
public record IrcAgentProperties(Client client, Agent agent, List<Account> accounts) {

  public static final String DEFAULT_ACCOUNT_ID = "default";

  /**
   * Connection-wide behaviour shared by every account.
   *
   * <p>Example YAML:
   * <pre>
   * irc:
   *   client:
   *     reconnect:
   *       initial-delay-ms: 1000
   *       max-attempts: 10
   *     rate-limit:
   *       max-requests: 5
   *       window-ms: 60000
   * </pre>
   */
  public record Client(
      Reconnect reconnect,
      long registrationTimeoutMs,
      RateLimit rateLimit,
      Outbound outbound,
      Inbound inbound
  ) {
    public Client {
      if (reconnect == null) {
        reconnect = new Reconnect(true, 1_000, 300_000, 2.0, 0, 10);
      }
      if (registrationTimeoutMs <= 0) registrationTimeoutMs = 60_000;
      if (rateLimit == null) {
        rateLimit = new RateLimit(5, 60_000, 300_000, null);
      }
      if (outbound == null) {
        outbound = new Outbound(450, 500, 200);
      }
      if (inbound == null) {
        inbound = new Inbound(2_000);
      }
    }
  }

  public record Reconnect(
      boolean enabled,
      long initialDelayMs,
      long maxDelayMs,
      double multiplier,
      double jitterPct,
      int maxAttempts
  ) {
    public Reconnect {
      if (initialDelayMs <= 0) initialDelayMs = 1_000;
      if (maxDelayMs <= 0) maxDelayMs = 300_000;
      if (maxDelayMs < initialDelayMs) maxDelayMs = initialDelayMs;
      if (multiplier < 1.1) multiplier = 2.0;
      if (jitterPct < 0) jitterPct = 0;
      if (jitterPct > 0.75) jitterPct = 0.75;
      // There is always a ceiling; exhaustion needs an operator.
      if (maxAttempts <= 0) maxAttempts = 10;
    }
  }

  public record RateLimit(int maxRequests, long windowMs, long sweepIntervalMs, String notice) {
    public RateLimit {
      if (maxRequests <= 0) maxRequests = 5;
      if (windowMs <= 0) windowMs = 60_000;
      if (sweepIntervalMs <= 0) sweepIntervalMs = 300_000;
      if (notice == null || notice.isBlank()) {
        notice = "You're sending messages too quickly. Please wait a moment and try again.";
      }
    }
  }

  public record Outbound(int maxChunkLength, long chunkDelayMs, long messageDelayMs) {
    public Outbound {
      if (maxChunkLength <= 0) maxChunkLength = 450;
      if (chunkDelayMs < 0) chunkDelayMs = 500;
      if (messageDelayMs < 0) messageDelayMs = 200;
    }
  }

  public record Inbound(int maxContentLength) {
    public Inbound {
      if (maxContentLength <= 0) maxContentLength = 2_000;
    }
  }

  /** External agent process invoked for every accepted inbound message. */
  public record Agent(List<String> command, long timeoutMs, String failureNotice) {
    public Agent {
      if (command == null || command.isEmpty()) {
        command = List.of("openclaw", "agent");
      } else {
        command = List.copyOf(command);
      }
      if (timeoutMs <= 0) timeoutMs = 120_000;
      if (failureNotice == null || failureNotice.isBlank()) {
        failureNotice = "Sorry, something went wrong while handling your message (ref: %s).";
      }
    }
  }

  public record Account(
      String id,
      Boolean enabled,
      String server,
      Integer port,
      Boolean tls,
      String nickname,
      String username,
      String realname,
      Sasl sasl,
      String nickservPassword,
      boolean allowInsecureNickservAuth,
      List<String> channels,
      Dm dm,
      String groupPolicy,
      Map<String, Group> groups
  ) {
    public record Sasl(String username, String password) {
      public Sasl {
        if (username == null || username.isBlank() || password == null || password.isBlank()) {
          throw new IllegalArgumentException("irc.accounts[].sasl requires both username and password");
        }
      }

      @Override
      public String toString() {
        return "Sasl[username=" + username + ", password=****]";
      }
    }

    /** Direct-message policy. The policy string is kept verbatim and interpreted by the authorizer. */
    public record Dm(String policy, List<String> allowFrom) {
      public Dm {
        if (policy == null || policy.isBlank()) policy = "pairing";
        allowFrom = formatAllowFrom(allowFrom);
      }
    }

    public record Group(List<String> users) {
      public Group {
        users = (users == null) ? List.of("*") : formatAllowFrom(users);
      }
    }

    public Account {
      if (id == null || id.isBlank()) {
        throw new IllegalArgumentException("irc.accounts[].id is required");
      }
      id = id.trim();
      if (enabled == null) enabled = true;
      server = Objects.toString(server, "").trim();
      if (port == null) port = 6697;
      if (port <= 0 || port > 65535) {
        throw new IllegalArgumentException("irc.accounts[" + id + "].port is invalid: " + port);
      }
      if (tls == null) tls = true;
      if (nickname == null || nickname.isBlank()) nickname = "openclaw";
      nickname = nickname.trim();
      if (!IrcTargets.isValidNickname(nickname)) {
        throw new IllegalArgumentException("irc.accounts[" + id + "].nickname is invalid: " + nickname);
      }
      if (username == null || username.isBlank()) username = nickname;
      if (realname == null || realname.isBlank()) realname = "OpenClaw IRC Agent";
      if (nickservPassword != null && nickservPassword.isBlank()) nickservPassword = null;
      channels = (channels == null) ? List.of() : List.copyOf(channels);
      for (String channel : channels) {
        if (!IrcTargets.isValidChannel(channel)) {
          throw new IllegalArgumentException("irc.accounts[" + id + "].channels has an invalid channel: " + channel);
        }
      }
      if (dm == null) dm = new Dm("pairing", List.of());
      if (groupPolicy == null || groupPolicy.isBlank()) groupPolicy = "allowlist";
      groups = normalizeGroups(groups);
    }

    public boolean configured() {
      return !server.isBlank();
    }

    public boolean hasSasl() {
      return sasl != null;
    }

    public boolean hasNickservPassword() {
      return nickservPassword != null;
    }

    /** Case-insensitive lookup of a channel's group entry. */
    public Group group(String channel) {
      if (channel == null) return null;
      return groups.get(channel.trim().toLowerCase(Locale.ROOT));
    }

    @Override
    public String toString() {
      return "Account[id=" + id + ", server=" + server + ":" + port + ", tls=" + tls
          + ", nickname=" + nickname + ", enabled=" + enabled + "]";
    }

    private static Map<String, Group> normalizeGroups(Map<String, Group> raw) {
      if (raw == null || raw.isEmpty()) return Map.of();
      LinkedHashMap<String, Group> out = new LinkedHashMap<>();
      raw.forEach((key, group) -> {
        String k = Objects.toString(key, "").trim().toLowerCase(Locale.ROOT);
        if (k.isEmpty()) return;
        out.put(k, group == null ? new Group(null) : group);
      });
      return Map.copyOf(out);
    }
  }

  public IrcAgentProperties {
    if (client == null) {
      client = new Client(null, 0, null, null, null);
    }
    if (agent == null) {
      agent = new Agent(null, 0, null);
    }
    accounts = (accounts == null) ? List.of() : List.copyOf(accounts);
  }

  public Map<String, Account> byId() {
    return accounts.stream().collect(Collectors.toUnmodifiableMap(
        Account::id,
        Function.identity(),
        (a, b) -> {
          throw new IllegalStateException("Duplicate account id: " + a.id());
        }
    ));
  }

  /** Trims, drops blanks and lower-cases allow/deny list entries. */
  public static List<String> formatAllowFrom(List<String> entries) {
    if (entries == null) return List.of();
    return entries.stream()
        .map(e -> Objects.toString(e, "").trim())
        .filter(e -> !e.isEmpty())
        .map(e -> e.toLowerCase(Locale.ROOT))
        .collect(Collectors.toUnmodifiableList());
  }
}
