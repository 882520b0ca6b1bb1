package cafe.woden.ircagent.irc;

import cafe.woden.ircagent.config.IrcAgentProperties;
import java.util.Objects;

/**
 * Everything a transport needs to open a socket and perform the handshake.
 *
 * <p>Channel auto-join and NickServ are intentionally absent: the connection joins after
 * registration and owns the legacy auth policy.
 */
public record TransportOptions(
    String host,
    int port,
    boolean tls,
    String nickname,
    String username,
    String realname,
    String saslUsername,
    String saslPassword,
    long messageDelayMs
) {
  public TransportOptions {
    host = Objects.requireNonNull(host, "host").trim();
    if (host.isEmpty()) throw new IllegalArgumentException("host is blank");
    Objects.requireNonNull(nickname, "nickname");
  }

  public static TransportOptions from(IrcAgentProperties.Account account, IrcAgentProperties.Outbound outbound) {
    IrcAgentProperties.Account.Sasl sasl = account.sasl();
    return new TransportOptions(
        account.server(),
        account.port(),
        account.tls(),
        account.nickname(),
        account.username(),
        account.realname(),
        sasl == null ? null : sasl.username(),
        sasl == null ? null : sasl.password(),
        outbound.messageDelayMs()
    );
  }

  public boolean hasSasl() {
    return saslUsername != null && saslPassword != null;
  }

  @Override
  public String toString() {
    return "TransportOptions[" + host + ":" + port + ", tls=" + tls + ", nick=" + nickname
        + ", sasl=" + hasSasl() + "]";
  }
}
