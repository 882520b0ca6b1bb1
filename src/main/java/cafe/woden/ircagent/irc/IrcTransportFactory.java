package cafe.woden.ircagent.irc;

@FunctionalInterface
public interface IrcTransportFactory {
  IrcTransport create(String accountId);
}
