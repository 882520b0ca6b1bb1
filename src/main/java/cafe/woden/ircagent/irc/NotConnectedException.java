package cafe.woden.ircagent.irc;

/** A send was attempted while the connection was not both connected and registered. */
public class NotConnectedException extends RuntimeException {

  public NotConnectedException(String accountId) {
    super("IRC connection for account " + accountId + " is not connected and registered");
  }
}
