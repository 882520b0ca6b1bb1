package cafe.woden.ircagent.irc;

/**
 * Structured events emitted by an {@link IrcTransport}.
 *
 * <p>Everything above the transport reasons about these values only; no PircBotX type leaks out
 * of the adapter classes.
 */
public sealed interface TransportEvent {

  /** Server accepted the handshake (RPL_WELCOME). The nick is the one the server assigned. */
  record Registered(String nick) implements TransportEvent {}

  record JoinedChannel(String channel, String nick) implements TransportEvent {}

  record PartedChannel(String channel, String nick) implements TransportEvent {}

  record Kicked(String channel, String nick, String by, String reason) implements TransportEvent {}

  record NickChanged(String oldNick, String newNick) implements TransportEvent {}

  /**
   * A PRIVMSG addressed to a channel or to us. CTCP payloads keep their {@code \u0001} wrapper.
   */
  record LineReceived(String sender, String target, String text) implements TransportEvent {}

  record SocketClosed(String reason) implements TransportEvent {}

  record SocketError(String message, Throwable cause) implements TransportEvent {}

  /** Numeric error that rejects our identity (bad password, SASL failure, banned). */
  record ProtocolError(int code, String reason) implements TransportEvent {}
}
