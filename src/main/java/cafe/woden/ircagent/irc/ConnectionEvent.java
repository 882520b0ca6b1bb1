package cafe.woden.ircagent.irc;

import java.time.Instant;

/**
 * Lifecycle notifications published by {@link IrcConnection#lifecycle()}.
 */
public sealed interface ConnectionEvent {

  String accountId();

  Instant at();

  record Connecting(String accountId, Instant at, String server, int port, String nick) implements ConnectionEvent {}

  record Registered(String accountId, Instant at, String nick) implements ConnectionEvent {}

  record Disconnected(String accountId, Instant at, String reason) implements ConnectionEvent {}

  record Reconnecting(String accountId, Instant at, long attempt, long delayMs, String reason)
      implements ConnectionEvent {}

  record Error(String accountId, Instant at, String message, Throwable cause) implements ConnectionEvent {}

  /** Fatal means automatic recovery has given up; non-fatal is an explicit stop. */
  record Terminated(String accountId, Instant at, String reason, boolean fatal) implements ConnectionEvent {}
}
