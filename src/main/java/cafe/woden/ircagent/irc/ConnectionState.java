package cafe.woden.ircagent.irc;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Mutable connection state for a single account.
 *
 * <p>Package-private mutators: only {@link IrcConnection} changes this, always while holding its
 * own monitor. Everyone else sees {@link ConnectionSnapshot}s.
 */
final class ConnectionState {

  private ConnectionPhase phase = ConnectionPhase.IDLE;
  private boolean connected;
  private boolean registered;
  private String currentNickname;
  private final Set<String> joinedChannels = new LinkedHashSet<>();
  private String lastError;
  private int reconnectAttempts;

  ConnectionPhase phase() {
    return phase;
  }

  void phase(ConnectionPhase next) {
    this.phase = next;
  }

  boolean ready() {
    return connected && registered;
  }

  String currentNickname() {
    return currentNickname;
  }

  void markRegistered(String nick) {
    connected = true;
    registered = true;
    currentNickname = nick;
    reconnectAttempts = 0;
    lastError = null;
    phase = ConnectionPhase.REGISTERED;
  }

  void nickChanged(String nick) {
    currentNickname = nick;
  }

  void joined(String channel) {
    joinedChannels.add(key(channel));
  }

  void left(String channel) {
    joinedChannels.remove(key(channel));
  }

  void lastError(String error) {
    lastError = error;
  }

  int incrementReconnectAttempts() {
    return ++reconnectAttempts;
  }

  void resetReconnectAttempts() {
    reconnectAttempts = 0;
  }

  /** Applied on every disconnect. Nickname, attempts and last error survive for diagnostics. */
  void resetOnDisconnect() {
    connected = false;
    registered = false;
    joinedChannels.clear();
  }

  ConnectionSnapshot snapshot() {
    return new ConnectionSnapshot(phase, connected, registered, currentNickname, joinedChannels, lastError, reconnectAttempts);
  }

  private static String key(String channel) {
    return channel == null ? "" : channel.trim().toLowerCase(Locale.ROOT);
  }
}
