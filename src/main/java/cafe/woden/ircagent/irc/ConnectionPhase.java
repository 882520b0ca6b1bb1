package cafe.woden.ircagent.irc;

public enum ConnectionPhase {
  IDLE,
  CONNECTING,
  REGISTERED,
  DISCONNECTED,
  TERMINATED
}
