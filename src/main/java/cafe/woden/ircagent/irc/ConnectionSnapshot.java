package cafe.woden.ircagent.irc;

import java.util.Set;
import org.jmolecules.ddd.annotation.ValueObject;

/** Immutable view of a connection's state at one instant. */
@ValueObject
public record ConnectionSnapshot(
    ConnectionPhase phase,
    boolean connected,
    boolean registered,
    String currentNickname,
    Set<String> joinedChannels,
    String lastError,
    int reconnectAttempts
) {
  public ConnectionSnapshot {
    joinedChannels = Set.copyOf(joinedChannels);
  }

  public boolean ready() {
    return connected && registered;
  }
}
