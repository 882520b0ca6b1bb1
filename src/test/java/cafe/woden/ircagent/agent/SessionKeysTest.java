package cafe.woden.ircagent.agent;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class SessionKeysTest {

  @Test
  void groupsAreKeyedByChatDirectMessagesBySender() {
    assertEquals("irc:libera:#java", SessionKeys.forChat("libera", true, "#java", "alice"));
    assertEquals("irc:libera:alice", SessionKeys.forChat("libera", false, "alice", "alice"));
  }

  @Test
  void keysAreStableAcrossCalls() {
    assertEquals(SessionKeys.of("oftc", "bob"), SessionKeys.of(" oftc ", "bob "));
  }
}
