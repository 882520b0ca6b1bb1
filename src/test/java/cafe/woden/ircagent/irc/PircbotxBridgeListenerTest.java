package cafe.woden.ircagent.irc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.pircbotx.Channel;
import org.pircbotx.PircBotX;
import org.pircbotx.User;
import org.pircbotx.hooks.events.ActionEvent;
import org.pircbotx.hooks.events.DisconnectEvent;
import org.pircbotx.hooks.events.MessageEvent;
import org.pircbotx.hooks.events.PrivateMessageEvent;
import org.pircbotx.hooks.events.ServerResponseEvent;

class PircbotxBridgeListenerTest {

  private final List<TransportEvent> events = new ArrayList<>();
  private final List<String> closes = new ArrayList<>();
  private final PircbotxBridgeListener listener = new PircbotxBridgeListener("libera", events::add, closes::add);

  private static User user(String nick) {
    User u = mock(User.class);
    when(u.getNick()).thenReturn(nick);
    return u;
  }

  private static Channel channel(String name) {
    Channel c = mock(Channel.class);
    when(c.getName()).thenReturn(name);
    return c;
  }

  private static PircBotX bot(String nick) {
    PircBotX b = mock(PircBotX.class);
    when(b.getNick()).thenReturn(nick);
    return b;
  }

  @Test
  void channelMessageBecomesLineReceived() {
    MessageEvent ev = mock(MessageEvent.class);
    User alice = user("alice");
    Channel java = channel("#java");
    when(ev.getUser()).thenReturn(alice);
    when(ev.getChannel()).thenReturn(java);
    when(ev.getMessage()).thenReturn("openclaw: hi");

    listener.onMessage(ev);

    assertThat(events).containsExactly(new TransportEvent.LineReceived("alice", "#java", "openclaw: hi"));
  }

  @Test
  void privateMessageTargetsOurNick() {
    PrivateMessageEvent ev = mock(PrivateMessageEvent.class);
    User alice = user("alice");
    PircBotX bot = bot("openclaw");
    when(ev.getUser()).thenReturn(alice);
    when(ev.getBot()).thenReturn(bot);
    when(ev.getMessage()).thenReturn("hello");

    listener.onPrivateMessage(ev);

    assertThat(events).containsExactly(new TransportEvent.LineReceived("alice", "openclaw", "hello"));
  }

  @Test
  void actionKeepsItsCtcpWrapper() {
    ActionEvent ev = mock(ActionEvent.class);
    User alice = user("alice");
    Channel java = channel("#java");
    when(ev.getUser()).thenReturn(alice);
    when(ev.getChannel()).thenReturn(java);
    when(ev.getAction()).thenReturn("waves");

    listener.onAction(ev);

    assertThat(events).containsExactly(new TransportEvent.LineReceived("alice", "#java", "\u0001ACTION waves\u0001"));
  }

  @Test
  void disconnectReportsTheReason() {
    DisconnectEvent ev = mock(DisconnectEvent.class);
    when(ev.getDisconnectException()).thenReturn(new IOException("Connection reset"));

    listener.onDisconnect(ev);

    assertThat(closes).containsExactly("Connection reset");
    assertThat(events).isEmpty();
  }

  @Test
  void identityRejectionNumericsBecomeProtocolErrors() {
    ServerResponseEvent ev = mock(ServerResponseEvent.class);
    when(ev.getCode()).thenReturn(904);
    when(ev.getRawLine()).thenReturn(":irc.example.net 904 openclaw :SASL authentication failed");

    listener.onServerResponse(ev);

    assertThat(events).containsExactly(new TransportEvent.ProtocolError(904, "SASL authentication failed"));
  }

  @Test
  void otherNumericsAreIgnored() {
    ServerResponseEvent ev = mock(ServerResponseEvent.class);
    when(ev.getCode()).thenReturn(372);

    listener.onServerResponse(ev);

    assertThat(events).isEmpty();
  }

  @Test
  void rejectionNumericSet() {
    for (int code : new int[] {464, 465, 904, 905, 906, 907}) {
      assertTrue(PircbotxBridgeListener.isIdentityRejectedNumeric(code), "code " + code);
    }
    assertFalse(PircbotxBridgeListener.isIdentityRejectedNumeric(433));
  }

  @Test
  void trailingTextFallsBackWhenMissing() {
    assertEquals("Password incorrect",
        PircbotxBridgeListener.trailingText(":srv 464 nick :Password incorrect", "x"));
    assertEquals("fallback", PircbotxBridgeListener.trailingText(":srv 464 nick", "fallback"));
    assertEquals("fallback", PircbotxBridgeListener.trailingText(null, "fallback"));
    assertEquals("fallback", PircbotxBridgeListener.trailingText(":srv 464 nick : ", "fallback"));
  }
}
