package cafe.woden.ircagent.outbound;

import static cafe.woden.ircagent.config.TestAccounts.account;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import cafe.woden.ircagent.config.IrcAgentProperties;
import cafe.woden.ircagent.irc.FakeTransport;
import cafe.woden.ircagent.irc.IrcConnection;
import cafe.woden.ircagent.irc.NotConnectedException;
import cafe.woden.ircagent.irc.TestConnections;
import cafe.woden.ircagent.status.AccountStatusTracker;
import io.reactivex.rxjava3.observers.TestObserver;
import io.reactivex.rxjava3.schedulers.TestScheduler;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class OutboundSenderTest {

  private final TestScheduler pacing = new TestScheduler();
  private final TestScheduler timers = new TestScheduler();
  private final FakeTransport transport = new FakeTransport();
  private final AccountStatusTracker status = mock(AccountStatusTracker.class);

  private OutboundSender sender(int maxChunk, long chunkDelayMs) {
    IrcAgentProperties props = new IrcAgentProperties(
        new IrcAgentProperties.Client(null, 0, null,
            new IrcAgentProperties.Outbound(maxChunk, chunkDelayMs, 0), null),
        null, List.of());
    return new OutboundSender(props, pacing, status);
  }

  @Test
  void chunksArePacedAndDeliveredInOrder() {
    IrcConnection c = TestConnections.registered(account().build(), transport, timers);
    OutboundSender sender = sender(10, 500);

    TestObserver<Void> sent = sender.send(c, "#java", "one two three four five six").test();

    assertThat(transport.textsTo("#java")).containsExactly("one two");
    sent.assertNotComplete();

    pacing.advanceTimeBy(499, TimeUnit.MILLISECONDS);
    assertThat(transport.textsTo("#java")).hasSize(1);

    pacing.advanceTimeBy(1, TimeUnit.MILLISECONDS);
    assertThat(transport.textsTo("#java")).containsExactly("one two", "three four");

    pacing.advanceTimeBy(1_000, TimeUnit.MILLISECONDS);
    assertThat(transport.textsTo("#java")).containsExactly("one two", "three four", "five six");
    sent.assertComplete();
    verify(status, times(3)).recordOutbound("libera");
  }

  @Test
  void multiLineRepliesBecomeOneMessagePerLine() {
    IrcConnection c = TestConnections.registered(account().build(), transport, timers);

    sender(450, 0).send(c, "alice", "first line\n\nsecond line  ").test().assertComplete();

    assertThat(transport.textsTo("alice")).containsExactly("first line", "second line");
  }

  @Test
  void blankTextSendsNothing() {
    IrcConnection c = TestConnections.registered(account().build(), transport, timers);

    sender(450, 500).send(c, "alice", "  \n ").test().assertComplete();

    assertThat(transport.said).isEmpty();
    verify(status, never()).recordOutbound("libera");
  }

  @Test
  void failsBeforeSendingWhenNotRegistered() {
    IrcConnection c = TestConnections.create(account().build(), transport, timers);

    sender(450, 500).send(c, "#java", "hello").test().assertError(NotConnectedException.class);

    assertThat(transport.said).isEmpty();
  }

  @Test
  void aFailedChunkStopsTheRest() {
    IrcConnection c = TestConnections.registered(account().build(), transport, timers);
    transport.failSay = new IllegalStateException("socket gone");

    sender(5, 0).send(c, "#java", "aaaaa bbbbb").test().assertError(IllegalStateException.class);

    assertThat(transport.said).isEmpty();
  }

  @Test
  void actionIsSentAsOneCtcpMessage() {
    IrcConnection c = TestConnections.registered(account().build(), transport, timers);

    sender(5, 500).sendAction(c, "#java", "waves at everyone").test().assertComplete();

    assertThat(transport.textsTo("#java")).containsExactly("\u0001ACTION waves at everyone\u0001");
  }

  @Test
  void previewTruncatesLongText() {
    assertEquals("x".repeat(50) + "...", OutboundSender.preview("x".repeat(80)));
    assertEquals("", OutboundSender.preview(null));
  }
}
