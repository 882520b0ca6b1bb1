package cafe.woden.ircagent.outbound;

import cafe.woden.ircagent.config.ExecutorConfig;
import cafe.woden.ircagent.config.IrcAgentProperties;
import cafe.woden.ircagent.irc.IrcConnection;
import cafe.woden.ircagent.irc.NotConnectedException;
import cafe.woden.ircagent.status.AccountStatusTracker;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Scheduler;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Delivers replies over a connection: chunked, in order, with a fixed pause between chunks.
 *
 * <p>Each chunk's send completes before the pause for the next one starts, so a slow server
 * delays a reply but never reorders or drops part of it.
 */
@Component
public class OutboundSender {
  private static final Logger log = LoggerFactory.getLogger(OutboundSender.class);

  private static final int LOG_PREVIEW = 50;

  private final IrcAgentProperties.Outbound outbound;
  private final Scheduler pacingScheduler;
  private final AccountStatusTracker statusTracker;

  public OutboundSender(
      IrcAgentProperties props,
      @Qualifier(ExecutorConfig.OUTBOUND_PACING_SCHEDULER) Scheduler pacingScheduler,
      AccountStatusTracker statusTracker) {
    this.outbound = props.client().outbound();
    this.pacingScheduler = Objects.requireNonNull(pacingScheduler, "pacingScheduler");
    this.statusTracker = Objects.requireNonNull(statusTracker, "statusTracker");
  }

  /**
   * Fails with {@link NotConnectedException} before anything is sent when the connection is not
   * registered. Blank text sends nothing.
   */
  public Completable send(IrcConnection connection, String target, String text) {
    return Completable.defer(() -> {
      if (!connection.isReady()) {
        return Completable.error(new NotConnectedException(connection.accountId()));
      }
      List<String> chunks = MessageChunker.chunkReply(text, outbound.maxChunkLength());
      if (chunks.isEmpty()) return Completable.complete();

      String accountId = connection.accountId();
      List<Completable> steps = new ArrayList<>(chunks.size() * 2);
      for (int i = 0; i < chunks.size(); i++) {
        if (i > 0 && outbound.chunkDelayMs() > 0) {
          steps.add(Completable.timer(outbound.chunkDelayMs(), TimeUnit.MILLISECONDS, pacingScheduler));
        }
        String chunk = chunks.get(i);
        steps.add(Completable.defer(() -> {
          log.debug("[{}] sending to {}: {}", accountId, target, preview(chunk));
          return connection.say(target, chunk);
        }).doOnComplete(() -> statusTracker.recordOutbound(accountId)));
      }
      return Completable.concat(steps);
    });
  }

  /** One CTCP ACTION, never chunked. */
  public Completable sendAction(IrcConnection connection, String target, String action) {
    return Completable.defer(() -> {
      if (!connection.isReady()) {
        return Completable.error(new NotConnectedException(connection.accountId()));
      }
      log.debug("[{}] sending action to {}: {}", connection.accountId(), target, preview(action));
      return connection.sendAction(target, action)
          .doOnComplete(() -> statusTracker.recordOutbound(connection.accountId()));
    });
  }

  static String preview(String text) {
    String s = Objects.toString(text, "");
    return s.length() > LOG_PREVIEW ? s.substring(0, LOG_PREVIEW) + "..." : s;
  }
}
