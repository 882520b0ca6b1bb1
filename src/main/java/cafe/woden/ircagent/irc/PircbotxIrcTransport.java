package cafe.woden.ircagent.irc;

import cafe.woden.ircagent.util.NamedThreads;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.processors.FlowableProcessor;
import io.reactivex.rxjava3.processors.PublishProcessor;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.pircbotx.PircBotX;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link IrcTransport} backed by PircBotX.
 *
 * <p>Every {@link #open} builds a fresh bot (a "session"). Events from a session that has been
 * closed locally, or replaced by a newer one, are discarded so a late disconnect from an old bot
 * can never be mistaken for the current one.
 */
final class PircbotxIrcTransport implements IrcTransport {
  private static final Logger log = LoggerFactory.getLogger(PircbotxIrcTransport.class);

  private final String accountId;
  private final PircbotxBotFactory botFactory;
  private final Scheduler ioScheduler;

  private final FlowableProcessor<TransportEvent> bus =
      PublishProcessor.<TransportEvent>create().toSerialized();

  private final AtomicReference<Session> current = new AtomicReference<>();

  private final class Session {
    final PircBotX bot;
    final ExecutorService listenerExec;
    final AtomicBoolean closedEmitted = new AtomicBoolean(false);

    Session(PircBotX bot, ExecutorService listenerExec) {
      this.bot = bot;
      this.listenerExec = listenerExec;
    }

    boolean live() {
      return current.get() == this;
    }

    void emit(TransportEvent ev) {
      if (live()) bus.onNext(ev);
    }

    void closed(String reason) {
      if (!closedEmitted.compareAndSet(false, true)) return;
      if (current.compareAndSet(this, null)) {
        bus.onNext(new TransportEvent.SocketClosed(Objects.toString(reason, "Disconnected")));
      }
      listenerExec.shutdown();
    }
  }

  PircbotxIrcTransport(String accountId, PircbotxBotFactory botFactory, Scheduler ioScheduler) {
    this.accountId = Objects.requireNonNull(accountId, "accountId");
    this.botFactory = Objects.requireNonNull(botFactory, "botFactory");
    this.ioScheduler = Objects.requireNonNull(ioScheduler, "ioScheduler");
  }

  @Override
  public Flowable<TransportEvent> events() {
    return bus.onBackpressureBuffer();
  }

  @Override
  public void open(TransportOptions options) {
    Objects.requireNonNull(options, "options");
    close();

    ExecutorService listenerExec = NamedThreads.newSingleThreadExecutor("ircagent-events-" + accountId);
    // Listener callbacks need the session; bind them late.
    AtomicReference<Session> self = new AtomicReference<>();
    PircbotxBridgeListener listener = new PircbotxBridgeListener(
        accountId,
        ev -> {
          Session s = self.get();
          if (s != null) s.emit(ev);
        },
        reason -> {
          Session s = self.get();
          if (s != null) s.closed(reason);
        });

    PircBotX bot = botFactory.build(options, listener, listenerExec);
    Session session = new Session(bot, listenerExec);
    self.set(session);
    current.set(session);

    log.info("[{}] opening {}", accountId, options);
    // startBot() blocks for the lifetime of the socket.
    ioScheduler.scheduleDirect(() -> {
      try {
        bot.startBot();
      } catch (Exception e) {
        log.error("[{}] IRC session crashed", accountId, e);
        session.emit(new TransportEvent.SocketError(
            e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), e));
      } finally {
        // No-op if DisconnectEvent already reported it.
        session.closed("Connection ended");
      }
    });
  }

  @Override
  public void say(String target, String text) {
    requireBot().sendIRC().message(PircbotxUtil.sanitizeTarget(target), PircbotxUtil.sanitizeMessage(text));
  }

  @Override
  public void join(String channel) {
    requireBot().sendIRC().joinChannel(PircbotxUtil.sanitizeChannel(channel));
  }

  @Override
  public void part(String channel) {
    requireBot().sendRaw().rawLine("PART " + PircbotxUtil.sanitizeChannel(channel));
  }

  @Override
  public void quit(String reason) {
    Session s = current.get();
    if (s == null) return;
    s.bot.sendIRC().quitServer(Objects.toString(reason, ""));
  }

  @Override
  public void close() {
    Session s = current.getAndSet(null);
    if (s == null) return;
    s.closedEmitted.set(true);
    try {
      s.bot.stopBotReconnect();
      s.bot.close();
    } catch (RuntimeException e) {
      log.debug("[{}] error while closing IRC session", accountId, e);
    } finally {
      s.listenerExec.shutdown();
    }
  }

  private PircBotX requireBot() {
    Session s = current.get();
    if (s == null) throw new IllegalStateException("Not connected: " + accountId);
    return s.bot;
  }
}
