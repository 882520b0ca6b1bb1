package cafe.woden.ircagent.irc;

import cafe.woden.ircagent.config.IrcAgentProperties;
import cafe.woden.ircagent.normalize.IrcTargets;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.disposables.Disposable;
import io.reactivex.rxjava3.processors.FlowableProcessor;
import io.reactivex.rxjava3.processors.PublishProcessor;
import io.reactivex.rxjava3.subjects.CompletableSubject;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One account's IRC connection: connect, register, join, and recover from drops.
 *
 * <p>State transitions are serialized on this object's monitor. Transport events arrive on the
 * transport's dispatch thread, timers on the shared timer scheduler; both enter through
 * synchronized handlers. Sends check readiness under the lock but write outside it, since the
 * transport may block on its own output throttle.
 *
 * <p>{@code IDLE -> CONNECTING -> REGISTERED -> DISCONNECTED -> (CONNECTING | TERMINATED)}.
 */
public class IrcConnection {
  private static final Logger log = LoggerFactory.getLogger(IrcConnection.class);

  static final String QUIT_MESSAGE = "Goodbye";
  static final String NICKSERV = "NickServ";
  static final String CLIENT_DISCONNECT = "Client requested disconnect";

  private final String accountId;
  private final IrcAgentProperties.Account account;
  private final IrcAgentProperties.Reconnect reconnectPolicy;
  private final long registrationTimeoutMs;
  private final TransportOptions options;
  private final IrcTransport transport;
  private final ConnectionTimers timers;

  private final ConnectionState state = new ConnectionState();

  private final FlowableProcessor<TransportEvent.LineReceived> lines =
      PublishProcessor.<TransportEvent.LineReceived>create().toSerialized();
  private final FlowableProcessor<ConnectionEvent> lifecycle =
      PublishProcessor.<ConnectionEvent>create().toSerialized();

  private final AtomicReference<Disposable> reconnectSlot = new AtomicReference<>();
  private final AtomicReference<Disposable> registrationTimeout = new AtomicReference<>();

  // Guarded by this.
  private Disposable transportSub;
  private CompletableSubject pending;
  private boolean destroyed;

  public IrcConnection(
      IrcAgentProperties.Account account,
      IrcAgentProperties.Client client,
      IrcTransport transport,
      ConnectionTimers timers
  ) {
    this.account = Objects.requireNonNull(account, "account");
    this.accountId = account.id();
    this.reconnectPolicy = client.reconnect();
    this.registrationTimeoutMs = client.registrationTimeoutMs();
    this.options = TransportOptions.from(account, client.outbound());
    this.transport = Objects.requireNonNull(transport, "transport");
    this.timers = Objects.requireNonNull(timers, "timers");
  }

  public String accountId() {
    return accountId;
  }

  public IrcAgentProperties.Account account() {
    return account;
  }

  /** Received PRIVMSG lines, in wire order. Completes after {@link #disconnect()}. */
  public Flowable<TransportEvent.LineReceived> lines() {
    return lines.onBackpressureBuffer();
  }

  public Flowable<ConnectionEvent> lifecycle() {
    return lifecycle.onBackpressureBuffer();
  }

  public synchronized ConnectionSnapshot snapshot() {
    return state.snapshot();
  }

  public synchronized boolean isReady() {
    return !destroyed && state.ready();
  }

  /** Nickname the server knows us by, or the configured one before registration. */
  public synchronized String currentNickname() {
    String nick = state.currentNickname();
    return (nick == null || nick.isBlank()) ? account.nickname() : nick;
  }

  /**
   * Opens the transport and completes once the server confirms registration.
   *
   * <p>Fails with {@link RegistrationException} when the server rejects us, the socket closes
   * first, or registration times out. An initial failure is not retried automatically.
   */
  public Completable connect() {
    return Completable.defer(() -> {
      synchronized (this) {
        if (destroyed) {
          return Completable.error(new IllegalStateException(
              "IRC connection for account " + accountId + " was disconnected"));
        }
        if (state.phase() == ConnectionPhase.REGISTERED) return Completable.complete();
        if (pending != null) return pending;

        // Any explicit connect cancels pending reconnect work and resets attempts.
        ConnectionTimers.cancel(reconnectSlot);
        state.resetReconnectAttempts();
        return beginAttempt();
      }
    });
  }

  /**
   * Idempotent and absorbing. Cancels timers, sends a best-effort QUIT, closes the transport and
   * detaches from it; {@link #lines()} and {@link #lifecycle()} complete.
   */
  public Completable disconnect() {
    return Completable.fromAction(this::destroy);
  }

  public Completable say(String target, String text) {
    return Completable.fromAction(() -> {
      requireReady();
      transport.say(target, text);
    });
  }

  /** A single CTCP ACTION; never chunked. */
  public Completable sendAction(String target, String action) {
    return say(target, "\u0001ACTION " + Objects.toString(action, "") + "\u0001");
  }

  public Completable join(String channel) {
    return Completable.fromAction(() -> {
      requireValidChannel(channel);
      requireReady();
      transport.join(channel);
    });
  }

  public Completable part(String channel) {
    return Completable.fromAction(() -> {
      requireValidChannel(channel);
      requireReady();
      transport.part(channel);
    });
  }

  private static void requireValidChannel(String channel) {
    if (!IrcTargets.isValidChannel(channel)) {
      throw new IllegalArgumentException("Invalid channel: " + channel);
    }
  }

  private synchronized void requireReady() {
    if (destroyed || !state.ready()) throw new NotConnectedException(accountId);
  }

  private Completable beginAttempt() {
    CompletableSubject attempt = CompletableSubject.create();
    pending = attempt;
    attachTransport();

    state.phase(ConnectionPhase.CONNECTING);
    publish(new ConnectionEvent.Connecting(accountId, Instant.now(), options.host(), options.port(), options.nickname()));
    log.info("[{}] connecting to {}:{} (tls={}) as {}", accountId, options.host(), options.port(), options.tls(), options.nickname());

    ConnectionTimers.replace(registrationTimeout,
        timers.schedule(registrationTimeoutMs, () -> onRegistrationTimeout(attempt)));

    try {
      transport.open(options);
    } catch (RuntimeException e) {
      failAttempt(new RegistrationException("Could not open connection: " + e.getMessage(), e));
    }
    return attempt;
  }

  private void attachTransport() {
    if (transportSub != null) return;
    transportSub = transport.events().subscribe(
        this::onTransportEvent,
        err -> log.error("[{}] transport event stream failed", accountId, err));
  }

  void onTransportEvent(TransportEvent ev) {
    if (ev instanceof TransportEvent.LineReceived line) {
      if (!isDestroyed()) lines.onNext(line);
      return;
    }

    synchronized (this) {
      if (destroyed) return;
      if (ev instanceof TransportEvent.Registered r) {
        onRegistered(r);
      } else if (ev instanceof TransportEvent.JoinedChannel j) {
        if (isSelf(j.nick())) {
          state.joined(j.channel());
          log.info("[{}] joined {}", accountId, j.channel());
        }
      } else if (ev instanceof TransportEvent.PartedChannel p) {
        if (isSelf(p.nick())) {
          state.left(p.channel());
          log.info("[{}] left {}", accountId, p.channel());
        }
      } else if (ev instanceof TransportEvent.Kicked k) {
        if (isSelf(k.nick())) {
          state.left(k.channel());
          log.warn("[{}] kicked from {} by {}: {}", accountId, k.channel(), k.by(), k.reason());
        }
      } else if (ev instanceof TransportEvent.NickChanged n) {
        if (isSelf(n.oldNick())) {
          state.nickChanged(n.newNick());
          log.info("[{}] nick changed {} -> {}", accountId, n.oldNick(), n.newNick());
        }
      } else if (ev instanceof TransportEvent.SocketError e) {
        state.lastError(e.message());
        log.error("[{}] socket error: {}", accountId, e.message(), e.cause());
        publish(new ConnectionEvent.Error(accountId, Instant.now(), e.message(), e.cause()));
      } else if (ev instanceof TransportEvent.ProtocolError p) {
        onProtocolError(p);
      } else if (ev instanceof TransportEvent.SocketClosed c) {
        onSocketClosed(c.reason());
      }
    }
  }

  private boolean isSelf(String nick) {
    String me = state.currentNickname();
    return me != null && nick != null && me.equalsIgnoreCase(nick);
  }

  private synchronized boolean isDestroyed() {
    return destroyed;
  }

  private void onRegistered(TransportEvent.Registered r) {
    ConnectionTimers.cancel(registrationTimeout);
    String nick = (r.nick() == null || r.nick().isBlank()) ? account.nickname() : r.nick();
    state.markRegistered(nick);
    log.info("[{}] registered as {}", accountId, nick);
    publish(new ConnectionEvent.Registered(accountId, Instant.now(), nick));

    authenticateLegacy();

    for (String channel : account.channels()) {
      try {
        transport.join(channel);
        log.info("[{}] joining {}", accountId, channel);
      } catch (RuntimeException e) {
        log.warn("[{}] could not join {}", accountId, channel, e);
      }
    }

    CompletableSubject p = pending;
    pending = null;
    if (p != null) p.onComplete();
  }

  /**
   * SASL, when configured, is used exclusively. The NickServ path only runs when explicitly
   * enabled; a configured password without the flag is refused, never silently used.
   */
  private void authenticateLegacy() {
    if (!account.hasNickservPassword()) return;
    if (account.hasSasl()) {
      log.info("[{}] SASL is configured; ignoring nickserv-password", accountId);
      return;
    }
    if (!account.allowInsecureNickservAuth()) {
      log.warn("[{}] nickserv-password is set but allow-insecure-nickserv-auth is false; not identifying", accountId);
      return;
    }
    log.warn("[{}] identifying to {} in plaintext (allow-insecure-nickserv-auth=true)", accountId, NICKSERV);
    try {
      transport.say(NICKSERV, "IDENTIFY " + account.nickservPassword());
    } catch (RuntimeException e) {
      log.warn("[{}] {} identify failed", accountId, NICKSERV, e);
    }
  }

  private void onProtocolError(TransportEvent.ProtocolError p) {
    state.lastError(p.reason());
    log.error("[{}] server rejected registration ({}): {}", accountId, p.code(), p.reason());
    publish(new ConnectionEvent.Error(accountId, Instant.now(), p.reason(), null));
    if (state.phase() == ConnectionPhase.CONNECTING) {
      failAttempt(new RegistrationException(p.code(), p.reason()));
    }
  }

  private void onSocketClosed(String reason) {
    ConnectionPhase before = state.phase();
    if (before != ConnectionPhase.CONNECTING && before != ConnectionPhase.REGISTERED) {
      log.debug("[{}] ignoring socket close in phase {}", accountId, before);
      return;
    }

    state.resetOnDisconnect();
    state.phase(ConnectionPhase.DISCONNECTED);
    publish(new ConnectionEvent.Disconnected(accountId, Instant.now(), reason));

    if (before == ConnectionPhase.CONNECTING) {
      failAttempt(new RegistrationException("Connection closed before registration: " + reason));
      return;
    }

    log.warn("[{}] connection lost: {}", accountId, reason);
    scheduleReconnect(reason);
  }

  private void onRegistrationTimeout(CompletableSubject attempt) {
    synchronized (this) {
      if (destroyed || pending != attempt || state.phase() != ConnectionPhase.CONNECTING) return;
      failAttempt(new RegistrationException("Registration timed out after " + registrationTimeoutMs + "ms"));
    }
  }

  private void failAttempt(RegistrationException err) {
    ConnectionTimers.cancel(registrationTimeout);
    if (state.phase() == ConnectionPhase.CONNECTING) {
      publish(new ConnectionEvent.Disconnected(accountId, Instant.now(), err.getMessage()));
    }
    state.resetOnDisconnect();
    state.phase(ConnectionPhase.DISCONNECTED);
    state.lastError(err.getMessage());

    try {
      transport.close();
    } catch (RuntimeException e) {
      log.debug("[{}] error closing transport after failed attempt", accountId, e);
    }

    log.error("[{}] registration failed: {}", accountId, err.getMessage());
    CompletableSubject p = pending;
    pending = null;
    if (p != null) p.onError(err);
  }

  private void scheduleReconnect(String reason) {
    if (destroyed || !reconnectPolicy.enabled()) return;

    int attempt = state.incrementReconnectAttempts();
    if (attempt > reconnectPolicy.maxAttempts()) {
      ReconnectExhaustedException ex = new ReconnectExhaustedException(accountId, reconnectPolicy.maxAttempts());
      state.phase(ConnectionPhase.TERMINATED);
      state.lastError(ex.getMessage());
      log.error("[{}] {}", accountId, ex.getMessage());
      publish(new ConnectionEvent.Error(accountId, Instant.now(), ex.getMessage(), ex));
      publish(new ConnectionEvent.Terminated(accountId, Instant.now(), ex.getMessage(), true));
      return;
    }

    long delayMs = ConnectionTimers.computeBackoffDelayMs(reconnectPolicy, attempt);
    log.info("[{}] reconnecting in {}ms (attempt {}/{}): {}",
        accountId, delayMs, attempt, reconnectPolicy.maxAttempts(), reason);
    publish(new ConnectionEvent.Reconnecting(accountId, Instant.now(), attempt, delayMs,
        Objects.toString(reason, "Disconnected")));

    ConnectionTimers.replace(reconnectSlot, timers.schedule(delayMs, this::reconnectNow));
  }

  private void reconnectNow() {
    Completable attempt;
    synchronized (this) {
      if (destroyed || state.phase() != ConnectionPhase.DISCONNECTED) return;
      attempt = beginAttempt();
    }
    attempt.subscribe(
        () -> log.info("[{}] reconnected", accountId),
        err -> {
          synchronized (this) {
            log.warn("[{}] reconnect attempt failed: {}", accountId, err.getMessage());
            scheduleReconnect("Reconnect attempt failed: " + err.getMessage());
          }
        });
  }

  private void destroy() {
    synchronized (this) {
      if (destroyed) return;
      destroyed = true;

      ConnectionTimers.cancel(reconnectSlot);
      ConnectionTimers.cancel(registrationTimeout);

      ConnectionPhase before = state.phase();
      boolean wasUp = before == ConnectionPhase.CONNECTING || before == ConnectionPhase.REGISTERED;
      if (wasUp) {
        try {
          transport.quit(QUIT_MESSAGE);
        } catch (RuntimeException e) {
          log.debug("[{}] quit failed during disconnect", accountId, e);
        }
      }
      try {
        transport.close();
      } catch (RuntimeException e) {
        log.warn("[{}] error closing transport", accountId, e);
      }
      if (transportSub != null) {
        transportSub.dispose();
        transportSub = null;
      }

      state.resetOnDisconnect();
      state.phase(ConnectionPhase.TERMINATED);
      log.info("[{}] disconnected", accountId);

      if (wasUp) publish(new ConnectionEvent.Disconnected(accountId, Instant.now(), CLIENT_DISCONNECT));
      publish(new ConnectionEvent.Terminated(accountId, Instant.now(), CLIENT_DISCONNECT, false));
      lifecycle.onComplete();
      lines.onComplete();

      CompletableSubject p = pending;
      pending = null;
      if (p != null) p.onError(new RegistrationException("Disconnected before registration completed"));
    }
  }

  private void publish(ConnectionEvent ev) {
    lifecycle.onNext(ev);
  }
}
