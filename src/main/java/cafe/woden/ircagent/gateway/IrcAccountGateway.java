package cafe.woden.ircagent.gateway;

import cafe.woden.ircagent.agent.AgentClient;
import cafe.woden.ircagent.config.AccountCatalog;
import cafe.woden.ircagent.config.IrcAgentProperties;
import cafe.woden.ircagent.inbound.InboundMonitor;
import cafe.woden.ircagent.irc.IrcConnection;
import cafe.woden.ircagent.irc.IrcConnectionFactory;
import cafe.woden.ircagent.normalize.IrcTargets;
import cafe.woden.ircagent.outbound.OutboundSender;
import cafe.woden.ircagent.ratelimit.SenderRateLimiter;
import cafe.woden.ircagent.status.AccountStatusTracker;
import cafe.woden.ircagent.util.NamedThreads;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.disposables.Disposable;
import io.reactivex.rxjava3.schedulers.Schedulers;
import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Owns the running account sessions: one connection, one inbound monitor and one inbound
 * thread per started account.
 *
 * <p>Sessions are kept in start order; {@link #notifyPairingApproved(String)} walks them in that
 * order.
 */
@Component
@ApplicationLayer
public class IrcAccountGateway {
  private static final Logger log = LoggerFactory.getLogger(IrcAccountGateway.class);

  static final String PAIRING_APPROVED = "Your pairing request has been approved!";

  /** Everything one started account holds on to. */
  record AccountSession(
      String accountId,
      IrcConnection connection,
      InboundMonitor monitor,
      ExecutorService inboundExecutor,
      Disposable statusSubscription
  ) {}

  private final IrcAgentProperties props;
  private final AccountCatalog catalog;
  private final IrcConnectionFactory connectionFactory;
  private final OutboundSender sender;
  private final SenderRateLimiter rateLimiter;
  private final AgentClient agent;
  private final AccountStatusTracker statusTracker;

  // Guarded by this.
  private final Map<String, AccountSession> sessions = new LinkedHashMap<>();

  public IrcAccountGateway(
      IrcAgentProperties props,
      AccountCatalog catalog,
      IrcConnectionFactory connectionFactory,
      OutboundSender sender,
      SenderRateLimiter rateLimiter,
      AgentClient agent,
      AccountStatusTracker statusTracker
  ) {
    this.props = Objects.requireNonNull(props, "props");
    this.catalog = Objects.requireNonNull(catalog, "catalog");
    this.connectionFactory = Objects.requireNonNull(connectionFactory, "connectionFactory");
    this.sender = Objects.requireNonNull(sender, "sender");
    this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
    this.agent = Objects.requireNonNull(agent, "agent");
    this.statusTracker = Objects.requireNonNull(statusTracker, "statusTracker");
  }

  /**
   * Starts (or restarts) an account and completes once it is registered.
   *
   * <p>An existing session for the id is stopped first. When the connect fails the session is
   * removed again and the error is recorded in the account status.
   */
  public Completable startAccount(String accountId) {
    return Completable.defer(() -> {
      IrcAgentProperties.Account account = catalog.require(accountId);
      String id = account.id();

      stopSession(id, false);
      statusTracker.markStarted(id);
      log.info("[{}] starting IRC account ({}@{}:{})", id, account.nickname(), account.server(), account.port());

      if (!catalog.isConfigured(account)) {
        IllegalStateException err = new IllegalStateException("IRC server not configured");
        statusTracker.recordError(id, err.getMessage());
        statusTracker.markStopped(id);
        return Completable.error(err);
      }

      AccountSession session = openSession(account);
      synchronized (this) {
        sessions.put(id, session);
      }

      return session.connection().connect()
          .doOnComplete(() -> log.info("[{}] IRC account started, connected as {}",
              id, session.connection().currentNickname()))
          .doOnError(err -> {
            log.error("[{}] IRC account failed to start: {}", id, err.getMessage());
            boolean removed;
            synchronized (this) {
              removed = sessions.remove(id, session);
            }
            if (removed) close(session);
            statusTracker.recordError(id, err.getMessage());
            statusTracker.markStopped(id);
          });
    });
  }

  private AccountSession openSession(IrcAgentProperties.Account account) {
    IrcConnection connection = connectionFactory.create(account);
    Disposable statusSub = connection.lifecycle().subscribe(
        statusTracker::onConnectionEvent,
        err -> log.warn("[{}] lifecycle stream failed", account.id(), err));

    ExecutorService inboundExec = NamedThreads.newSingleThreadExecutor("ircagent-inbound-" + account.id());
    InboundMonitor monitor = new InboundMonitor(
        connection, sender, rateLimiter, agent, statusTracker, props, Schedulers.from(inboundExec));
    monitor.start();
    return new AccountSession(account.id(), connection, monitor, inboundExec, statusSub);
  }

  public Completable stopAccount(String accountId) {
    return Completable.fromAction(() -> stopSession(accountId, true));
  }

  private void stopSession(String accountId, boolean markStopped) {
    AccountSession session;
    synchronized (this) {
      session = sessions.remove(Objects.toString(accountId, "").trim());
    }
    if (session == null) return;
    close(session);
    if (markStopped) statusTracker.markStopped(session.accountId());
    log.info("[{}] IRC account stopped", session.accountId());
  }

  private void close(AccountSession session) {
    session.monitor().stop();
    session.connection().disconnect()
        .subscribe(
            () -> {},
            err -> log.warn("[{}] disconnect failed", session.accountId(), err));
    // The connection's final lifecycle events are delivered synchronously by disconnect().
    session.statusSubscription().dispose();
    session.inboundExecutor().shutdownNow();
  }

  /** Stops every running account. Called on shutdown. */
  @PreDestroy
  public void stopAll() {
    List<String> ids;
    synchronized (this) {
      ids = new ArrayList<>(sessions.keySet());
    }
    for (String id : ids) {
      try {
        stopSession(id, true);
      } catch (RuntimeException e) {
        log.warn("[{}] error stopping account", id, e);
      }
    }
  }

  /** Starts every enabled and configured account; each failure is logged and does not stop the rest. */
  public void startAllEnabled() {
    for (IrcAgentProperties.Account account : catalog.accounts()) {
      if (!account.enabled()) {
        log.info("[{}] account disabled; not starting", account.id());
        continue;
      }
      if (!catalog.isConfigured(account)) {
        log.warn("[{}] account has no server configured; not starting", account.id());
        continue;
      }
      startAccount(account.id()).subscribe(
          () -> {},
          err -> log.warn("[{}] startup connect failed: {}", account.id(), err.getMessage()));
    }
  }

  public synchronized Optional<IrcConnection> activeConnection(String accountId) {
    AccountSession s = sessions.get(Objects.toString(accountId, "").trim());
    return s == null ? Optional.empty() : Optional.of(s.connection());
  }

  public synchronized List<String> runningAccountIds() {
    return List.copyOf(sessions.keySet());
  }

  /** Sends text for the host. Channel targets are lower-cased, nicknames keep their case. */
  public Completable sendText(String accountId, String to, String text) {
    return Completable.defer(() -> {
      String id = resolveAccountId(accountId);
      IrcConnection connection = requireRunning(id);
      String target = IrcTargets.formatTarget(to);
      return sender.send(connection, target, Objects.toString(text, ""))
          .doOnError(err -> log.error("[{}] failed to send message to {}: {}", id, to, err.getMessage()));
    });
  }

  public Completable sendAction(String accountId, String to, String action) {
    return Completable.defer(() -> {
      String id = resolveAccountId(accountId);
      IrcConnection connection = requireRunning(id);
      return sender.sendAction(connection, IrcTargets.formatTarget(to), action);
    });
  }

  /**
   * Tells a newly paired nickname about it through the first running account that can deliver
   * the notice.
   */
  public Completable notifyPairingApproved(String nick) {
    return Completable.defer(() -> {
      List<AccountSession> running;
      synchronized (this) {
        running = new ArrayList<>(sessions.values());
      }
      Completable chain = Completable.error(
          new IllegalStateException("No running IRC account could deliver the pairing notice to " + nick));
      // Build back to front so the first session is tried first.
      for (int i = running.size() - 1; i >= 0; i--) {
        AccountSession s = running.get(i);
        Completable next = chain;
        chain = sender.send(s.connection(), nick, PAIRING_APPROVED)
            .doOnComplete(() -> log.info("[{}] sent pairing approval to {}", s.accountId(), nick))
            .onErrorResumeNext(err -> {
              log.debug("[{}] failed to send pairing approval to {}, trying next account", s.accountId(), nick);
              return next;
            });
      }
      return chain;
    });
  }

  private String resolveAccountId(String accountId) {
    String id = Objects.toString(accountId, "").trim();
    return id.isEmpty() ? IrcAgentProperties.DEFAULT_ACCOUNT_ID : id;
  }

  private IrcConnection requireRunning(String accountId) {
    return activeConnection(accountId)
        .orElseThrow(() -> new IllegalStateException("IRC client not running for account " + accountId));
  }
}
