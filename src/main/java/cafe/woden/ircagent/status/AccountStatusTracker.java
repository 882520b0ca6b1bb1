package cafe.woden.ircagent.status;

import cafe.woden.ircagent.irc.ConnectionEvent;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.processors.FlowableProcessor;
import io.reactivex.rxjava3.processors.PublishProcessor;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Keeps the per-account {@link AccountStatus} the host polls, and publishes every change.
 */
@Component
public class AccountStatusTracker {
  private static final Logger log = LoggerFactory.getLogger(AccountStatusTracker.class);

  private final Map<String, AccountStatus> byId = new ConcurrentHashMap<>();
  private final FlowableProcessor<AccountStatus> updates =
      PublishProcessor.<AccountStatus>create().toSerialized();
  private final Clock clock;

  public AccountStatusTracker(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public Flowable<AccountStatus> updates() {
    return updates.onBackpressureLatest();
  }

  public Optional<AccountStatus> snapshot(String accountId) {
    return Optional.ofNullable(byId.get(accountId));
  }

  public List<AccountStatus> all() {
    List<AccountStatus> out = new ArrayList<>(byId.values());
    out.sort(Comparator.comparing(AccountStatus::accountId));
    return out;
  }

  public void markStarted(String accountId) {
    update(accountId, s -> s.started(clock.instant()));
  }

  public void markStopped(String accountId) {
    update(accountId, s -> s.stopped(clock.instant()));
  }

  public void recordError(String accountId, String error) {
    update(accountId, s -> s.withError(error));
  }

  public void recordInbound(String accountId) {
    update(accountId, s -> s.inbound(clock.instant()));
  }

  public void recordOutbound(String accountId) {
    update(accountId, s -> s.outbound(clock.instant()));
  }

  /** Folds a connection lifecycle event into the account's status. */
  public void onConnectionEvent(ConnectionEvent ev) {
    if (ev == null) return;
    if (ev instanceof ConnectionEvent.Registered) {
      update(ev.accountId(), s -> s.withError(null));
    } else if (ev instanceof ConnectionEvent.Error e) {
      update(ev.accountId(), s -> s.withError(e.message()));
    } else if (ev instanceof ConnectionEvent.Terminated t && t.fatal()) {
      update(ev.accountId(), s -> s.withError(t.reason()).stopped(clock.instant()));
    }
  }

  /** One issue per account whose last error is set. */
  public List<StatusIssue> collectIssues() {
    List<StatusIssue> issues = new ArrayList<>();
    for (AccountStatus s : all()) {
      if (!s.hasError()) continue;
      issues.add(new StatusIssue(s.accountId(), StatusIssue.KIND_RUNTIME, "Channel error: " + s.lastError()));
    }
    return issues;
  }

  private void update(String accountId, UnaryOperator<AccountStatus> fn) {
    if (accountId == null) return;
    AccountStatus next = byId.compute(accountId, (k, cur) -> fn.apply(cur == null ? AccountStatus.initial(k) : cur));
    log.debug("[{}] status {}", accountId, next);
    updates.onNext(next);
  }
}
