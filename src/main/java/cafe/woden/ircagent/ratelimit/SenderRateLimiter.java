package cafe.woden.ircagent.ratelimit;

import cafe.woden.ircagent.config.ExecutorConfig;
import cafe.woden.ircagent.config.IrcAgentProperties;
import cafe.woden.ircagent.normalize.IrcTargets;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.disposables.Disposable;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Process-wide, per-sender fixed-window rate limiter.
 *
 * <p>Keys are the trimmed, lower-cased sender so case variants share one counter. Each key is
 * updated atomically via {@link ConcurrentHashMap#compute}; stale windows are swept on the
 * maintenance scheduler rather than on the check path.
 */
@Component
public class SenderRateLimiter {
  private static final Logger log = LoggerFactory.getLogger(SenderRateLimiter.class);

  private final Map<String, RateLimitEntry> entries = new ConcurrentHashMap<>();
  private final IrcAgentProperties.RateLimit defaults;
  private final Clock clock;
  private final Scheduler maintenanceScheduler;
  private final AtomicReference<Disposable> sweep = new AtomicReference<>();

  public SenderRateLimiter(
      IrcAgentProperties props,
      Clock clock,
      @Qualifier(ExecutorConfig.MAINTENANCE_SCHEDULER) Scheduler maintenanceScheduler) {
    this.defaults = props.client().rateLimit();
    this.clock = Objects.requireNonNull(clock, "clock");
    this.maintenanceScheduler = Objects.requireNonNull(maintenanceScheduler, "maintenanceScheduler");
  }

  @PostConstruct
  public void startSweep() {
    long period = defaults.sweepIntervalMs();
    Disposable d = Flowable.interval(period, period, TimeUnit.MILLISECONDS, maintenanceScheduler)
        .subscribe(
            tick -> sweepExpired(),
            err -> log.warn("[ircagent] rate-limit sweep stopped", err));
    Disposable prev = sweep.getAndSet(d);
    if (prev != null && !prev.isDisposed()) prev.dispose();
  }

  @PreDestroy
  public void stopSweep() {
    Disposable prev = sweep.getAndSet(null);
    if (prev != null && !prev.isDisposed()) prev.dispose();
  }

  public RateLimitResult check(String senderId) {
    return check(senderId, defaults);
  }

  public RateLimitResult check(String senderId, IrcAgentProperties.RateLimit config) {
    IrcAgentProperties.RateLimit cfg = (config != null) ? config : defaults;
    String key = IrcTargets.normalizeTarget(senderId);
    long now = clock.millis();

    // compute() runs atomically per key; the decision is captured from inside it.
    RateLimitResult[] out = new RateLimitResult[1];
    entries.compute(key, (k, cur) -> {
      if (cur == null || cur.expired(now)) {
        out[0] = RateLimitResult.ALLOWED;
        return RateLimitEntry.fresh(now, cfg.windowMs());
      }
      if (cur.count() < cfg.maxRequests()) {
        out[0] = RateLimitResult.ALLOWED;
        return cur.increment();
      }
      if (!cur.notified()) {
        out[0] = RateLimitResult.LIMITED_NOTIFY;
        return cur.markNotified();
      }
      out[0] = RateLimitResult.LIMITED_SILENT;
      return cur;
    });
    return out[0];
  }

  public void reset(String senderId) {
    entries.remove(IrcTargets.normalizeTarget(senderId));
  }

  public void clear() {
    entries.clear();
  }

  public Optional<RateLimitStatus> status(String senderId) {
    RateLimitEntry e = entries.get(IrcTargets.normalizeTarget(senderId));
    long now = clock.millis();
    if (e == null || e.expired(now)) return Optional.empty();
    return Optional.of(new RateLimitStatus(e.count(), e.windowResetAt() - now));
  }

  int sweepExpired() {
    long now = clock.millis();
    int before = entries.size();
    entries.entrySet().removeIf(e -> e.getValue().expired(now));
    int removed = before - entries.size();
    if (removed > 0) {
      log.debug("[ircagent] rate-limit sweep removed {} stale entr{}", removed, removed == 1 ? "y" : "ies");
    }
    return removed;
  }

  int size() {
    return entries.size();
  }
}
