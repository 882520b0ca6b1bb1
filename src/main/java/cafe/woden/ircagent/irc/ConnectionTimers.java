package cafe.woden.ircagent.irc;

import cafe.woden.ircagent.config.ExecutorConfig;
import cafe.woden.ircagent.config.IrcAgentProperties;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.disposables.Disposable;
import jakarta.annotation.PreDestroy;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * RxJava-driven timers shared by every connection: reconnect backoff and registration timeouts.
 *
 * <p>This centralizes all scheduling so {@link IrcConnection} doesn't need its own executor
 * plumbing. Each connection keeps its own single pending slot per timer kind.
 */
@Component
public class ConnectionTimers {
  private static final Logger log = LoggerFactory.getLogger(ConnectionTimers.class);

  private final Scheduler scheduler;

  // Prevent scheduling (and noisy UndeliverableException logs) during JVM/app shutdown.
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

  public ConnectionTimers(@Qualifier(ExecutorConfig.CONNECTION_TIMER_SCHEDULER) Scheduler scheduler) {
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
  }

  Disposable schedule(long delayMs, Runnable task) {
    if (shuttingDown.get()) return Disposable.disposed();
    try {
      return scheduler.scheduleDirect(() -> {
        if (shuttingDown.get()) return;
        task.run();
      }, Math.max(0, delayMs), TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException rejected) {
      // Common during shutdown: executor already terminated.
      log.debug("[ircagent] timer scheduling rejected (likely shutdown)");
      return Disposable.disposed();
    }
  }

  /** Puts {@code next} in the slot and disposes whatever was there. */
  static void replace(AtomicReference<Disposable> slot, Disposable next) {
    Disposable prev = slot.getAndSet(next);
    if (prev != null && !prev.isDisposed()) prev.dispose();
  }

  static void cancel(AtomicReference<Disposable> slot) {
    replace(slot, null);
  }

  /**
   * {@code initial * multiplier^(attempt-1)}, capped at the maximum. Attempt 1 waits the initial
   * delay.
   */
  static long computeBackoffDelayMs(IrcAgentProperties.Reconnect p, long attempt) {
    long base = p.initialDelayMs();
    double mult = Math.pow(p.multiplier(), Math.max(0, attempt - 1));
    double raw = base * mult;
    long capped = (long) Math.min(raw, (double) p.maxDelayMs());

    double jitter = p.jitterPct();
    if (jitter <= 0) return capped;

    double factor = 1.0 + ThreadLocalRandom.current().nextDouble(-jitter, jitter);
    long withJitter = (long) Math.max(0, capped * factor);
    return Math.max(250, Math.min(withJitter, p.maxDelayMs()));
  }

  @PreDestroy
  void shutdown() {
    shuttingDown.set(true);
  }
}
