package cafe.woden.ircagent.config;

import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.reactivex.rxjava3.core.Scheduler;
import java.time.Clock;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

class ExecutorConfigTest {

  private final ApplicationContextRunner runner =
      new ApplicationContextRunner().withUserConfiguration(ExecutorConfig.class);

  @Test
  void exposesSchedulersAndClock() {
    runner.run(ctx -> {
      assertInstanceOf(Scheduler.class, ctx.getBean(ExecutorConfig.CONNECTION_TIMER_SCHEDULER));
      assertInstanceOf(Scheduler.class, ctx.getBean(ExecutorConfig.MAINTENANCE_SCHEDULER));
      assertInstanceOf(Scheduler.class, ctx.getBean(ExecutorConfig.OUTBOUND_PACING_SCHEDULER));
      assertInstanceOf(Scheduler.class, ctx.getBean(ExecutorConfig.IO_SCHEDULER));
      assertInstanceOf(Clock.class, ctx.getBean(Clock.class));
    });
  }

  @Test
  void reconnectTimersDoNotShareAThreadWithPacingOrMaintenance() {
    runner.run(ctx -> {
      Object timers = ctx.getBean(ExecutorConfig.CONNECTION_TIMER_EXECUTOR);
      Object pacing = ctx.getBean(ExecutorConfig.OUTBOUND_PACING_EXECUTOR);
      Object maintenance = ctx.getBean(ExecutorConfig.MAINTENANCE_EXECUTOR);
      assertNotSame(timers, pacing);
      assertNotSame(timers, maintenance);
      assertNotSame(pacing, maintenance);
    });
  }

  @Test
  void contextCloseShutsDownExecutors() {
    AtomicReference<ScheduledExecutorService> timersRef = new AtomicReference<>();

    runner.run(ctx -> timersRef.set(
        ctx.getBean(ExecutorConfig.CONNECTION_TIMER_EXECUTOR, ScheduledExecutorService.class)));

    assertTrue(timersRef.get().isShutdown());
  }
}
