package cafe.woden.ircagent.config;

import cafe.woden.ircagent.util.NamedThreads;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.schedulers.Schedulers;
import java.time.Clock;
import java.util.concurrent.ScheduledExecutorService;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Centralized app-owned executors.
 *
 * <p>These remain workload-specific so reconnect timers never queue behind rate-limit
 * maintenance or reply pacing, while giving Spring ownership of creation/shutdown.
 */
@Configuration
public class ExecutorConfig {
  public static final String CONNECTION_TIMER_EXECUTOR = "connectionTimerExecutor";
  public static final String CONNECTION_TIMER_SCHEDULER = "connectionTimerScheduler";
  public static final String MAINTENANCE_EXECUTOR = "maintenanceExecutor";
  public static final String MAINTENANCE_SCHEDULER = "maintenanceScheduler";
  public static final String OUTBOUND_PACING_EXECUTOR = "outboundPacingExecutor";
  public static final String OUTBOUND_PACING_SCHEDULER = "outboundPacingScheduler";
  public static final String IO_SCHEDULER = "ioScheduler";

  @Bean(name = CONNECTION_TIMER_EXECUTOR, destroyMethod = "shutdownNow")
  public ScheduledExecutorService connectionTimerExecutor() {
    return NamedThreads.newSingleThreadScheduledExecutor("ircagent-reconnect");
  }

  @Bean(name = CONNECTION_TIMER_SCHEDULER)
  public Scheduler connectionTimerScheduler(
      @Qualifier(CONNECTION_TIMER_EXECUTOR) ScheduledExecutorService exec) {
    return Schedulers.from(exec);
  }

  @Bean(name = MAINTENANCE_EXECUTOR, destroyMethod = "shutdownNow")
  public ScheduledExecutorService maintenanceExecutor() {
    return NamedThreads.newSingleThreadScheduledExecutor("ircagent-maintenance");
  }

  @Bean(name = MAINTENANCE_SCHEDULER)
  public Scheduler maintenanceScheduler(@Qualifier(MAINTENANCE_EXECUTOR) ScheduledExecutorService exec) {
    return Schedulers.from(exec);
  }

  @Bean(name = OUTBOUND_PACING_EXECUTOR, destroyMethod = "shutdownNow")
  public ScheduledExecutorService outboundPacingExecutor() {
    return NamedThreads.newSingleThreadScheduledExecutor("ircagent-outbound");
  }

  @Bean(name = OUTBOUND_PACING_SCHEDULER)
  public Scheduler outboundPacingScheduler(
      @Qualifier(OUTBOUND_PACING_EXECUTOR) ScheduledExecutorService exec) {
    return Schedulers.from(exec);
  }

  /** Blocking work: the transport read loop and the agent process. */
  @Bean(name = IO_SCHEDULER)
  public Scheduler ioScheduler() {
    return Schedulers.io();
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
