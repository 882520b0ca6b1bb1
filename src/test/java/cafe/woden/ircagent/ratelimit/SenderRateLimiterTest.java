package cafe.woden.ircagent.ratelimit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cafe.woden.ircagent.config.IrcAgentProperties;
import cafe.woden.ircagent.util.MutableClock;
import io.reactivex.rxjava3.schedulers.TestScheduler;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SenderRateLimiterTest {

  private static final IrcAgentProperties.RateLimit THREE_PER_MINUTE =
      new IrcAgentProperties.RateLimit(3, 60_000, 300_000, null);

  private final MutableClock clock = MutableClock.atEpochMillis(1_000_000);
  private final TestScheduler scheduler = new TestScheduler();
  private SenderRateLimiter limiter;

  @BeforeEach
  void setUp() {
    IrcAgentProperties props = new IrcAgentProperties(
        new IrcAgentProperties.Client(null, 0, THREE_PER_MINUTE, null, null), null, List.of());
    limiter = new SenderRateLimiter(props, clock, scheduler);
  }

  @AfterEach
  void tearDown() {
    limiter.stopSweep();
  }

  @Test
  void fourthCallNotifiesFifthIsSilentAndWindowExpiryResets() {
    assertFalse(limiter.check("alice").limited());
    assertFalse(limiter.check("alice").limited());
    assertFalse(limiter.check("alice").limited());

    RateLimitResult fourth = limiter.check("alice");
    assertTrue(fourth.limited());
    assertTrue(fourth.shouldNotify());

    RateLimitResult fifth = limiter.check("alice");
    assertTrue(fifth.limited());
    assertFalse(fifth.shouldNotify());

    clock.advanceMillis(60_000);
    assertEquals(RateLimitResult.ALLOWED, limiter.check("alice"));
  }

  @Test
  void caseVariantsShareOneCounter() {
    limiter.check("Alice");
    limiter.check(" ALICE ");
    limiter.check("alice");

    assertEquals(RateLimitResult.LIMITED_NOTIFY, limiter.check("aLiCe"));
  }

  @Test
  void sendersAreCountedIndependently() {
    for (int i = 0; i < 3; i++) limiter.check("alice");

    assertEquals(RateLimitResult.ALLOWED, limiter.check("bob"));
  }

  @Test
  void newWindowClearsTheNotifiedFlag() {
    for (int i = 0; i < 4; i++) limiter.check("alice");
    clock.advanceMillis(60_000);
    for (int i = 0; i < 3; i++) limiter.check("alice");

    assertEquals(RateLimitResult.LIMITED_NOTIFY, limiter.check("alice"));
  }

  @Test
  void statusReportsCountAndRemainingTime() {
    limiter.check("alice");
    limiter.check("alice");
    clock.advanceMillis(10_000);

    RateLimitStatus status = limiter.status("ALICE").orElseThrow();
    assertEquals(2, status.count());
    assertEquals(50_000, status.remainingMs());

    clock.advanceMillis(50_000);
    assertTrue(limiter.status("alice").isEmpty());
  }

  @Test
  void resetAndClearDropEntries() {
    for (int i = 0; i < 4; i++) limiter.check("alice");
    limiter.check("bob");

    limiter.reset("Alice");
    assertEquals(RateLimitResult.ALLOWED, limiter.check("alice"));

    limiter.clear();
    assertEquals(0, limiter.size());
  }

  @Test
  void periodicSweepRemovesOnlyStaleEntries() {
    limiter.startSweep();
    limiter.check("alice");
    clock.advanceMillis(30_000);
    limiter.check("bob");
    clock.advanceMillis(30_000);

    scheduler.advanceTimeBy(300_000, TimeUnit.MILLISECONDS);

    assertEquals(1, limiter.size());
    assertTrue(limiter.status("bob").isPresent());
  }
}
