package cafe.woden.ircagent.agent;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cafe.woden.ircagent.config.IrcAgentProperties;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.observers.TestObserver;
import io.reactivex.rxjava3.schedulers.Schedulers;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

class CliAgentClientTest {

  private final List<String> replies = new CopyOnWriteArrayList<>();
  private CliAgentClient client;

  @AfterEach
  void tearDown() {
    if (client != null) client.shutdown();
  }

  /** Runs {@code script} under sh; the appended CLI arguments become $1..$5. */
  private CliAgentClient shell(String script, long timeoutMs) {
    IrcAgentProperties props = new IrcAgentProperties(null,
        new IrcAgentProperties.Agent(List.of("sh", "-c", script, "agent"), timeoutMs, null), List.of());
    client = new CliAgentClient(props, Schedulers.trampoline());
    return client;
  }

  private static Optional<ProcessHandle> awaitPid(Path pidFile) throws IOException, InterruptedException {
    long deadline = System.currentTimeMillis() + 10_000;
    while (System.currentTimeMillis() < deadline) {
      if (Files.exists(pidFile)) {
        String pid = Files.readString(pidFile, StandardCharsets.UTF_8).trim();
        if (!pid.isEmpty()) return ProcessHandle.of(Long.parseLong(pid));
      }
      Thread.sleep(20);
    }
    return Optional.empty();
  }

  private static boolean awaitExit(ProcessHandle handle) throws InterruptedException {
    long deadline = System.currentTimeMillis() + 10_000;
    while (handle.isAlive() && System.currentTimeMillis() < deadline) {
      Thread.sleep(20);
    }
    return !handle.isAlive();
  }

  private AgentRequest request(String text) {
    return new AgentRequest("libera", "irc:libera:#java", text, reply -> {
      replies.add(reply);
      return Completable.complete();
    });
  }

  @Test
  void buildsTheAgentCommandLine() {
    IrcAgentProperties props = new IrcAgentProperties(null, null, List.of());
    client = new CliAgentClient(props, Schedulers.trampoline());

    assertThat(client.commandFor(request("hi there"))).containsExactly(
        "openclaw", "agent", "--session-id", "irc:libera:#java", "--message", "hi there", "--json");
  }

  @Test
  @EnabledOnOs({OS.LINUX, OS.MAC})
  void deliversTheParsedReply() {
    CliAgentClient c = shell("printf '{\"result\":{\"payloads\":[{\"text\":\"%s | %s\"}]}}' \"$2\" \"$4\"", 10_000);

    c.handle(request("ping")).test().awaitDone(15, TimeUnit.SECONDS).assertComplete();

    assertEquals(List.of("irc:libera:#java | ping"), replies);
  }

  @Test
  @EnabledOnOs({OS.LINUX, OS.MAC})
  void emptyReplySendsNothing() {
    CliAgentClient c = shell("echo '{}'", 10_000);

    c.handle(request("ping")).test().awaitDone(15, TimeUnit.SECONDS).assertComplete();

    assertTrue(replies.isEmpty());
  }

  @Test
  @EnabledOnOs({OS.LINUX, OS.MAC})
  void nonZeroExitFailsWithStderr() {
    CliAgentClient c = shell("echo 'gateway offline' >&2; exit 3", 10_000);

    c.handle(request("ping")).test().awaitDone(15, TimeUnit.SECONDS)
        .assertError(err -> err instanceof AgentInvocationException
            && err.getMessage().contains("code 3")
            && err.getMessage().contains("gateway offline"));
    assertTrue(replies.isEmpty());
  }

  @Test
  @EnabledOnOs({OS.LINUX, OS.MAC})
  void slowAgentIsKilledAfterTheTimeout() {
    CliAgentClient c = shell("sleep 10", 300);

    c.handle(request("ping")).test().awaitDone(15, TimeUnit.SECONDS)
        .assertError(err -> err instanceof AgentInvocationException && err.getMessage().contains("timed out"));
  }

  @Test
  @EnabledOnOs({OS.LINUX, OS.MAC})
  void disposingACallKillsTheAgentProcess(@TempDir Path tmp) throws Exception {
    Path pidFile = tmp.resolve("agent.pid");
    IrcAgentProperties props = new IrcAgentProperties(null,
        new IrcAgentProperties.Agent(
            List.of("sh", "-c", "echo $$ > '" + pidFile + "'; exec sleep 30", "agent"), 60_000, null),
        List.of());
    client = new CliAgentClient(props, Schedulers.io());

    TestObserver<Void> call = client.handle(request("ping")).test();
    ProcessHandle agent = awaitPid(pidFile).orElseThrow(() -> new AssertionError("agent never started"));
    assertTrue(agent.isAlive());

    call.dispose();

    assertTrue(awaitExit(agent), "agent process still alive after the call was disposed");
    assertTrue(replies.isEmpty());
  }

  @Test
  void missingExecutableFails() {
    IrcAgentProperties props = new IrcAgentProperties(null,
        new IrcAgentProperties.Agent(List.of("/nonexistent/ircagent-test-binary"), 1_000, null), List.of());
    client = new CliAgentClient(props, Schedulers.trampoline());

    client.handle(request("ping")).test().awaitDone(5, TimeUnit.SECONDS)
        .assertError(AgentInvocationException.class);
  }
}
