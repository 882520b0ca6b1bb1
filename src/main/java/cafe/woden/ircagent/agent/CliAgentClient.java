package cafe.woden.ircagent.agent;

import cafe.woden.ircagent.config.ExecutorConfig;
import cafe.woden.ircagent.config.IrcAgentProperties;
import cafe.woden.ircagent.util.NamedThreads;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Maybe;
import io.reactivex.rxjava3.core.Scheduler;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Runs the agent CLI once per message:
 * {@code <command> --session-id <key> --message <text> --json}.
 *
 * <p>The process is killed after the configured timeout. A non-zero exit status is a failure;
 * its stderr goes to the log, never to chat.
 */
@Component
public class CliAgentClient implements AgentClient {
  private static final Logger log = LoggerFactory.getLogger(CliAgentClient.class);

  private static final int MAX_CAPTURE = 256 * 1024;
  private static final int LOG_PREVIEW = 200;

  private final IrcAgentProperties.Agent config;
  private final Scheduler ioScheduler;
  private final ExecutorService streamReaders =
      Executors.newCachedThreadPool(NamedThreads.namedFactory("ircagent-agent-io"));

  public CliAgentClient(
      IrcAgentProperties props,
      @Qualifier(ExecutorConfig.IO_SCHEDULER) Scheduler ioScheduler) {
    this.config = props.agent();
    this.ioScheduler = Objects.requireNonNull(ioScheduler, "ioScheduler");
  }

  @Override
  public Completable handle(AgentRequest request) {
    return Maybe.fromCallable(() -> run(request).orElse(null))
        .subscribeOn(ioScheduler)
        .flatMapCompletable(reply -> {
          log.info("[{}] agent reply for {}: {}", request.accountId(), request.sessionKey(), preview(reply, 100));
          return request.reply().reply(reply);
        });
  }

  List<String> commandFor(AgentRequest request) {
    List<String> cmd = new ArrayList<>(config.command());
    cmd.add("--session-id");
    cmd.add(request.sessionKey());
    cmd.add("--message");
    cmd.add(request.text());
    cmd.add("--json");
    return cmd;
  }

  private Optional<String> run(AgentRequest request) throws InterruptedException {
    List<String> cmd = commandFor(request);
    log.info("[{}] sending to agent ({}): {}", request.accountId(), request.sessionKey(), preview(request.text(), 50));

    Process process;
    try {
      process = new ProcessBuilder(cmd).start();
    } catch (IOException e) {
      throw new AgentInvocationException("Failed to start agent command " + cmd.get(0), e);
    }
    // No stdin.
    try {
      process.getOutputStream().close();
    } catch (IOException e) {
      log.debug("[{}] could not close agent stdin", request.accountId(), e);
    }

    Future<String> stdout = streamReaders.submit(() -> drain(process.getInputStream()));
    Future<String> stderr = streamReaders.submit(() -> drain(process.getErrorStream()));

    boolean finished;
    try {
      finished = process.waitFor(config.timeoutMs(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      // The call was disposed, e.g. the account is stopping.
      log.info("[{}] agent call for {} cancelled, killing agent process", request.accountId(), request.sessionKey());
      kill(process, stdout, stderr);
      Thread.currentThread().interrupt();
      throw e;
    }
    if (!finished) {
      kill(process, stdout, stderr);
      throw new AgentInvocationException("Agent command timed out after " + config.timeoutMs() + "ms");
    }

    String out = await(stdout);
    int exit = process.exitValue();
    if (exit != 0) {
      String err = await(stderr);
      throw new AgentInvocationException(
          "Agent command failed (code " + exit + "): " + (err.isBlank() ? "unknown error" : err.trim()));
    }

    Optional<String> reply = AgentResponseParser.parse(out);
    if (reply.isEmpty()) {
      log.warn("[{}] no response from agent, stdout: {}", request.accountId(), preview(out, LOG_PREVIEW));
    }
    return reply;
  }

  private static void kill(Process process, Future<String> stdout, Future<String> stderr) {
    process.descendants().forEach(ProcessHandle::destroyForcibly);
    process.destroyForcibly();
    stdout.cancel(true);
    stderr.cancel(true);
  }

  private static String await(Future<String> f) throws InterruptedException {
    try {
      return f.get(5, TimeUnit.SECONDS);
    } catch (ExecutionException | TimeoutException e) {
      throw new AgentInvocationException("Failed to read agent output", e);
    }
  }

  private static String drain(InputStream in) throws IOException {
    try (InputStream s = in) {
      byte[] bytes = s.readNBytes(MAX_CAPTURE);
      // Keep reading so the child never blocks on a full pipe.
      s.transferTo(OutputStream.nullOutputStream());
      return new String(bytes, StandardCharsets.UTF_8);
    }
  }

  static String preview(String text, int max) {
    String s = Objects.toString(text, "");
    return s.length() > max ? s.substring(0, max) + "..." : s;
  }

  @PreDestroy
  void shutdown() {
    streamReaders.shutdownNow();
  }
}
