package cafe.woden.ircagent.inbound;

import cafe.woden.ircagent.agent.AgentClient;
import cafe.woden.ircagent.agent.AgentInvocationException;
import cafe.woden.ircagent.agent.AgentRequest;
import cafe.woden.ircagent.agent.SessionKeys;
import cafe.woden.ircagent.auth.AuthorizationResult;
import cafe.woden.ircagent.auth.InboundAuthorizer;
import cafe.woden.ircagent.config.IrcAgentProperties;
import cafe.woden.ircagent.irc.IrcConnection;
import cafe.woden.ircagent.irc.TransportEvent;
import cafe.woden.ircagent.normalize.IrcTargets;
import cafe.woden.ircagent.normalize.IrcTextSanitizer;
import cafe.woden.ircagent.normalize.MentionExtractor;
import cafe.woden.ircagent.normalize.SanitizedText;
import cafe.woden.ircagent.outbound.OutboundSender;
import cafe.woden.ircagent.ratelimit.RateLimitResult;
import cafe.woden.ircagent.ratelimit.SenderRateLimiter;
import cafe.woden.ircagent.status.AccountStatusTracker;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.disposables.CompositeDisposable;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns one account's received lines into agent requests.
 *
 * <p>Lines are handled one at a time on the given scheduler: the agent call and the paced reply
 * for a message finish before the next line is looked at. Every gate that drops a line does so
 * silently, apart from the single rate-limit notice per window.
 */
public class InboundMonitor {
  private static final Logger log = LoggerFactory.getLogger(InboundMonitor.class);

  private final IrcConnection connection;
  private final String accountId;
  private final OutboundSender sender;
  private final SenderRateLimiter rateLimiter;
  private final AgentClient agent;
  private final AccountStatusTracker statusTracker;
  private final IrcAgentProperties.RateLimit rateLimit;
  private final int maxContentLength;
  private final String failureNotice;
  private final Scheduler scheduler;

  private final CompositeDisposable disposables = new CompositeDisposable();

  public InboundMonitor(
      IrcConnection connection,
      OutboundSender sender,
      SenderRateLimiter rateLimiter,
      AgentClient agent,
      AccountStatusTracker statusTracker,
      IrcAgentProperties props,
      Scheduler scheduler
  ) {
    this.connection = Objects.requireNonNull(connection, "connection");
    this.accountId = connection.accountId();
    this.sender = Objects.requireNonNull(sender, "sender");
    this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
    this.agent = Objects.requireNonNull(agent, "agent");
    this.statusTracker = Objects.requireNonNull(statusTracker, "statusTracker");
    this.rateLimit = props.client().rateLimit();
    this.maxContentLength = props.client().inbound().maxContentLength();
    this.failureNotice = props.agent().failureNotice();
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
  }

  public void start() {
    disposables.add(connection.lines()
        .observeOn(scheduler)
        .concatMapCompletable(line -> handle(line)
            .onErrorComplete(err -> {
              // handle() reports its own failures; this only guards the stream.
              log.error("[{}] unexpected error handling line from {}", accountId, line.sender(), err);
              return true;
            }))
        .subscribe(
            () -> log.debug("[{}] inbound stream completed", accountId),
            err -> log.error("[{}] inbound stream failed", accountId, err)));
    log.info("[{}] inbound monitor started", accountId);
  }

  public void stop() {
    disposables.dispose();
  }

  public boolean isRunning() {
    return !disposables.isDisposed();
  }

  /** Runs one received line through every gate, then on to the agent. */
  public Completable handle(TransportEvent.LineReceived line) {
    return Completable.defer(() -> {
      String nick = Objects.toString(line.sender(), "");
      String target = Objects.toString(line.target(), "");

      if (nick.equalsIgnoreCase(connection.currentNickname())) {
        log.debug("[{}] ignoring own message to {}", accountId, target);
        return Completable.complete();
      }

      SanitizedText sanitized = IrcTextSanitizer.sanitize(line.text());
      if (sanitized.isDroppedCommand()) {
        log.debug("[{}] ignoring CTCP {} from {}", accountId, sanitized.command(), nick);
        return Completable.complete();
      }

      if (!IrcTextSanitizer.isValidContent(sanitized.cleanText(), maxContentLength)) {
        log.debug("[{}] rejecting invalid message from {}", accountId, nick);
        return Completable.complete();
      }

      AuthorizationResult auth = InboundAuthorizer.authorize(nick, target, connection.account());
      if (!auth.authorized()) {
        log.debug("[{}] dropping message from {} to {}: {}", accountId, nick, target, auth.reason());
        return Completable.complete();
      }

      boolean group = IrcTargets.isChannel(target);
      String replyTarget = group ? target : nick;

      RateLimitResult rate = rateLimiter.check(nick, rateLimit);
      if (rate.limited()) {
        if (!rate.shouldNotify()) {
          log.debug("[{}] rate limited {} (already notified)", accountId, nick);
          return Completable.complete();
        }
        log.info("[{}] rate limited {}, sending notice to {}", accountId, nick, replyTarget);
        return sender.send(connection, replyTarget, rateLimit.notice())
            .doOnError(err -> log.warn("[{}] could not send rate-limit notice to {}: {}",
                accountId, replyTarget, err.getMessage()))
            .onErrorComplete();
      }

      InboundMessage message = normalize(nick, target, sanitized);
      statusTracker.recordInbound(accountId);
      return forward(message);
    });
  }

  InboundMessage normalize(String nick, String target, SanitizedText sanitized) {
    boolean group = IrcTargets.isChannel(target);
    MentionExtractor.Mention mention = MentionExtractor.extract(sanitized.cleanText(), connection.currentNickname());
    String body = mention.cleanText().isEmpty() ? sanitized.cleanText() : mention.cleanText();
    String text = sanitized.isEmote() ? "* " + nick + " " + body : body;
    return new InboundMessage(
        accountId,
        nick,
        group ? ChatType.GROUP : ChatType.DIRECT,
        group ? IrcTargets.formatTarget(target) : nick,
        text,
        mention.mentioned(),
        group ? target : nick);
  }

  private Completable forward(InboundMessage message) {
    String sessionKey = SessionKeys.forChat(accountId, message.isGroup(), message.chatId(), message.senderId());
    AgentRequest request = new AgentRequest(accountId, sessionKey, message.text(),
        reply -> sender.send(connection, message.replyTarget(), reply));

    log.debug("[{}] forwarding {} message from {} (addressed={})",
        accountId, message.chatType(), message.senderId(), message.addressed());

    return agent.handle(request)
        .onErrorResumeNext(err -> reportFailure(message, err));
  }

  /** Logs the full failure under a fresh reference; the chat only ever sees the reference. */
  private Completable reportFailure(InboundMessage message, Throwable err) {
    String ref = UUID.randomUUID().toString().substring(0, 8);
    AgentInvocationException wrapped = (err instanceof AgentInvocationException a)
        ? a.withReference(ref)
        : new AgentInvocationException(ref, Objects.toString(err.getMessage(), err.toString()), err);
    log.error("[{}] error handling message from {} (ref: {})", accountId, message.senderId(), ref, wrapped);

    return sender.send(connection, message.replyTarget(), String.format(failureNotice, ref))
        .doOnError(e -> log.warn("[{}] could not deliver failure notice (ref: {}) to {}: {}",
            accountId, ref, message.replyTarget(), e.getMessage()))
        .onErrorComplete();
  }
}
