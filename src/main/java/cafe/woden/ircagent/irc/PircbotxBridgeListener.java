package cafe.woden.ircagent.irc;

import java.util.Objects;
import java.util.function.Consumer;
import org.pircbotx.PircBotX;
import org.pircbotx.hooks.ListenerAdapter;
import org.pircbotx.hooks.events.ActionEvent;
import org.pircbotx.hooks.events.ConnectAttemptFailedEvent;
import org.pircbotx.hooks.events.ConnectEvent;
import org.pircbotx.hooks.events.DisconnectEvent;
import org.pircbotx.hooks.events.FingerEvent;
import org.pircbotx.hooks.events.JoinEvent;
import org.pircbotx.hooks.events.KickEvent;
import org.pircbotx.hooks.events.MessageEvent;
import org.pircbotx.hooks.events.NickChangeEvent;
import org.pircbotx.hooks.events.PartEvent;
import org.pircbotx.hooks.events.PrivateMessageEvent;
import org.pircbotx.hooks.events.ServerResponseEvent;
import org.pircbotx.hooks.types.GenericCTCPEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * PircBotX listener that translates raw events into the {@link TransportEvent} stream.
 *
 * <p>PircBotX dispatches listener callbacks on a single thread per bot, so events for one
 * account are published in wire order.
 */
final class PircbotxBridgeListener extends ListenerAdapter {
  private static final Logger log = LoggerFactory.getLogger(PircbotxBridgeListener.class);

  // 464 = ERR_PASSWDMISMATCH
  // 465 = ERR_YOUREBANNEDCREEP
  // 904 = ERR_SASLFAIL
  // 905 = ERR_SASLTOOLONG
  // 906 = ERR_SASLABORTED
  // 907 = ERR_SASLALREADY
  static boolean isIdentityRejectedNumeric(int code) {
    return code == 464
        || code == 465
        || code == 904
        || code == 905
        || code == 906
        || code == 907;
  }

  private final String accountId;
  private final Consumer<TransportEvent> emit;
  private final Consumer<String> closed;

  PircbotxBridgeListener(String accountId, Consumer<TransportEvent> emit, Consumer<String> closed) {
    this.accountId = Objects.requireNonNull(accountId, "accountId");
    this.emit = Objects.requireNonNull(emit, "emit");
    this.closed = Objects.requireNonNull(closed, "closed");
  }

  @Override
  public void onConnect(ConnectEvent event) {
    PircBotX bot = event.getBot();
    emit.accept(new TransportEvent.Registered(bot.getNick()));
  }

  @Override
  public void onDisconnect(DisconnectEvent event) {
    Exception ex = event.getDisconnectException();
    String reason = (ex != null && ex.getMessage() != null) ? ex.getMessage() : "Disconnected";
    closed.accept(reason);
  }

  @Override
  public void onConnectAttemptFailed(ConnectAttemptFailedEvent event) {
    Exception first = event.getConnectExceptions().values().stream().findFirst().orElse(null);
    String msg = (first != null && first.getMessage() != null) ? first.getMessage() : "Connect attempt failed";
    emit.accept(new TransportEvent.SocketError(msg, first));
  }

  @Override
  public void onMessage(MessageEvent event) {
    String from = PircbotxUtil.nickOf(event.getUser());
    emit.accept(new TransportEvent.LineReceived(from, event.getChannel().getName(), event.getMessage()));
  }

  @Override
  public void onPrivateMessage(PrivateMessageEvent event) {
    String from = PircbotxUtil.nickOf(event.getUser());
    emit.accept(new TransportEvent.LineReceived(from, event.getBot().getNick(), event.getMessage()));
  }

  @Override
  public void onAction(ActionEvent event) {
    // PircBotX unwraps CTCP ACTION for us; restore the wrapper so the sanitizer sees the wire form.
    String from = PircbotxUtil.nickOf(event.getUser());
    String action = PircbotxUtil.safeStr(event::getAction, "");
    String target = (event.getChannel() != null) ? event.getChannel().getName() : event.getBot().getNick();
    emit.accept(new TransportEvent.LineReceived(from, target, PircbotxUtil.ctcpWrap("ACTION", action)));
  }

  @Override
  public void onGenericCTCP(GenericCTCPEvent event) throws Exception {
    if (event instanceof ActionEvent) return;
    String cmd = PircbotxUtil.ctcpCommandFromEvent(event);
    log.debug("[{}] CTCP {} from {}", accountId, cmd, PircbotxUtil.nickOf(event.getUser()));
    emitCtcp(event.getBot(), event.getUser() == null ? "" : PircbotxUtil.nickOf(event.getUser()),
        event.getChannel() == null ? null : event.getChannel().getName(), cmd);
    // Let the library answer VERSION/PING/TIME.
    super.onGenericCTCP(event);
  }

  // FingerEvent is a CTCP request, but in PircBotX it is not part of the GenericCTCPEvent hierarchy.
  @Override
  public void onFinger(FingerEvent event) throws Exception {
    log.debug("[{}] CTCP FINGER from {}", accountId, PircbotxUtil.nickOf(event.getUser()));
    emitCtcp(event.getBot(), PircbotxUtil.nickOf(event.getUser()),
        event.getChannel() == null ? null : event.getChannel().getName(), "FINGER");
    super.onFinger(event);
  }

  private void emitCtcp(PircBotX bot, String from, String channel, String cmd) {
    String target = (channel != null) ? channel : bot.getNick();
    emit.accept(new TransportEvent.LineReceived(from, target, PircbotxUtil.ctcpWrap(cmd, null)));
  }

  @Override
  public void onJoin(JoinEvent event) {
    emit.accept(new TransportEvent.JoinedChannel(
        event.getChannel().getName(),
        PircbotxUtil.nickOf(event.getUser())));
  }

  @Override
  public void onPart(PartEvent event) {
    emit.accept(new TransportEvent.PartedChannel(
        event.getChannel().getName(),
        PircbotxUtil.nickOf(event.getUser())));
  }

  @Override
  public void onKick(KickEvent event) {
    emit.accept(new TransportEvent.Kicked(
        event.getChannel().getName(),
        PircbotxUtil.nickOf(event.getRecipient()),
        PircbotxUtil.nickOf(event.getUser()),
        event.getReason()));
  }

  @Override
  public void onNickChange(NickChangeEvent event) {
    emit.accept(new TransportEvent.NickChanged(event.getOldNick(), event.getNewNick()));
  }

  @Override
  public void onServerResponse(ServerResponseEvent event) {
    int code = event.getCode();
    if (!isIdentityRejectedNumeric(code)) return;
    String line = PircbotxUtil.safeStr(event::getRawLine, "");
    emit.accept(new TransportEvent.ProtocolError(code, trailingText(line, "Server rejected registration (" + code + ")")));
  }

  /** Most numeric lines look like: ":server.name 904 nick :SASL authentication failed". */
  static String trailingText(String rawLine, String fallback) {
    if (rawLine == null || rawLine.isBlank()) return fallback;
    String s = rawLine.startsWith(":") ? rawLine.substring(1) : rawLine;
    int idx = s.indexOf(" :");
    if (idx < 0) return fallback;
    String trailing = s.substring(idx + 2).trim();
    return trailing.isEmpty() ? fallback : trailing;
  }
}
