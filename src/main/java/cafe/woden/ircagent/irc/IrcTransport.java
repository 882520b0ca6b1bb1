package cafe.woden.ircagent.irc;

import io.reactivex.rxjava3.core.Flowable;

/**
 * Lower-level IRC client the connection is layered on.
 *
 * <p>One transport serves one account and may be opened again after it closes. Implementations
 * publish exactly one {@link TransportEvent.SocketClosed} per opened session unless the session
 * was ended locally through {@link #close()}, in which case nothing more is published for it.
 */
public interface IrcTransport {

  Flowable<TransportEvent> events();

  /** Starts connecting in the background; progress is reported on {@link #events()}. */
  void open(TransportOptions options);

  void say(String target, String text);

  void join(String channel);

  void part(String channel);

  void quit(String reason);

  void close();
}
