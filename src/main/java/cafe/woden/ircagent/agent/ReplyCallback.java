package cafe.woden.ircagent.agent;

import io.reactivex.rxjava3.core.Completable;

/** Sends agent reply text back to where the inbound message came from. */
@FunctionalInterface
public interface ReplyCallback {
  Completable reply(String text);
}
