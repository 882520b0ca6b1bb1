package cafe.woden.ircagent.agent;

import io.reactivex.rxjava3.core.Completable;

/**
 * The conversational agent. Completes once any reply has been delivered through
 * {@link AgentRequest#reply()}; any failure is reported as an error signal.
 */
public interface AgentClient {
  Completable handle(AgentRequest request);
}
