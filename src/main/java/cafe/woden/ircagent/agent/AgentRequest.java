package cafe.woden.ircagent.agent;

import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * One accepted inbound message handed to the agent.
 *
 * @param sessionKey stable conversation key, see {@link SessionKeys}
 * @param text normalized message text
 * @param reply where to deliver the answer
 */
@ValueObject
public record AgentRequest(String accountId, String sessionKey, String text, ReplyCallback reply) {
  public AgentRequest {
    Objects.requireNonNull(sessionKey, "sessionKey");
    Objects.requireNonNull(text, "text");
    Objects.requireNonNull(reply, "reply");
  }
}
