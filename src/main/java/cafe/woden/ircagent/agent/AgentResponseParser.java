package cafe.woden.ircagent.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Optional;

/**
 * Extracts the reply text from the agent CLI's {@code --json} output.
 *
 * <p>Looks at {@code result.payloads[0].text}, then {@code text}, then {@code response}.
 */
public final class AgentResponseParser {

  private static final ObjectMapper JSON = new ObjectMapper();

  private AgentResponseParser() {}

  /**
   * @return the reply, or empty when the output is valid JSON without any text
   * @throws AgentInvocationException when the output is not JSON
   */
  public static Optional<String> parse(String stdout) {
    String s = stdout == null ? "" : stdout.trim();
    if (s.isEmpty()) return Optional.empty();

    JsonNode root;
    try {
      root = JSON.readTree(s);
    } catch (JsonProcessingException e) {
      throw new AgentInvocationException("Failed to parse agent response", e);
    }
    if (root == null || !root.isObject()) return Optional.empty();

    String text = textOf(root.path("result").path("payloads").path(0).path("text"));
    if (text == null) text = textOf(root.path("text"));
    if (text == null) text = textOf(root.path("response"));
    return Optional.ofNullable(text);
  }

  private static String textOf(JsonNode node) {
    if (node == null || !node.isTextual()) return null;
    String v = node.asText();
    return v.isEmpty() ? null : v;
  }
}
