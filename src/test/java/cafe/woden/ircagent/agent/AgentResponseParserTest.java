package cafe.woden.ircagent.agent;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;
import org.junit.jupiter.api.Test;

class AgentResponseParserTest {

  @Test
  void prefersFirstPayloadText() {
    String json = """
        {"result": {"payloads": [{"text": "from payload"}, {"text": "second"}]},
         "text": "top level", "response": "legacy"}
        """;

    assertEquals(Optional.of("from payload"), AgentResponseParser.parse(json));
  }

  @Test
  void fallsBackToTextThenResponse() {
    assertEquals(Optional.of("top"), AgentResponseParser.parse("{\"result\":{\"payloads\":[]},\"text\":\"top\"}"));
    assertEquals(Optional.of("legacy"), AgentResponseParser.parse("{\"response\":\"legacy\"}"));
  }

  @Test
  void emptyOrMissingTextYieldsNothing() {
    assertTrue(AgentResponseParser.parse("{}").isEmpty());
    assertTrue(AgentResponseParser.parse("{\"text\":\"\"}").isEmpty());
    assertTrue(AgentResponseParser.parse("{\"text\":42}").isEmpty());
    assertTrue(AgentResponseParser.parse("  ").isEmpty());
    assertTrue(AgentResponseParser.parse(null).isEmpty());
    assertTrue(AgentResponseParser.parse("[\"not an object\"]").isEmpty());
  }

  @Test
  void nonJsonOutputIsAnInvocationFailure() {
    assertThrows(AgentInvocationException.class, () -> AgentResponseParser.parse("Error: gateway offline"));
  }
}
