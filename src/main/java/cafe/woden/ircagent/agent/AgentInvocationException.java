package cafe.woden.ircagent.agent;

/**
 * Any failure of the agent collaborator.
 *
 * <p>The message may contain process output and must stay in server logs. Chat users only ever
 * see the {@link #reference()}.
 */
public class AgentInvocationException extends RuntimeException {

  private final String reference;

  public AgentInvocationException(String message) {
    this(null, message, null);
  }

  public AgentInvocationException(String message, Throwable cause) {
    this(null, message, cause);
  }

  public AgentInvocationException(String reference, String message, Throwable cause) {
    super(message, cause);
    this.reference = reference;
  }

  /** Correlation reference, or null until one has been assigned. */
  public String reference() {
    return reference;
  }

  public AgentInvocationException withReference(String ref) {
    AgentInvocationException e = new AgentInvocationException(ref, getMessage(), getCause());
    e.setStackTrace(getStackTrace());
    return e;
  }
}
