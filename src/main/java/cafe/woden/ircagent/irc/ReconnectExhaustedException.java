package cafe.woden.ircagent.irc;

/** Terminal: every reconnect attempt failed. Recovery needs an operator. */
public class ReconnectExhaustedException extends RuntimeException {

  private final int attempts;

  public ReconnectExhaustedException(String accountId, int attempts) {
    super("Reconnect aborted for account " + accountId + " (max attempts reached: " + attempts + ")");
    this.attempts = attempts;
  }

  public int attempts() {
    return attempts;
  }
}
