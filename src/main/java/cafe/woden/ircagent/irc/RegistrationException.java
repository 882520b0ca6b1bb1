package cafe.woden.ircagent.irc;

/**
 * The server did not accept our identity, or the connection ended before it did.
 *
 * <p>{@link #code()} is the IRC numeric when the server sent one, otherwise 0.
 */
public class RegistrationException extends RuntimeException {

  private final int code;

  public RegistrationException(String message) {
    this(0, message);
  }

  public RegistrationException(int code, String message) {
    super(message);
    this.code = code;
  }

  public RegistrationException(String message, Throwable cause) {
    super(message, cause);
    this.code = 0;
  }

  public int code() {
    return code;
  }
}
