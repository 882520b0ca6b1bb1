package cafe.woden.ircagent.status;

import java.time.Instant;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * Host-facing runtime status of one account. Timestamps are null until the first occurrence.
 */
@ValueObject
public record AccountStatus(
    String accountId,
    boolean running,
    Instant lastStartAt,
    Instant lastStopAt,
    String lastError,
    Instant lastInboundAt,
    Instant lastOutboundAt
) {

  static AccountStatus initial(String accountId) {
    return new AccountStatus(accountId, false, null, null, null, null, null);
  }

  AccountStatus started(Instant at) {
    return new AccountStatus(accountId, true, at, lastStopAt, null, lastInboundAt, lastOutboundAt);
  }

  AccountStatus stopped(Instant at) {
    return new AccountStatus(accountId, false, lastStartAt, at, lastError, lastInboundAt, lastOutboundAt);
  }

  AccountStatus withError(String error) {
    return new AccountStatus(accountId, running, lastStartAt, lastStopAt, error, lastInboundAt, lastOutboundAt);
  }

  AccountStatus inbound(Instant at) {
    return new AccountStatus(accountId, running, lastStartAt, lastStopAt, lastError, at, lastOutboundAt);
  }

  AccountStatus outbound(Instant at) {
    return new AccountStatus(accountId, running, lastStartAt, lastStopAt, lastError, lastInboundAt, at);
  }

  public boolean hasError() {
    return lastError != null && !lastError.isBlank();
  }
}
