package cafe.woden.ircagent.ratelimit;

import org.jmolecules.ddd.annotation.ValueObject;

/**
 * Outcome of a rate-limit check. {@code shouldNotify} is true at most once per window.
 */
@ValueObject
public record RateLimitResult(boolean limited, boolean shouldNotify) {

  public static final RateLimitResult ALLOWED = new RateLimitResult(false, false);
  public static final RateLimitResult LIMITED_NOTIFY = new RateLimitResult(true, true);
  public static final RateLimitResult LIMITED_SILENT = new RateLimitResult(true, false);
}
