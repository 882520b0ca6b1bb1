package cafe.woden.ircagent.ratelimit;

import org.jmolecules.ddd.annotation.ValueObject;

/** Snapshot of a sender's live window. */
@ValueObject
public record RateLimitStatus(int count, long remainingMs) {}
