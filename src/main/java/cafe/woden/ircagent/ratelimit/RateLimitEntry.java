package cafe.woden.ircagent.ratelimit;

/**
 * Per-sender window. Replaced wholesale when the window elapses, never reset in place.
 */
record RateLimitEntry(int count, long windowResetAt, boolean notified) {

  static RateLimitEntry fresh(long now, long windowMs) {
    return new RateLimitEntry(1, now + windowMs, false);
  }

  boolean expired(long now) {
    return now >= windowResetAt;
  }

  RateLimitEntry increment() {
    return new RateLimitEntry(count + 1, windowResetAt, notified);
  }

  RateLimitEntry markNotified() {
    return new RateLimitEntry(count, windowResetAt, true);
  }
}
