package raffle.spi;

/**
 * Cache key names shared by repositories (which invalidate them) and cached readers.
 */
public final class CacheKeys {
  public static final String APPROVED_SNAPSHOT = "participants:approved";
  public static final String STATUS_COUNTS = "participants:counts";
  public static final String RECENT_RUNS = "lottery:runs";

  public static String participantStatus(long externalId) {
    return "participant:status:" + externalId;
  }

  public static String broadcastProgress(String jobId) {
    return "broadcast:job:" + jobId;
  }

  private CacheKeys() {}
}
