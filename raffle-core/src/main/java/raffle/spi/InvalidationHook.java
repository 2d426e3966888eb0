package raffle.spi;

/**
 * Callback invoked by repositories after a write commits, naming each cache key the write
 * made stale.
 *
 * @see CacheKeys
 */
@FunctionalInterface
public interface InvalidationHook {

  /** Hook that does nothing; used when no cache is configured. */
  InvalidationHook NONE = key -> {};

  void invalidate(String key);
}
