package raffle.draw;

import raffle.util.Hashing;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Deterministic pseudo-random stream derived from a seed string.
 *
 * <p>Block {@code n} is {@code SHA-256(seed || n)} with {@code n} as a big-endian long.
 * Values are read from consecutive blocks, so a seed yields the same sequence on every JVM.
 * Not thread-safe.
 */
final class SeededStream {
  private final byte[] seed;
  private final MessageDigest digest = Hashing.sha256();
  private long counter;
  private ByteBuffer block = ByteBuffer.allocate(0);

  SeededStream(String seed) {
    this.seed = seed.getBytes(StandardCharsets.UTF_8);
  }

  long nextLong() {
    if (block.remaining() < Long.BYTES) {
      refill();
    }
    return block.getLong();
  }

  /**
   * Uniform int in {@code [0, bound)}. Rejection sampling keeps the distribution unbiased.
   */
  int nextInt(int bound) {
    if (bound <= 0) {
      throw new IllegalArgumentException("bound must be > 0, got: " + bound);
    }
    long limit = Long.MAX_VALUE - (Long.MAX_VALUE % bound);
    long value;
    do {
      value = nextLong() >>> 1;
    } while (value >= limit);
    return (int) (value % bound);
  }

  private void refill() {
    digest.reset();
    digest.update(seed);
    digest.update(ByteBuffer.allocate(Long.BYTES).putLong(counter++).array());
    block = ByteBuffer.wrap(digest.digest());
  }
}
