package raffle.draw;

import raffle.util.Hashing;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Produces draw seeds: SHA-256 over the current instant (nanosecond resolution) and 32 bytes
 * of entropy, as 64 lower-case hex characters.
 */
public final class SeedGenerator {
  private static final int ENTROPY_BYTES = 32;

  private final Clock clock;
  private final SecureRandom random;

  public SeedGenerator() {
    this(Clock.systemUTC(), new SecureRandom());
  }

  public SeedGenerator(Clock clock, SecureRandom random) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.random = Objects.requireNonNull(random, "random");
  }

  public String generate() {
    Instant now = clock.instant();
    byte[] entropy = new byte[ENTROPY_BYTES];
    random.nextBytes(entropy);

    MessageDigest digest = Hashing.sha256();
    digest.update((now.getEpochSecond() + "." + now.getNano()).getBytes(StandardCharsets.UTF_8));
    digest.update(entropy);
    return HexFormat.of().formatHex(digest.digest());
  }
}
