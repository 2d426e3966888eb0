package raffle.cache;

import org.junit.jupiter.api.Test;
import raffle.ErrorKind;
import raffle.StoreResult;
import raffle.model.ParticipantSnapshot;
import raffle.model.ParticipantStatus;
import raffle.spi.CacheKeys;
import raffle.stub.InMemoryBroadcastJobRepository;
import raffle.stub.InMemoryLotteryRunRepository;
import raffle.stub.InMemoryParticipantRepository;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class CachedReadsTest {

  private final CacheTier cache = CacheTier.builder().build();
  private final InMemoryParticipantRepository participants = new InMemoryParticipantRepository();
  private final CachedReads reads = new CachedReads(cache, participants,
      new InMemoryLotteryRunRepository(), new InMemoryBroadcastJobRepository());

  @Test
  void snapshotIsLoadedOnceUntilInvalidated() {
    participants.addApproved(1L, 2L);

    ParticipantSnapshot first = reads.approvedSnapshot().orElseThrow();
    participants.addApproved(3L);
    ParticipantSnapshot cached = reads.approvedSnapshot().orElseThrow();

    assertSame(first, cached);
    assertEquals(1, participants.snapshotReads.get());

    cache.invalidate(CacheKeys.APPROVED_SNAPSHOT);
    assertEquals(3, reads.approvedSnapshot().orElseThrow().size());
  }

  @Test
  void statusIsCachedPerParticipant() {
    participants.addApproved(7L);

    assertEquals(Optional.of(ParticipantStatus.APPROVED), reads.participantStatus(7L).orElseThrow());
    assertEquals(Optional.empty(), reads.participantStatus(8L).orElseThrow());
    assertNotNull(cache.getIfPresent(CacheKeys.participantStatus(7L), Tier.HOT));
  }

  @Test
  void failedReadIsReturnedAndNotCached() {
    AtomicBoolean failing = new AtomicBoolean(true);
    InMemoryParticipantRepository flaky = new InMemoryParticipantRepository() {
      @Override
      public StoreResult<ParticipantSnapshot> getApprovedSnapshot() {
        if (failing.get()) {
          return StoreResult.failure(ErrorKind.TRANSIENT, "database busy");
        }
        return super.getApprovedSnapshot();
      }
    };
    CachedReads flakyReads = new CachedReads(cache, flaky,
        new InMemoryLotteryRunRepository(), new InMemoryBroadcastJobRepository());

    StoreResult<ParticipantSnapshot> failed = flakyReads.approvedSnapshot();
    assertEquals(ErrorKind.TRANSIENT, failed.error().orElseThrow().kind());

    failing.set(false);
    assertTrue(flakyReads.approvedSnapshot().isOk());
  }

  @Test
  void countsCoverEveryStatus() {
    participants.addApproved(1L, 2L);

    var counts = reads.statusCounts().orElseThrow();

    assertEquals(2, counts.get(ParticipantStatus.APPROVED));
    assertEquals(0, counts.get(ParticipantStatus.PENDING));
  }
}
