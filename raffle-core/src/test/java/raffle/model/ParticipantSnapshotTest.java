package raffle.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ParticipantSnapshotTest {

  @Test
  void isIsolatedFromSourceList() {
    List<Long> ids = new ArrayList<>(List.of(1L, 2L, 3L));
    ParticipantSnapshot snapshot = new ParticipantSnapshot(ids, Instant.EPOCH);

    ids.add(4L);

    assertEquals(3, snapshot.size());
    assertThrows(UnsupportedOperationException.class, () -> snapshot.participantIds().add(5L));
  }

  @Test
  void digestDependsOnOrder() {
    ParticipantSnapshot a = new ParticipantSnapshot(List.of(1L, 2L, 3L), Instant.EPOCH);
    ParticipantSnapshot b = new ParticipantSnapshot(List.of(1L, 2L, 3L), Instant.now());
    ParticipantSnapshot c = new ParticipantSnapshot(List.of(3L, 2L, 1L), Instant.EPOCH);

    assertEquals(64, a.digest().length());
    assertEquals(a.digest(), b.digest());
    assertNotEquals(a.digest(), c.digest());
  }
}
