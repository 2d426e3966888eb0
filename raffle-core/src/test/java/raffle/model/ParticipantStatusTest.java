package raffle.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ParticipantStatusTest {

  @Test
  void pendingMovesToApprovedOrRejected() {
    assertTrue(ParticipantStatus.PENDING.canTransitionTo(ParticipantStatus.APPROVED));
    assertTrue(ParticipantStatus.PENDING.canTransitionTo(ParticipantStatus.REJECTED));
    assertFalse(ParticipantStatus.PENDING.canTransitionTo(ParticipantStatus.PENDING));
  }

  @Test
  void rejectedMayOnlyBeResubmitted() {
    assertTrue(ParticipantStatus.REJECTED.canTransitionTo(ParticipantStatus.PENDING));
    assertFalse(ParticipantStatus.REJECTED.canTransitionTo(ParticipantStatus.APPROVED));
  }

  @Test
  void approvedIsFinal() {
    for (ParticipantStatus target : ParticipantStatus.values()) {
      assertFalse(ParticipantStatus.APPROVED.canTransitionTo(target), "to " + target);
    }
  }

  @Test
  void codesRoundTrip() {
    for (ParticipantStatus status : ParticipantStatus.values()) {
      assertEquals(status, ParticipantStatus.fromCode(status.code()));
    }
    assertThrows(IllegalArgumentException.class, () -> ParticipantStatus.fromCode("banned"));
  }
}
