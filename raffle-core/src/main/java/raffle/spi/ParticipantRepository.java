package raffle.spi;

import raffle.StoreResult;
import raffle.model.DuplicateKeys;
import raffle.model.Participant;
import raffle.model.ParticipantRecord;
import raffle.model.ParticipantSnapshot;
import raffle.model.ParticipantStatus;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistence for participants and their moderation status.
 *
 * <p>Every write runs in one transaction. Implementations invalidate the affected
 * {@link CacheKeys} through an {@link InvalidationHook} after commit.
 */
public interface ParticipantRepository {

  /**
   * Looks up the status of a participant by external id.
   *
   * @return empty when the participant is not registered
   */
  StoreResult<Optional<ParticipantStatus>> getStatus(long externalId);

  StoreResult<Optional<Participant>> find(long externalId);

  /**
   * Validates and inserts all records atomically.
   *
   * <p>A validation failure names the offending record index and inserts nothing. A duplicate
   * external id, phone or loyalty card (against stored rows or within the batch) fails the
   * whole batch with {@link raffle.ErrorKind#CONFLICT}.
   *
   * @return the number of inserted rows
   */
  StoreResult<Integer> insertBatch(List<ParticipantRecord> records);

  default StoreResult<Integer> insert(ParticipantRecord record) {
    return insertBatch(List.of(record));
  }

  /**
   * Moves a participant to {@code target}, rejecting transitions the status table forbids.
   *
   * @param note optional moderator note stored with the change
   * @return the status before the change
   */
  StoreResult<ParticipantStatus> updateStatus(long externalId, ParticipantStatus target, String note);

  /**
   * Replaces a rejected participant's details and returns it to {@code PENDING}.
   */
  StoreResult<Participant> resubmit(ParticipantRecord record);

  /**
   * Reads every approved participant id, ordered by id, in a single read.
   */
  StoreResult<ParticipantSnapshot> getApprovedSnapshot();

  StoreResult<DuplicateKeys> findDuplicates(String phone, String loyaltyCard);

  StoreResult<Map<ParticipantStatus, Integer>> countByStatus();
}
