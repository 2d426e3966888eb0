package raffle.jdbc;

import raffle.ErrorKind;
import raffle.StoreResult;
import raffle.event.EventDispatcher;
import raffle.event.RaffleEvent;
import raffle.model.DuplicateKeys;
import raffle.model.Participant;
import raffle.model.ParticipantRecord;
import raffle.model.ParticipantSnapshot;
import raffle.model.ParticipantStatus;
import raffle.model.ParticipantValidator;
import raffle.spi.CacheKeys;
import raffle.spi.InvalidationHook;
import raffle.spi.ParticipantRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link ParticipantRepository} backed by the {@code participants} table.
 */
public final class JdbcParticipantRepository implements ParticipantRepository {
  private static final String COLUMNS = "id, external_id, full_name, phone, loyalty_card, "
      + "photo_ref, status, admin_note, created_at, updated_at";

  private static final JdbcTemplate.RowMapper<Participant> ROW_MAPPER = rs -> new Participant(
      rs.getLong("id"),
      rs.getLong("external_id"),
      rs.getString("full_name"),
      rs.getString("phone"),
      rs.getString("loyalty_card"),
      rs.getString("photo_ref"),
      ParticipantStatus.fromCode(rs.getString("status")),
      rs.getString("admin_note"),
      JdbcTemplate.instant(rs, "created_at"),
      JdbcTemplate.instant(rs, "updated_at"));

  private final ConnectionPool pool;
  private final InvalidationHook invalidation;
  private final EventDispatcher events;
  private final Clock clock;

  public JdbcParticipantRepository(ConnectionPool pool, InvalidationHook invalidation,
      EventDispatcher events, Clock clock) {
    this.pool = Objects.requireNonNull(pool, "pool");
    this.invalidation = Objects.requireNonNull(invalidation, "invalidation");
    this.events = Objects.requireNonNull(events, "events");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public StoreResult<Optional<ParticipantStatus>> getStatus(long externalId) {
    return pool.read(conn -> JdbcTemplate.queryOne(conn,
        "SELECT status FROM participants WHERE external_id = ?",
        rs -> ParticipantStatus.fromCode(rs.getString(1)), externalId));
  }

  @Override
  public StoreResult<Optional<Participant>> find(long externalId) {
    return pool.read(conn -> findParticipant(conn, externalId));
  }

  @Override
  public StoreResult<Integer> insertBatch(List<ParticipantRecord> records) {
    Objects.requireNonNull(records, "records");
    for (int i = 0; i < records.size(); i++) {
      Optional<String> violation = ParticipantValidator.validate(records.get(i));
      if (violation.isPresent()) {
        return StoreResult.failure(ErrorKind.VALIDATION, "record " + i + ": " + violation.get());
      }
    }
    if (records.isEmpty()) {
      return StoreResult.ok(0);
    }
    Instant now = clock.instant();
    StoreResult<Integer> result = pool.write(conn -> {
      try (PreparedStatement ps = conn.prepareStatement(
          "INSERT INTO participants (external_id, full_name, phone, loyalty_card, photo_ref, "
              + "status, created_at, updated_at) VALUES (?, ?, ?, ?, ?, 'pending', ?, ?)")) {
        for (ParticipantRecord record : records) {
          JdbcTemplate.bindParams(ps, record.externalId(), record.fullName().strip(),
              record.phone().strip(), record.loyaltyCard().strip(), record.photoRef(), now, now);
          ps.executeUpdate();
        }
      }
      return records.size();
    });
    if (result.isOk()) {
      invalidation.invalidate(CacheKeys.STATUS_COUNTS);
      for (ParticipantRecord record : records) {
        invalidation.invalidate(CacheKeys.participantStatus(record.externalId()));
      }
    }
    return describeConflict(result);
  }

  @Override
  public StoreResult<ParticipantStatus> updateStatus(long externalId, ParticipantStatus target,
      String note) {
    Objects.requireNonNull(target, "target");
    StoreResult<ParticipantStatus> result = pool.transact(conn -> {
      Optional<ParticipantStatus> current = lockStatus(conn, externalId);
      if (current.isEmpty()) {
        return StoreResult.failure(ErrorKind.VALIDATION, "participant not found: " + externalId);
      }
      ParticipantStatus from = current.get();
      if (!from.canTransitionTo(target)) {
        return StoreResult.failure(ErrorKind.VALIDATION,
            "cannot move participant " + externalId + " from " + from.code()
                + " to " + target.code());
      }
      JdbcTemplate.update(conn,
          "UPDATE participants SET status = ?, admin_note = COALESCE(?, admin_note), "
              + "updated_at = ? WHERE external_id = ?",
          target.code(), note, clock.instant(), externalId);
      return StoreResult.ok(from);
    });
    if (result instanceof StoreResult.Ok<ParticipantStatus> ok) {
      invalidateParticipant(externalId);
      events.publish(new RaffleEvent.ParticipantStatusChanged(
          externalId, ok.value(), target, note, clock.instant()));
    }
    return result;
  }

  @Override
  public StoreResult<Participant> resubmit(ParticipantRecord record) {
    Optional<String> violation = ParticipantValidator.validate(record);
    if (violation.isPresent()) {
      return StoreResult.failure(ErrorKind.VALIDATION, violation.get());
    }
    StoreResult<Participant> result = pool.transact(conn -> {
      Optional<ParticipantStatus> current = lockStatus(conn, record.externalId());
      if (current.isEmpty()) {
        return StoreResult.failure(ErrorKind.VALIDATION,
            "participant not found: " + record.externalId());
      }
      if (current.get() != ParticipantStatus.REJECTED) {
        return StoreResult.failure(ErrorKind.VALIDATION,
            "only rejected participants may resubmit, participant " + record.externalId()
                + " is " + current.get().code());
      }
      JdbcTemplate.update(conn,
          "UPDATE participants SET full_name = ?, phone = ?, loyalty_card = ?, photo_ref = ?, "
              + "status = 'pending', admin_note = NULL, updated_at = ? WHERE external_id = ?",
          record.fullName().strip(), record.phone().strip(), record.loyaltyCard().strip(),
          record.photoRef(), clock.instant(), record.externalId());
      return StoreResult.ok(findParticipant(conn, record.externalId()).orElseThrow());
    });
    if (result.isOk()) {
      invalidateParticipant(record.externalId());
      events.publish(new RaffleEvent.ParticipantStatusChanged(record.externalId(),
          ParticipantStatus.REJECTED, ParticipantStatus.PENDING, "resubmitted", clock.instant()));
    }
    return describeConflict(result);
  }

  @Override
  public StoreResult<ParticipantSnapshot> getApprovedSnapshot() {
    return pool.read(conn -> new ParticipantSnapshot(
        JdbcTemplate.query(conn,
            "SELECT id FROM participants WHERE status = 'approved' ORDER BY id",
            rs -> rs.getLong(1)),
        clock.instant()));
  }

  @Override
  public StoreResult<DuplicateKeys> findDuplicates(String phone, String loyaltyCard) {
    String normalizedPhone = phone == null ? "" : phone.strip();
    String normalizedCard = loyaltyCard == null ? "" : loyaltyCard.strip();
    return pool.read(conn -> JdbcTemplate.queryOne(conn,
        "SELECT (SELECT COUNT(*) FROM participants WHERE phone = ?), "
            + "(SELECT COUNT(*) FROM participants WHERE loyalty_card = ?)",
        rs -> new DuplicateKeys(rs.getInt(1), rs.getInt(2)),
        normalizedPhone, normalizedCard).orElse(new DuplicateKeys(0, 0)));
  }

  @Override
  public StoreResult<Map<ParticipantStatus, Integer>> countByStatus() {
    return pool.read(conn -> {
      Map<ParticipantStatus, Integer> counts = new EnumMap<>(ParticipantStatus.class);
      for (ParticipantStatus status : ParticipantStatus.values()) {
        counts.put(status, 0);
      }
      for (Map.Entry<ParticipantStatus, Integer> row : JdbcTemplate.query(conn,
          "SELECT status, COUNT(*) FROM participants GROUP BY status",
          rs -> Map.entry(ParticipantStatus.fromCode(rs.getString(1)), rs.getInt(2)))) {
        counts.put(row.getKey(), row.getValue());
      }
      return counts;
    });
  }

  private static Optional<Participant> findParticipant(Connection conn, long externalId)
      throws SQLException {
    return JdbcTemplate.queryOne(conn,
        "SELECT " + COLUMNS + " FROM participants WHERE external_id = ?", ROW_MAPPER, externalId);
  }

  private static Optional<ParticipantStatus> lockStatus(Connection conn, long externalId)
      throws SQLException {
    return JdbcTemplate.queryOne(conn,
        "SELECT status FROM participants WHERE external_id = ? FOR UPDATE",
        rs -> ParticipantStatus.fromCode(rs.getString(1)), externalId);
  }

  private void invalidateParticipant(long externalId) {
    invalidation.invalidate(CacheKeys.participantStatus(externalId));
    invalidation.invalidate(CacheKeys.STATUS_COUNTS);
    invalidation.invalidate(CacheKeys.APPROVED_SNAPSHOT);
  }

  private static <T> StoreResult<T> describeConflict(StoreResult<T> result) {
    if (!(result instanceof StoreResult.Failure<T> failure)
        || failure.kind() != ErrorKind.CONFLICT) {
      return result;
    }
    String message = failure.cause().message().toUpperCase(Locale.ROOT);
    String field;
    if (message.contains("UQ_PARTICIPANTS_PHONE") || message.contains("PARTICIPANTS(PHONE")) {
      field = "phone";
    } else if (message.contains("UQ_PARTICIPANTS_LOYALTY_CARD")
        || message.contains("PARTICIPANTS(LOYALTY_CARD")) {
      field = "loyalty card";
    } else if (message.contains("UQ_PARTICIPANTS_EXTERNAL_ID")
        || message.contains("PARTICIPANTS(EXTERNAL_ID")) {
      field = "external id";
    } else {
      return result;
    }
    return StoreResult.failure(ErrorKind.CONFLICT, "duplicate " + field,
        failure.cause().cause());
  }
}
