package raffle.stub;

import raffle.ErrorKind;
import raffle.StoreResult;
import raffle.fraud.FraudScore;
import raffle.model.FraudLogEntry;
import raffle.spi.FraudLogRepository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * FraudLogRepository held in memory for unit tests that don't need real JDBC.
 */
public class InMemoryFraudLogRepository implements FraudLogRepository {
  private final List<FraudLogEntry> entries = new ArrayList<>();
  public volatile boolean failWrites;

  @Override
  public synchronized StoreResult<Long> record(long externalId, FraudScore score) {
    if (failWrites) {
      return StoreResult.failure(ErrorKind.TRANSIENT, "database busy");
    }
    long id = entries.size() + 1L;
    entries.add(new FraudLogEntry(id, externalId, score.value(), score.verdict(), score.reasons(),
        Instant.now()));
    return StoreResult.ok(id);
  }

  @Override
  public synchronized StoreResult<List<FraudLogEntry>> recent(long externalId, int limit) {
    List<FraudLogEntry> result = new ArrayList<>();
    for (int i = entries.size() - 1; i >= 0 && result.size() < limit; i--) {
      if (entries.get(i).externalId() == externalId) {
        result.add(entries.get(i));
      }
    }
    return StoreResult.ok(result);
  }
}
