package raffle.spi;

import raffle.StoreResult;
import raffle.fraud.FraudScore;
import raffle.model.FraudLogEntry;

import java.util.List;

/**
 * Audit trail of fraud scores.
 */
public interface FraudLogRepository {

  /** @return the generated log id */
  StoreResult<Long> record(long externalId, FraudScore score);

  /** Most recent entries first. */
  StoreResult<List<FraudLogEntry>> recent(long externalId, int limit);
}
