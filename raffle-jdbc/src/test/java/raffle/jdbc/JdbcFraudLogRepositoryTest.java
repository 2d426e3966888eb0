package raffle.jdbc;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import raffle.ErrorKind;
import raffle.fraud.FraudScore;
import raffle.fraud.Verdict;
import raffle.model.FraudLogEntry;
import raffle.spi.FraudLogRepository;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JdbcFraudLogRepositoryTest {
  private RaffleDatabase db;
  private FraudLogRepository fraudLog;

  @BeforeEach
  void setup() {
    db = RaffleDatabase.builder()
        .settings(TestDatabases.memory())
        .clock(new MutableClock(Instant.parse("2026-03-01T10:00:00Z")))
        .open();
    fraudLog = db.repositories().fraudLog();
  }

  @AfterEach
  void tearDown() {
    db.close();
  }

  @Test
  void entriesAreReturnedNewestFirst() {
    long first = fraudLog.record(7, new FraudScore(0.5, Verdict.FLAG,
        List.of("duplicate phone"))).orElseThrow();
    long second = fraudLog.record(7, new FraudScore(1.0, Verdict.BLOCK,
        List.of("duplicate phone", "suspicious name pattern: bot"))).orElseThrow();
    fraudLog.record(8, new FraudScore(0.6, Verdict.FLAG, List.of("x"))).orElseThrow();

    List<FraudLogEntry> entries = fraudLog.recent(7, 10).orElseThrow();
    assertEquals(2, entries.size());
    assertEquals(second, entries.get(0).id());
    assertEquals(first, entries.get(1).id());

    FraudLogEntry latest = entries.get(0);
    assertEquals(7, latest.externalId());
    assertEquals(1.0, latest.score(), 1e-9);
    assertEquals(Verdict.BLOCK, latest.verdict());
    assertEquals(List.of("duplicate phone", "suspicious name pattern: bot"), latest.reasons());
    assertEquals(Instant.parse("2026-03-01T10:00:00Z"), latest.detectedAt());

    assertEquals(1, fraudLog.recent(7, 1).orElseThrow().size());
  }

  @Test
  void scoreWithoutReasonsRoundTrips() {
    fraudLog.record(9, new FraudScore(0.0, Verdict.PASS, List.of())).orElseThrow();
    assertEquals(List.of(), fraudLog.recent(9, 5).orElseThrow().get(0).reasons());
  }

  @Test
  void limitMustBePositive() {
    assertEquals(ErrorKind.VALIDATION, fraudLog.recent(1, 0).error().orElseThrow().kind());
  }
}
