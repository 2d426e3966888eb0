package raffle.spi;

import java.util.Objects;

/**
 * The set of repositories a {@link raffle.Raffle} is assembled from.
 */
public record Repositories(
    ParticipantRepository participants,
    LotteryRunRepository lotteryRuns,
    BroadcastJobRepository broadcastJobs,
    RegistrationStateRepository registrationStates,
    FraudLogRepository fraudLog) {

  public Repositories {
    Objects.requireNonNull(participants, "participants");
    Objects.requireNonNull(lotteryRuns, "lotteryRuns");
    Objects.requireNonNull(broadcastJobs, "broadcastJobs");
    Objects.requireNonNull(registrationStates, "registrationStates");
    Objects.requireNonNull(fraudLog, "fraudLog");
  }
}
