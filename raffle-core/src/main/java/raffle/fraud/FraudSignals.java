package raffle.fraud;

import java.time.Duration;
import java.util.Objects;

/**
 * Observations about one registration attempt, assembled by the caller.
 *
 * @param registrationTime     time from starting the registration to submitting it
 * @param duplicatePhone       whether the phone is already registered
 * @param duplicateLoyaltyCard whether the loyalty card is already registered
 * @param recentAttempts       registration attempts by the same user in the recent window
 * @param actionsLastHour      actions by the same user in the last hour
 * @param fullName             submitted full name
 * @param alreadyBlocked       whether the user is already blocked
 */
public record FraudSignals(
    Duration registrationTime,
    boolean duplicatePhone,
    boolean duplicateLoyaltyCard,
    int recentAttempts,
    int actionsLastHour,
    String fullName,
    boolean alreadyBlocked) {

  public FraudSignals {
    Objects.requireNonNull(registrationTime, "registrationTime");
    fullName = fullName == null ? "" : fullName;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Builder for {@link FraudSignals}; unset signals default to benign values. */
  public static final class Builder {
    private Duration registrationTime = Duration.ofMinutes(1);
    private boolean duplicatePhone;
    private boolean duplicateLoyaltyCard;
    private int recentAttempts;
    private int actionsLastHour;
    private String fullName = "";
    private boolean alreadyBlocked;

    private Builder() {}

    public Builder registrationTime(Duration registrationTime) {
      this.registrationTime = registrationTime;
      return this;
    }

    public Builder duplicatePhone(boolean duplicatePhone) {
      this.duplicatePhone = duplicatePhone;
      return this;
    }

    public Builder duplicateLoyaltyCard(boolean duplicateLoyaltyCard) {
      this.duplicateLoyaltyCard = duplicateLoyaltyCard;
      return this;
    }

    public Builder recentAttempts(int recentAttempts) {
      this.recentAttempts = recentAttempts;
      return this;
    }

    public Builder actionsLastHour(int actionsLastHour) {
      this.actionsLastHour = actionsLastHour;
      return this;
    }

    public Builder fullName(String fullName) {
      this.fullName = fullName;
      return this;
    }

    public Builder alreadyBlocked(boolean alreadyBlocked) {
      this.alreadyBlocked = alreadyBlocked;
      return this;
    }

    public FraudSignals build() {
      return new FraudSignals(registrationTime, duplicatePhone, duplicateLoyaltyCard,
          recentAttempts, actionsLastHour, fullName, alreadyBlocked);
    }
  }
}
