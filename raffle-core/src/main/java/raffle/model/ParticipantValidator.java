package raffle.model;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Field rules applied to every participant record before it reaches the datastore.
 *
 * <p>Each check returns the first violation found, or empty when the value is acceptable.
 */
public final class ParticipantValidator {
  private static final Pattern DIGIT = Pattern.compile("\\d");
  private static final Pattern NAME_SPECIALS = Pattern.compile("[!@#$%^&*()+=\\[\\]{};:\",<>?/\\\\|`~]");
  private static final Pattern PHONE_SEPARATORS = Pattern.compile("[\\s\\-()]+");
  private static final Pattern CARD = Pattern.compile("^[A-Za-z0-9]+$");
  private static final Pattern LETTER = Pattern.compile("[A-Za-z]");

  public static Optional<String> validate(ParticipantRecord record) {
    if (record == null) {
      return Optional.of("record must not be null");
    }
    if (record.externalId() <= 0) {
      return Optional.of("externalId must be positive");
    }
    Optional<String> violation = validateName(record.fullName());
    if (violation.isPresent()) return violation;
    violation = validatePhone(record.phone());
    if (violation.isPresent()) return violation;
    return validateLoyaltyCard(record.loyaltyCard());
  }

  public static Optional<String> validateName(String name) {
    if (name == null || name.isBlank()) {
      return Optional.of("name must not be empty");
    }
    String trimmed = name.strip();
    if (trimmed.length() < 3) {
      return Optional.of("name is too short");
    }
    if (trimmed.length() > 100) {
      return Optional.of("name is too long");
    }
    if (trimmed.split("\\s+").length < 2) {
      return Optional.of("name must contain at least two words");
    }
    if (DIGIT.matcher(trimmed).find()) {
      return Optional.of("name must not contain digits");
    }
    if (NAME_SPECIALS.matcher(trimmed).find()) {
      return Optional.of("name contains disallowed characters");
    }
    return Optional.empty();
  }

  public static Optional<String> validatePhone(String phone) {
    if (phone == null || phone.isBlank()) {
      return Optional.of("phone must not be empty");
    }
    String digits = PHONE_SEPARATORS.matcher(phone.strip()).replaceAll("");
    if (digits.startsWith("+")) {
      digits = digits.substring(1);
    }
    if (digits.isEmpty() || !digits.chars().allMatch(Character::isDigit)) {
      return Optional.of("phone contains disallowed characters");
    }
    if (digits.length() < 7) {
      return Optional.of("phone is too short");
    }
    if (digits.length() > 15) {
      return Optional.of("phone is too long");
    }
    return Optional.empty();
  }

  public static Optional<String> validateLoyaltyCard(String card) {
    if (card == null || card.isBlank()) {
      return Optional.of("loyalty card must not be empty");
    }
    String trimmed = card.strip();
    if (trimmed.length() < 6) {
      return Optional.of("loyalty card is too short");
    }
    if (trimmed.length() > 20) {
      return Optional.of("loyalty card is too long");
    }
    if (!CARD.matcher(trimmed).matches()) {
      return Optional.of("loyalty card must be alphanumeric");
    }
    if (!LETTER.matcher(trimmed).find()) {
      return Optional.of("loyalty card must contain letters");
    }
    if (!DIGIT.matcher(trimmed).find()) {
      return Optional.of("loyalty card must contain digits");
    }
    return Optional.empty();
  }

  private ParticipantValidator() {}
}
