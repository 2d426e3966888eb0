package raffle.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ParticipantValidatorTest {

  private static ParticipantRecord record(String name, String phone, String card) {
    return new ParticipantRecord(42L, name, phone, card, null);
  }

  @Test
  void acceptsWellFormedRecord() {
    assertTrue(ParticipantValidator.validate(
        record("Ivan Petrov", "+7 (900) 123-45-67", "AB123456")).isEmpty());
  }

  @Test
  void rejectsNonPositiveExternalId() {
    ParticipantRecord bad = new ParticipantRecord(0L, "Ivan Petrov", "+79001234567", "AB123456", null);
    assertEquals("externalId must be positive", ParticipantValidator.validate(bad).orElseThrow());
  }

  @Test
  void nameRules() {
    assertEquals("name must not be empty", ParticipantValidator.validateName("  ").orElseThrow());
    assertEquals("name is too short", ParticipantValidator.validateName("Al").orElseThrow());
    assertEquals("name is too long", ParticipantValidator.validateName("A " + "b".repeat(100)).orElseThrow());
    assertEquals("name must contain at least two words",
        ParticipantValidator.validateName("Ivan").orElseThrow());
    assertEquals("name must not contain digits",
        ParticipantValidator.validateName("Ivan Petrov2").orElseThrow());
    assertEquals("name contains disallowed characters",
        ParticipantValidator.validateName("Ivan @Petrov").orElseThrow());
    assertTrue(ParticipantValidator.validateName("Anna-Maria O'Neil").isEmpty());
  }

  @Test
  void phoneRules() {
    assertEquals("phone must not be empty", ParticipantValidator.validatePhone(null).orElseThrow());
    assertEquals("phone contains disallowed characters",
        ParticipantValidator.validatePhone("+7900abc4567").orElseThrow());
    assertEquals("phone is too short", ParticipantValidator.validatePhone("12345").orElseThrow());
    assertEquals("phone is too long",
        ParticipantValidator.validatePhone("+1234567890123456").orElseThrow());
    assertTrue(ParticipantValidator.validatePhone("8-900-123-45-67").isEmpty());
  }

  @Test
  void loyaltyCardRules() {
    assertEquals("loyalty card is too short",
        ParticipantValidator.validateLoyaltyCard("AB12").orElseThrow());
    assertEquals("loyalty card is too long",
        ParticipantValidator.validateLoyaltyCard("AB" + "1".repeat(19)).orElseThrow());
    assertEquals("loyalty card must be alphanumeric",
        ParticipantValidator.validateLoyaltyCard("AB-12345").orElseThrow());
    assertEquals("loyalty card must contain letters",
        ParticipantValidator.validateLoyaltyCard("12345678").orElseThrow());
    assertEquals("loyalty card must contain digits",
        ParticipantValidator.validateLoyaltyCard("ABCDEFGH").orElseThrow());
  }
}
