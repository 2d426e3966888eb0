/**
 * Spring Boot auto-configuration for the raffle core.
 *
 * <p>{@link raffle.spring.boot.RaffleAutoConfiguration} wires the database, cache, draw
 * engine and broadcast queue from {@code raffle.*} properties.
 * {@link raffle.spring.boot.RaffleMicrometerAutoConfiguration} adds Micrometer counters.
 */
package raffle.spring.boot;
