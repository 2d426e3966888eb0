/**
 * Verifiable prize draws.
 *
 * <p>{@link raffle.draw.DrawEngine} orchestrates a run; {@link raffle.draw.WinnerSelector}
 * is the pure, seeded selection anyone can replay; {@link raffle.draw.SeedGenerator}
 * produces the published seeds.
 */
package raffle.draw;
