/**
 * Tiered read cache over the repositories.
 *
 * <p>{@link raffle.cache.CacheTier} doubles as the {@link raffle.spi.InvalidationHook} the
 * repositories call after each committed write.
 */
package raffle.cache;
