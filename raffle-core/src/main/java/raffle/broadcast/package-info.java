/**
 * Durable mass notification: {@link raffle.broadcast.BroadcastQueue} with a shared
 * {@link raffle.broadcast.RateLimiter} and per-recipient retry.
 */
package raffle.broadcast;
