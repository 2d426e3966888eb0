/**
 * H2 persistence: the {@link raffle.jdbc.ConnectionPool} with its single-writer gate, schema
 * migrations and the JDBC repository implementations.
 *
 * <p>{@link raffle.jdbc.RaffleDatabase} opens all of them as one closeable unit.
 */
package raffle.jdbc;
