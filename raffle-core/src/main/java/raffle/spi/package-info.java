/**
 * Service provider interfaces.
 *
 * <ul>
 *   <li>Repositories: {@link raffle.spi.ParticipantRepository},
 *       {@link raffle.spi.LotteryRunRepository}, {@link raffle.spi.BroadcastJobRepository},
 *       {@link raffle.spi.RegistrationStateRepository}, {@link raffle.spi.FraudLogRepository}</li>
 *   <li>{@link raffle.spi.DeliveryChannel}: the outbound messaging transport</li>
 *   <li>{@link raffle.spi.InvalidationHook}: post-commit cache invalidation</li>
 *   <li>{@link raffle.spi.MetricsExporter}: counters</li>
 * </ul>
 */
package raffle.spi;
