package raffle.spring.boot;

import raffle.Raffle;
import raffle.RaffleConfig;
import raffle.broadcast.BroadcastQueue;
import raffle.cache.CacheTier;
import raffle.cache.CachedReads;
import raffle.draw.DrawEngine;
import raffle.event.EventDispatcher;
import raffle.fraud.FraudScorer;
import raffle.jdbc.PoolSettings;
import raffle.jdbc.RaffleDatabase;
import raffle.spi.DeliveryChannel;
import raffle.spi.MetricsExporter;

import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Conditional;

import java.nio.file.Path;

/**
 * Auto-configuration for the raffle core.
 *
 * <p>Opens the H2 database named by {@code raffle.database.url} or
 * {@code raffle.database.path}, applies migrations and wires a {@link Raffle} composite
 * from {@link RaffleProperties}. The broadcast queue exists only when the context holds a
 * {@link DeliveryChannel} bean.
 *
 * @see RaffleProperties
 * @see RaffleMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass({Raffle.class, RaffleDatabase.class})
@Conditional(OnDatabaseConfiguredCondition.class)
@EnableConfigurationProperties(RaffleProperties.class)
public class RaffleAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public PoolSettings rafflePoolSettings(RaffleProperties props) {
    RaffleProperties.Database db = props.getDatabase();
    PoolSettings.Builder builder = PoolSettings.builder()
        .username(db.getUsername())
        .password(db.getPassword())
        .poolSize(db.getPoolSize())
        .acquireTimeout(db.getAcquireTimeout())
        .busyTimeout(db.getBusyTimeout())
        .busyRetryAttempts(db.getBusyRetryAttempts());
    if (db.getUrl() != null && !db.getUrl().isBlank()) {
      builder.jdbcUrl(db.getUrl());
    } else {
      builder.databaseFile(Path.of(db.getPath()));
    }
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  public RaffleConfig raffleConfig(RaffleProperties props) {
    RaffleProperties.Broadcast broadcast = props.getBroadcast();
    RaffleProperties.Cache cache = props.getCache();
    return new RaffleConfig()
        .setBroadcastBatchSize(broadcast.getBatchSize())
        .setBroadcastPermitsPerSecond(broadcast.getPermitsPerSecond())
        .setBroadcastBurst(broadcast.getBurst())
        .setBroadcastMaxAttempts(broadcast.getMaxAttempts())
        .setBroadcastRetryBaseDelayMs(broadcast.getRetryBaseDelayMs())
        .setBroadcastRetryMaxDelayMs(broadcast.getRetryMaxDelayMs())
        .setBroadcastThrottleCooldownMs(broadcast.getThrottleCooldownMs())
        .setBroadcastWorkers(broadcast.getWorkerCount())
        .setBroadcastPollIntervalMs(broadcast.getPollIntervalMs())
        .setBroadcastDrainTimeoutMs(broadcast.getDrainTimeoutMs())
        .setCacheHotTtlSeconds(cache.getHot().getTtl().toSeconds())
        .setCacheHotMaxSize(cache.getHot().getMaxSize())
        .setCacheWarmTtlSeconds(cache.getWarm().getTtl().toSeconds())
        .setCacheWarmMaxSize(cache.getWarm().getMaxSize())
        .setCacheColdTtlSeconds(cache.getCold().getTtl().toSeconds())
        .setCacheColdMaxSize(cache.getCold().getMaxSize())
        .setCacheSingleFlightTimeoutMs(cache.getSingleFlightTimeout().toMillis());
  }

  @Bean
  @ConditionalOnMissingBean
  public EventDispatcher raffleEventDispatcher(ListableBeanFactory beanFactory) {
    return new RaffleListenerRegistrar(beanFactory).buildDispatcher();
  }

  @Bean
  @ConditionalOnMissingBean
  public CacheTier raffleCacheTier(RaffleConfig config,
      ObjectProvider<MetricsExporter> metricsProvider) {
    return Raffle.cacheTier(config, metricsProvider.getIfAvailable(() -> MetricsExporter.NOOP));
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public RaffleDatabase raffleDatabase(RaffleProperties props,
      PoolSettings settings,
      CacheTier cache,
      EventDispatcher events,
      ObjectProvider<MetricsExporter> metricsProvider) {
    return RaffleDatabase.builder()
        .settings(settings)
        .invalidation(cache)
        .events(events)
        .metrics(metricsProvider.getIfAvailable(() -> MetricsExporter.NOOP))
        .registrationStateMaxAge(props.getRegistrationState().getMaxAge())
        .open();
  }

  @Bean(initMethod = "start", destroyMethod = "close")
  @ConditionalOnMissingBean
  public Raffle raffle(RaffleConfig config,
      RaffleDatabase database,
      CacheTier cache,
      EventDispatcher events,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<DeliveryChannel> channelProvider) {
    return Raffle.builder()
        .config(config)
        .repositories(database.repositories())
        .cache(cache)
        .deliveryChannel(channelProvider.getIfAvailable())
        .events(events)
        .metrics(metricsProvider.getIfAvailable(() -> MetricsExporter.NOOP))
        .build();
  }

  @Bean
  @ConditionalOnMissingBean
  public DrawEngine drawEngine(Raffle raffle) {
    return raffle.drawEngine();
  }

  @Bean
  @ConditionalOnMissingBean
  public CachedReads cachedReads(Raffle raffle) {
    return raffle.reads();
  }

  @Bean
  @ConditionalOnMissingBean
  public FraudScorer fraudScorer(Raffle raffle) {
    return raffle.fraudScorer();
  }

  @Bean(destroyMethod = "")
  @ConditionalOnBean(DeliveryChannel.class)
  @ConditionalOnMissingBean
  public BroadcastQueue broadcastQueue(Raffle raffle) {
    return raffle.broadcastQueue().orElseThrow(
        () -> new IllegalStateException("Raffle was built without a delivery channel"));
  }
}
