package raffle.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import raffle.Raffle;
import raffle.broadcast.BroadcastQueue;
import raffle.cache.CacheTier;
import raffle.cache.CachedReads;
import raffle.draw.DrawEngine;
import raffle.draw.DrawOutcome;
import raffle.event.EventDispatcher;
import raffle.event.EventListener;
import raffle.event.EventType;
import raffle.event.RaffleEvent;
import raffle.fraud.FraudScorer;
import raffle.jdbc.PoolSettings;
import raffle.jdbc.RaffleDatabase;
import raffle.jdbc.SchemaMigrator;
import raffle.micrometer.MicrometerMetricsExporter;
import raffle.model.ParticipantRecord;
import raffle.model.ParticipantStatus;
import raffle.spi.DeliveryChannel;
import raffle.spi.DeliveryOutcome;
import raffle.spi.MetricsExporter;
import raffle.spi.Repositories;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class RaffleAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(
          RaffleMicrometerAutoConfiguration.class,
          RaffleAutoConfiguration.class))
      .withPropertyValues(
          "raffle.database.url=jdbc:h2:mem:raffle_auto_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1",
          "raffle.database.pool-size=4");

  @Test
  void createsAllBeans() {
    runner.run(ctx -> {
      assertTrue(ctx.containsBean("rafflePoolSettings"));
      assertTrue(ctx.containsBean("raffleConfig"));
      assertTrue(ctx.containsBean("raffleEventDispatcher"));
      assertTrue(ctx.containsBean("raffleCacheTier"));
      assertTrue(ctx.containsBean("raffleDatabase"));
      assertTrue(ctx.containsBean("raffle"));

      assertInstanceOf(Raffle.class, ctx.getBean(Raffle.class));
      assertInstanceOf(DrawEngine.class, ctx.getBean(DrawEngine.class));
      assertInstanceOf(CachedReads.class, ctx.getBean(CachedReads.class));
      assertInstanceOf(FraudScorer.class, ctx.getBean(FraudScorer.class));
      assertInstanceOf(CacheTier.class, ctx.getBean(CacheTier.class));
      assertEquals(SchemaMigrator.latestVersion(), ctx.getBean(RaffleDatabase.class).schemaVersion());
    });
  }

  @Test
  void bindsDatabaseProperties() {
    runner
        .withPropertyValues("raffle.database.busy-timeout=2s",
            "raffle.database.busy-retry-attempts=1")
        .run(ctx -> {
          PoolSettings settings = ctx.getBean(PoolSettings.class);
          assertEquals(4, settings.poolSize());
          assertEquals(Duration.ofSeconds(2), settings.busyTimeout());
          assertEquals(1, settings.busyRetryAttempts());
        });
  }

  @Test
  void databasePathOpensFileDatabase(@TempDir Path dir) {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(RaffleAutoConfiguration.class))
        .withPropertyValues("raffle.database.path=" + dir.resolve("raffle").toAbsolutePath())
        .run(ctx -> {
          assertNull(ctx.getStartupFailure());
          assertTrue(ctx.getBean(PoolSettings.class).jdbcUrl().startsWith("jdbc:h2:file:"));
        });
  }

  @Test
  void noBroadcastQueueWithoutDeliveryChannel() {
    runner.run(ctx -> {
      assertFalse(ctx.containsBean("broadcastQueue"));
      assertTrue(ctx.getBean(Raffle.class).broadcastQueue().isEmpty());
    });
  }

  @Test
  void broadcastQueueWithDeliveryChannel() {
    runner.withUserConfiguration(ChannelConfig.class).run(ctx -> {
      assertTrue(ctx.containsBean("broadcastQueue"));
      assertSame(ctx.getBean(Raffle.class).broadcastQueue().orElseThrow(),
          ctx.getBean(BroadcastQueue.class));
    });
  }

  @Test
  void listenersReceiveEventsFilteredByAnnotation() {
    runner.withUserConfiguration(ListenerConfig.class).run(ctx -> {
      EventDispatcher events = ctx.getBean(EventDispatcher.class);
      assertEquals(2, events.listenerCount(EventType.DRAW_COMPLETED));
      assertEquals(1, events.listenerCount(EventType.BROADCAST_FINISHED));

      Repositories repositories = ctx.getBean(RaffleDatabase.class).repositories();
      for (long id = 1; id <= 3; id++) {
        repositories.participants().insert(new ParticipantRecord(id, "Anna Ivanova",
            String.format("+7900%07d", id), String.format("LC%06d", id), null)).orElseThrow();
        repositories.participants().updateStatus(id, ParticipantStatus.APPROVED, null)
            .orElseThrow();
      }

      DrawOutcome outcome = ctx.getBean(DrawEngine.class).runDraw("spring-draw", 2);
      assertInstanceOf(DrawOutcome.Completed.class, outcome);

      DrawListener drawListener = ctx.getBean(DrawListener.class);
      assertEquals(1, drawListener.received.size());
      assertEquals("spring-draw",
          ((RaffleEvent.DrawCompleted) drawListener.received.get(0)).runId());
      assertTrue(ctx.getBean(AllListener.class).received.stream()
          .anyMatch(e -> e.type() == EventType.DRAW_COMPLETED));
    });
  }

  @Test
  void micrometerExporterWhenRegistryPresent() {
    runner.withUserConfiguration(MeterRegistryConfig.class).run(ctx -> {
      assertInstanceOf(MicrometerMetricsExporter.class, ctx.getBean(MetricsExporter.class));
      MeterRegistry registry = ctx.getBean(MeterRegistry.class);
      assertNotNull(registry.find("raffle.draw.completed").counter());
    });
  }

  @Test
  void metricsCanBeDisabled() {
    runner
        .withPropertyValues("raffle.metrics.enabled=false")
        .withUserConfiguration(MeterRegistryConfig.class).run(ctx -> {
          assertFalse(ctx.containsBean("micrometerMetricsExporter"));
          assertTrue(ctx.containsBean("raffle"));
        });
  }

  @Test
  void customMetricsPrefix() {
    runner
        .withPropertyValues("raffle.metrics.name-prefix=shop.raffle")
        .withUserConfiguration(MeterRegistryConfig.class).run(ctx -> {
          MeterRegistry registry = ctx.getBean(MeterRegistry.class);
          assertNotNull(registry.find("shop.raffle.draw.completed").counter());
        });
  }

  @Test
  void notLoadedWithoutDatabase() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(RaffleAutoConfiguration.class))
        .run(ctx -> {
          assertFalse(ctx.containsBean("raffle"));
        });
  }

  @Test
  void invalidPoolSizeFailsStartup() {
    runner
        .withPropertyValues("raffle.database.pool-size=0")
        .run(ctx -> {
          assertNotNull(ctx.getStartupFailure());
          assertInstanceOf(IllegalArgumentException.class,
              findRootCause(ctx.getStartupFailure()));
        });
  }

  @Test
  void respectsConditionalOnMissingBean() {
    runner.withUserConfiguration(CustomEventsConfig.class).run(ctx -> {
      assertEquals("myEvents", ctx.getBeanNamesForType(EventDispatcher.class)[0]);
      assertEquals(1, ctx.getBeanNamesForType(EventDispatcher.class).length);
    });
  }

  // ── Test configurations ──────────────────────────────────────

  @RaffleListener(EventType.DRAW_COMPLETED)
  static class DrawListener implements EventListener {
    final List<RaffleEvent> received = new CopyOnWriteArrayList<>();

    @Override
    public void onEvent(RaffleEvent event) {
      received.add(event);
    }
  }

  static class AllListener implements EventListener {
    final List<RaffleEvent> received = new CopyOnWriteArrayList<>();

    @Override
    public void onEvent(RaffleEvent event) {
      received.add(event);
    }
  }

  @Configuration
  static class ListenerConfig {
    @Bean
    DrawListener drawListener() {
      return new DrawListener();
    }

    @Bean
    AllListener allListener() {
      return new AllListener();
    }
  }

  @Configuration
  static class ChannelConfig {
    @Bean
    DeliveryChannel deliveryChannel() {
      return (recipient, message) -> DeliveryOutcome.delivered();
    }
  }

  @Configuration
  static class MeterRegistryConfig {
    @Bean
    MeterRegistry meterRegistry() {
      return new SimpleMeterRegistry();
    }
  }

  @Configuration
  static class CustomEventsConfig {
    @Bean("myEvents")
    EventDispatcher myEvents() {
      return EventDispatcher.NONE;
    }
  }

  private static Throwable findRootCause(Throwable t) {
    while (t.getCause() != null && t.getCause() != t) {
      t = t.getCause();
    }
    return t;
  }
}
