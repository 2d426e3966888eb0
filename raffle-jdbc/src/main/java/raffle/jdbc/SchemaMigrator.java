package raffle.jdbc;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Applies the versioned schema scripts under {@code db/migration/} in order.
 *
 * <p>Each script is recorded in {@code schema_version} once applied; re-running is a no-op.
 * A database whose recorded version is newer than the newest known script halts the pool.
 */
public final class SchemaMigrator {
  private static final Logger logger = Logger.getLogger(SchemaMigrator.class.getName());

  static final List<Migration> MIGRATIONS = List.of(
      new Migration(1, "baseline", "db/migration/V1__baseline.sql"),
      new Migration(2, "registration state and fraud log",
          "db/migration/V2__registration_state_and_fraud_log.sql"),
      new Migration(3, "broadcast media", "db/migration/V3__broadcast_media.sql"),
      new Migration(4, "lottery run attempts", "db/migration/V4__lottery_run_attempts.sql"));

  private static final String CREATE_VERSION_TABLE =
      "CREATE TABLE IF NOT EXISTS schema_version ("
          + "version INT PRIMARY KEY, "
          + "description VARCHAR(255) NOT NULL, "
          + "applied_at TIMESTAMP NOT NULL)";

  private final ConnectionPool pool;
  private final Clock clock;

  public SchemaMigrator(ConnectionPool pool, Clock clock) {
    this.pool = Objects.requireNonNull(pool, "pool");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public static int latestVersion() {
    return MIGRATIONS.get(MIGRATIONS.size() - 1).version();
  }

  /**
   * Applies every pending migration.
   *
   * @return the number of migrations applied
   * @throws DatastoreFatalException if the database is newer than this code
   * @throws raffle.StoreException if a script fails
   */
  public int migrate() {
    return pool.write(this::applyPending).orElseThrow();
  }

  /** The highest applied version, 0 for an empty database. */
  public int currentVersion() {
    return pool.read(conn -> {
      createVersionTable(conn);
      return readVersion(conn);
    }).orElseThrow();
  }

  private int applyPending(Connection conn) throws SQLException {
    createVersionTable(conn);
    int current = readVersion(conn);
    if (current > latestVersion()) {
      throw pool.halt("Database schema version " + current
          + " is newer than the supported version " + latestVersion(), null);
    }
    int applied = 0;
    for (Migration migration : MIGRATIONS) {
      if (migration.version() <= current) {
        continue;
      }
      try (Statement st = conn.createStatement()) {
        for (String sql : statements(load(migration.resource()))) {
          st.execute(sql);
        }
      }
      JdbcTemplate.update(conn,
          "INSERT INTO schema_version (version, description, applied_at) VALUES (?, ?, ?)",
          migration.version(), migration.description(), clock.instant());
      logger.info("Applied schema migration V" + migration.version()
          + " (" + migration.description() + ")");
      applied++;
    }
    return applied;
  }

  private static void createVersionTable(Connection conn) throws SQLException {
    try (Statement st = conn.createStatement()) {
      st.execute(CREATE_VERSION_TABLE);
    }
  }

  private static int readVersion(Connection conn) throws SQLException {
    return JdbcTemplate.queryOne(conn, "SELECT COALESCE(MAX(version), 0) FROM schema_version",
        rs -> rs.getInt(1)).orElse(0);
  }

  static List<String> statements(String script) {
    StringBuilder cleaned = new StringBuilder(script.length());
    for (String line : script.split("\n")) {
      if (!line.strip().startsWith("--")) {
        cleaned.append(line).append('\n');
      }
    }
    List<String> out = new ArrayList<>();
    for (String part : cleaned.toString().split(";")) {
      String sql = part.strip();
      if (!sql.isEmpty()) {
        out.add(sql);
      }
    }
    return out;
  }

  private static String load(String resource) {
    ClassLoader loader = SchemaMigrator.class.getClassLoader();
    try (InputStream in = loader.getResourceAsStream(resource)) {
      if (in == null) {
        throw new IllegalStateException("Migration script not found on classpath: " + resource);
      }
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read migration script " + resource, e);
    }
  }

  record Migration(int version, String description, String resource) {}
}
