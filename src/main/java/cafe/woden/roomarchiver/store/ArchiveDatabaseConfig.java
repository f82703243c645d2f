package cafe.woden.roomarchiver.store;

import cafe.woden.roomarchiver.config.ArchiverProperties;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Archive DB wiring.
 *
 * <p>Uses a file-based HSQLDB in {@code archiver.store.directory} unless an explicit {@code
 * archiver.store.jdbc-url} is configured. Flyway migrations are run on startup.
 */
@Configuration
public class ArchiveDatabaseConfig {

  private static final Logger log = LoggerFactory.getLogger(ArchiveDatabaseConfig.class);

  public static final String MIGRATION_LOCATION = "classpath:db/migration/archive";

  @Bean(name = "archiveDataSource", destroyMethod = "close")
  public DataSource archiveDataSource(ArchiverProperties props) {
    ArchiverProperties.Store store = props.store();

    String url;
    if (!store.jdbcUrl().isEmpty()) {
      url = store.jdbcUrl();
      log.info("[archiver] Archive DB: {}", url);
    } else {
      Path basePath = resolveDbBasePath(store);
      // Keep the DB open for the life of the run by reusing pooled connections.
      url = "jdbc:hsqldb:file:" + basePath.toAbsolutePath() + ";hsqldb.tx=mvcc";
      log.info("[archiver] Archive DB (HSQLDB file: {})", basePath.toAbsolutePath());
    }

    HikariConfig cfg = new HikariConfig();
    cfg.setPoolName("archiver-store");
    cfg.setJdbcUrl(url);
    if (url.startsWith("jdbc:hsqldb:")) {
      cfg.setDriverClassName("org.hsqldb.jdbc.JDBCDriver");
    }
    cfg.setUsername(store.username());
    cfg.setPassword(store.password());

    cfg.setMaximumPoolSize(Math.max(store.maxPoolSize(), props.roomParallelism() + 1));
    cfg.setMinimumIdle(1);
    cfg.setConnectionTimeout(5_000);
    cfg.setValidationTimeout(5_000);
    cfg.setIdleTimeout(60_000);
    return new HikariDataSource(cfg);
  }

  @Bean(initMethod = "migrate", name = "archiveFlyway")
  public Flyway archiveFlyway(@Qualifier("archiveDataSource") DataSource archiveDataSource) {
    return migrationsFor(archiveDataSource);
  }

  @Bean(name = "archiveJdbcTemplate")
  public JdbcTemplate archiveJdbcTemplate(@Qualifier("archiveDataSource") DataSource ds) {
    return new JdbcTemplate(ds);
  }

  @Bean(name = "archiveTxManager")
  public PlatformTransactionManager archiveTxManager(
      @Qualifier("archiveDataSource") DataSource ds) {
    return new DataSourceTransactionManager(ds);
  }

  @Bean(name = "archiveTx")
  public TransactionTemplate archiveTx(
      @Qualifier("archiveTxManager") PlatformTransactionManager tm) {
    return new TransactionTemplate(tm);
  }

  @Bean
  public ArchiveRepository archiveRepository(
      @Qualifier("archiveJdbcTemplate") JdbcTemplate jdbc,
      @Qualifier("archiveFlyway") Flyway flyway) {
    // touch flyway to ensure init/migrate ran
    if (flyway == null) {
      throw new IllegalStateException("archiveFlyway bean missing (migrations must run first)");
    }
    return new ArchiveRepository(jdbc);
  }

  /** Flyway configured for the archive schema; shared with test fixtures. */
  public static Flyway migrationsFor(DataSource ds) {
    return Flyway.configure().dataSource(ds).locations(MIGRATION_LOCATION).load();
  }

  private static Path resolveDbBasePath(ArchiverProperties.Store store) {
    Path dir = Paths.get(store.directory());
    try {
      Files.createDirectories(dir);
    } catch (Exception e) {
      log.warn(
          "[archiver] Could not create archive DB dir '{}' (falling back to current directory)",
          dir,
          e);
      dir = Paths.get(".").toAbsolutePath();
    }
    return dir.resolve(store.fileBaseName());
  }
}
