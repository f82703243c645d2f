package cafe.woden.roomarchiver;

import cafe.woden.roomarchiver.config.ArchiverProperties;
import cafe.woden.roomarchiver.source.matrix.MatrixEventSource;
import cafe.woden.roomarchiver.sync.RoomSyncResult;
import cafe.woden.roomarchiver.sync.RunSummary;
import cafe.woden.roomarchiver.sync.SyncOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.Bean;

/**
 * Batch entry point: archive once, then exit.
 *
 * <p>The archive DB is wired by {@link cafe.woden.roomarchiver.store.ArchiveDatabaseConfig}, so
 * Boot's own DataSource and Flyway auto-configuration are switched off.
 */
@SpringBootApplication(
    exclude = {DataSourceAutoConfiguration.class, FlywayAutoConfiguration.class})
@EnableConfigurationProperties(ArchiverProperties.class)
public class RoomArchiverApp {
  private static final Logger log = LoggerFactory.getLogger(RoomArchiverApp.class);

  public static void main(String[] args) {
    ConfigurableApplicationContext ctx =
        new SpringApplicationBuilder(RoomArchiverApp.class).headless(true).run(args);
    System.exit(SpringApplication.exit(ctx));
  }

  @Bean
  public RunExitCode runExitCode() {
    return new RunExitCode();
  }

  @Bean
  public ApplicationRunner run(
      MatrixEventSource source, SyncOrchestrator orchestrator, RunExitCode exitCode) {
    return args -> {
      source.login();
      RunSummary summary;
      try {
        summary = orchestrator.runOnce();
      } finally {
        source.logout();
      }

      log.info(
          "[archiver] Run complete: {} new devices, {} new events across {} rooms",
          summary.devicesArchived(),
          summary.totalNewEvents(),
          summary.rooms().size());
      for (RoomSyncResult r : summary.rooms()) {
        if (r.status() == RoomSyncResult.Status.FAILED) {
          log.warn("[archiver] Room {} failed: {}", r.roomId(), r.message());
        }
      }
      if (summary.listingError() != null) {
        log.warn("[archiver] {}", summary.listingError());
      }
      exitCode.set(summary.hasFailures() ? 2 : 0);
    };
  }
}
