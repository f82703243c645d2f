package cafe.woden.roomarchiver.store;

import java.nio.file.Path;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.transaction.support.TransactionTemplate;

/** File-backed HSQLDB archive migrated by Flyway, for tests. */
public record ArchiveDbFixture(JdbcTemplate jdbc, ArchiveRepository repo, TransactionTemplate tx)
    implements AutoCloseable {

  public static ArchiveDbFixture open(Path basePath) {
    DriverManagerDataSource ds = new DriverManagerDataSource();
    ds.setDriverClassName("org.hsqldb.jdbc.JDBCDriver");
    ds.setUrl("jdbc:hsqldb:file:" + basePath.toAbsolutePath() + ";hsqldb.tx=mvcc");
    ds.setUsername("SA");
    ds.setPassword("");

    ArchiveDatabaseConfig.migrationsFor(ds).migrate();

    JdbcTemplate jdbc = new JdbcTemplate(ds);
    TransactionTemplate tx = new TransactionTemplate(new DataSourceTransactionManager(ds));
    return new ArchiveDbFixture(jdbc, new ArchiveRepository(jdbc), tx);
  }

  @Override
  public void close() {
    try {
      jdbc.execute("SHUTDOWN");
    } catch (Exception ignored) {
    }
  }
}
