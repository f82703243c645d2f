package cafe.woden.roomarchiver.sync;

import cafe.woden.roomarchiver.config.ArchiverProperties;
import cafe.woden.roomarchiver.source.EventSource;
import cafe.woden.roomarchiver.store.ArchiveRepository;
import java.time.Clock;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.support.TransactionTemplate;

/** Engine components shared by the {@link SyncOrchestrator}. */
@Configuration
public class SyncConfig {

  @Bean
  public Clock archiverClock() {
    return Clock.systemUTC();
  }

  @Bean
  public CursorPaginator cursorPaginator(EventSource source, ArchiverProperties props) {
    return new CursorPaginator(source, props.batchSize());
  }

  @Bean
  public FrontierDetector frontierDetector() {
    return new FrontierDetector();
  }

  @Bean
  public AttachmentFetcher attachmentFetcher(
      EventSource source,
      ArchiveRepository repo,
      @Qualifier("archiveTx") TransactionTemplate tx,
      ArchiverProperties props,
      Clock clock) {
    return new AttachmentFetcher(source, repo, tx, props.maxAttachmentBytes(), clock);
  }
}
