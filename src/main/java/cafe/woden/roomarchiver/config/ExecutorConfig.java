package cafe.woden.roomarchiver.config;

import cafe.woden.roomarchiver.util.NamedThreads;
import java.util.concurrent.ExecutorService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Centralized app-owned executors.
 *
 * <p>Room sync work runs on its own pool so Spring owns creation and shutdown.
 */
@Configuration
public class ExecutorConfig {
  public static final String ROOM_SYNC_EXECUTOR = "roomSyncExecutor";

  @Bean(name = ROOM_SYNC_EXECUTOR, destroyMethod = "shutdown")
  public ExecutorService roomSyncExecutor(ArchiverProperties props) {
    return NamedThreads.newFixedThreadPool(props.roomParallelism(), "archiver-room-sync");
  }
}
