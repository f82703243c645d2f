package cafe.woden.roomarchiver.source.matrix;

import cafe.woden.roomarchiver.config.ArchiverProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires the Matrix homeserver as the archiver's {@link cafe.woden.roomarchiver.source.EventSource}. */
@Configuration
public class MatrixSourceConfig {

  @Bean
  public MatrixEventSource matrixEventSource(ArchiverProperties props) {
    return new MatrixEventSource(props.source());
  }
}
