package cafe.woden.roomarchiver.sync;

import cafe.woden.roomarchiver.source.RawEvent;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Decides which streamed events are new and when to stop paging.
 *
 * <p>The stream runs newest to oldest, so the first already-archived event marks the boundary with
 * the previous run. Batches are handled whole: a batch containing any known event is terminal,
 * yet every unknown event in it is still handed to the sink. Only id membership is consulted,
 * never timestamps.
 */
public class FrontierDetector {

  /** Receives the new events of each batch, in stream order. */
  @FunctionalInterface
  public interface BatchSink {
    void accept(List<RawEvent> freshEvents, int batchIndex);
  }

  public FrontierScan scan(EventStream stream, Set<String> knownRecentIds, BatchSink sink) {
    Objects.requireNonNull(stream, "stream");
    Objects.requireNonNull(sink, "sink");
    Set<String> known = knownRecentIds == null ? Set.of() : knownRecentIds;

    int batches = 0;
    int scanned = 0;
    int fresh = 0;
    int knownSeen = 0;
    boolean terminal = false;

    while (!terminal) {
      List<RawEvent> batch = stream.nextBatch();
      if (batch.isEmpty()) break;
      int batchIndex = batches++;
      scanned += batch.size();

      Set<String> newIds = new LinkedHashSet<>();
      for (RawEvent e : batch) newIds.add(e.eventId());
      newIds.removeAll(known);

      List<RawEvent> toPersist = new ArrayList<>(newIds.size());
      for (RawEvent e : batch) {
        if (!newIds.contains(e.eventId())) {
          terminal = true;
          knownSeen++;
          continue;
        }
        toPersist.add(e);
      }

      fresh += toPersist.size();
      if (!toPersist.isEmpty()) {
        sink.accept(toPersist, batchIndex);
      }
    }

    return new FrontierScan(batches, scanned, fresh, knownSeen, terminal);
  }
}
