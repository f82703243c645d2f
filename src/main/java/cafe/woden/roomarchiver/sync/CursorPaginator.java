package cafe.woden.roomarchiver.sync;

import cafe.woden.roomarchiver.source.EventSource;
import cafe.woden.roomarchiver.source.RoomView;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Opens backward walks over a room's history. */
public class CursorPaginator {

  private static final Logger log = LoggerFactory.getLogger(CursorPaginator.class);

  private final EventSource source;
  private final int batchSize;

  public CursorPaginator(EventSource source, int batchSize) {
    this.source = Objects.requireNonNull(source, "source");
    if (batchSize <= 0) throw new IllegalArgumentException("batchSize must be > 0");
    this.batchSize = batchSize;
  }

  /** Start a new walk: resident events first, then pages from the room's backward cursor. */
  public EventStream open(RoomView room) {
    Objects.requireNonNull(room, "room");
    log.info("[archiver] Reading events from room '{}'...", room.displayName());
    return new EventStream(source, room.roomId(), room.residentEvents(), room.prevBatch(), batchSize);
  }

  public int batchSize() {
    return batchSize;
  }
}
