package cafe.woden.roomarchiver.sync;

import cafe.woden.roomarchiver.source.EventSource;
import cafe.woden.roomarchiver.source.MessagePage;
import cafe.woden.roomarchiver.source.RawEvent;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One pass over a room's history, newest to oldest.
 *
 * <p>Page boundaries are hidden: {@link #nextBatch()} slices the flattened sequence into chunks of
 * at most {@code batchSize} events, which may span two source pages. A stream is single-use;
 * reopen the room through {@link CursorPaginator} to start over.
 */
public final class EventStream implements Iterator<RawEvent> {

  private static final Logger log = LoggerFactory.getLogger(EventStream.class);

  private final EventSource source;
  private final String roomId;
  private final int batchSize;
  private final Deque<RawEvent> buffer = new ArrayDeque<>();

  private String cursor;
  private boolean exhausted;
  private int pagesRequested;
  private long delivered;

  EventStream(
      EventSource source, String roomId, List<RawEvent> resident, String cursor, int batchSize) {
    this.source = Objects.requireNonNull(source, "source");
    this.roomId = Objects.requireNonNull(roomId, "roomId");
    if (batchSize <= 0) throw new IllegalArgumentException("batchSize must be > 0");
    this.batchSize = batchSize;
    this.cursor = cursor;
    if (resident != null) {
      for (RawEvent e : resident) {
        if (e != null) buffer.addLast(e);
      }
    }
  }

  /**
   * Pull up to {@code batchSize} events. An empty list means end-of-stream.
   *
   * @throws cafe.woden.roomarchiver.source.EventSourceException if a page request fails
   */
  public List<RawEvent> nextBatch() {
    ArrayList<RawEvent> batch = new ArrayList<>(Math.min(batchSize, 256));
    while (batch.size() < batchSize && hasNext()) {
      batch.add(next());
    }
    return batch;
  }

  @Override
  public boolean hasNext() {
    while (buffer.isEmpty() && !exhausted) {
      fetchPage();
    }
    return !buffer.isEmpty();
  }

  @Override
  public RawEvent next() {
    if (!hasNext()) throw new NoSuchElementException("end of history for " + roomId);
    delivered++;
    return buffer.removeFirst();
  }

  public int pagesRequested() {
    return pagesRequested;
  }

  public long delivered() {
    return delivered;
  }

  public String roomId() {
    return roomId;
  }

  private void fetchPage() {
    pagesRequested++;
    MessagePage page =
        source.paginateMessages(roomId, cursor, EventSource.Direction.BACKWARD, batchSize);
    if (page == null || page.isEmpty()) {
      exhausted = true;
      return;
    }
    log.info("[archiver] Read {} events...", page.events().size());
    for (RawEvent e : page.events()) {
      if (e != null) buffer.addLast(e);
    }
    // Without a continuation token the next request would restart from "now".
    if (page.nextCursor() == null || page.nextCursor().equals(cursor)) {
      exhausted = true;
    }
    cursor = page.nextCursor();
  }
}
