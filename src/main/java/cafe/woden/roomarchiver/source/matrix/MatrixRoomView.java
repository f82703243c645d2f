package cafe.woden.roomarchiver.source.matrix;

import cafe.woden.roomarchiver.source.RawEvent;
import cafe.woden.roomarchiver.source.RoomView;
import cafe.woden.roomarchiver.source.SourceMember;
import cafe.woden.roomarchiver.source.TopicLookup;
import java.util.List;

/**
 * Joined room as seen by the initial sync. Members and topic are fetched on demand.
 *
 * <p>{@code residentEvents} is newest-first.
 */
final class MatrixRoomView implements RoomView {

  private final MatrixEventSource source;
  private final String roomId;
  private final String displayName;
  private final List<RawEvent> residentEvents;
  private final String prevBatch;

  MatrixRoomView(
      MatrixEventSource source,
      String roomId,
      String displayName,
      List<RawEvent> residentEvents,
      String prevBatch) {
    this.source = source;
    this.roomId = roomId;
    this.displayName = displayName;
    this.residentEvents = residentEvents == null ? List.of() : List.copyOf(residentEvents);
    this.prevBatch = prevBatch;
  }

  @Override
  public String roomId() {
    return roomId;
  }

  @Override
  public String displayName() {
    return displayName;
  }

  @Override
  public List<SourceMember> joinedMembers() {
    return source.joinedMembers(roomId);
  }

  @Override
  public TopicLookup topic() {
    return source.topic(roomId);
  }

  @Override
  public List<RawEvent> residentEvents() {
    return residentEvents;
  }

  @Override
  public String prevBatch() {
    return prevBatch;
  }
}
