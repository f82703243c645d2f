package cafe.woden.roomarchiver.source;

import java.util.List;

/** The source's local view of one joined room. */
public interface RoomView {

  String roomId();

  String displayName();

  List<SourceMember> joinedMembers();

  TopicLookup topic();

  /** Events already held in the local view, newest first. May be empty. */
  List<RawEvent> residentEvents();

  /** Backward cursor positioned just before {@link #residentEvents()}; may be {@code null}. */
  String prevBatch();
}
