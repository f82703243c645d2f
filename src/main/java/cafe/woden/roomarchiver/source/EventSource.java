package cafe.woden.roomarchiver.source;

import java.net.URI;
import java.util.List;
import java.util.Map;

/**
 * Remote, paginated event source mirrored by the archiver.
 *
 * <p>Implementations report transport and protocol failures as {@link EventSourceException}.
 */
public interface EventSource {

  /** Joined rooms keyed by room id, in the source's listing order. */
  Map<String, RoomView> listRooms();

  /** Devices of the archiving account. */
  List<SourceDevice> getDevices();

  /**
   * Request one page of room events.
   *
   * @param roomId room to page through
   * @param cursor opaque cursor from the room view or a previous page; {@code null} means "now"
   * @param direction paging direction
   * @param limit maximum number of events to return
   */
  MessagePage paginateMessages(String roomId, String cursor, Direction direction, int limit);

  /** Resolve an opaque content reference to a downloadable URL. */
  URI resolveContentUrl(String contentRef);

  /**
   * Start a streamed download. The caller owns the returned body and must close it.
   *
   * <p>Unlike the other operations this one reports failures as {@link
   * java.io.IOException}, since attachment fetches are contained by the caller.
   */
  ContentDownload download(URI url) throws java.io.IOException;

  enum Direction {
    BACKWARD,
    FORWARD
  }
}
