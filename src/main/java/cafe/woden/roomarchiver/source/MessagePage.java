package cafe.woden.roomarchiver.source;

import java.util.List;

/** One pagination response. {@code nextCursor} is null when the source has no further history. */
public record MessagePage(List<RawEvent> events, String nextCursor) {
  public MessagePage {
    events = events == null ? List.of() : List.copyOf(events);
    if (nextCursor != null && nextCursor.isBlank()) nextCursor = null;
  }

  public boolean isEmpty() {
    return events.isEmpty();
  }
}
