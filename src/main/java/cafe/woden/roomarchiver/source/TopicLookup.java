package cafe.woden.roomarchiver.source;

/** Result of asking the source for a room topic. */
public sealed interface TopicLookup {

  /** Topic text, or {@code null} when there is none to record. */
  default String valueOrNull() {
    return this instanceof Present p ? p.topic() : null;
  }

  record Present(String topic) implements TopicLookup {}

  /** The room has no topic set. */
  record Absent() implements TopicLookup {}

  /** The lookup failed; the archiver records the topic as absent. */
  record Failed(String reason) implements TopicLookup {}
}
