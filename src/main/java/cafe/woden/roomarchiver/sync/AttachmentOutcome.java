package cafe.woden.roomarchiver.sync;

/** Result of handling one event's attachment. */
public sealed interface AttachmentOutcome {

  /** The event does not reference a fetchable attachment. */
  record NotAttachment() implements AttachmentOutcome {}

  /** A cached copy already exists; no network call was made. */
  record AlreadyCached(String contentRef) implements AttachmentOutcome {}

  /** Downloaded and stored. */
  record Cached(String contentRef, int bytes, String status) implements AttachmentOutcome {}

  /** Declared or streamed length met the size ceiling; nothing was stored. */
  record Rejected(String contentRef, long length, String status) implements AttachmentOutcome {}

  /** The fetch failed; the row stays uncached and is retried on a later run. */
  record Failed(String contentRef, String status) implements AttachmentOutcome {}
}
