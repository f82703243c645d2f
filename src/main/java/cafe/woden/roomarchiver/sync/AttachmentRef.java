package cafe.woden.roomarchiver.sync;

import cafe.woden.roomarchiver.source.RawEvent;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/** Attachment metadata as declared by a file or image message. */
public record AttachmentRef(
    String contentRef, String filename, long declaredSize, String mimeType, boolean image) {

  static final String MESSAGE_EVENT_TYPE = "m.room.message";
  static final String MSGTYPE_FILE = "m.file";
  static final String MSGTYPE_IMAGE = "m.image";

  private static final Set<String> ATTACHMENT_MSGTYPES = Set.of(MSGTYPE_FILE, MSGTYPE_IMAGE);

  /**
   * Extract the attachment declared by {@code event}, if any.
   *
   * <p>Only plain {@code mxc://} references qualify; end-to-end encrypted files carry their
   * reference under {@code content.file} and are not fetched.
   */
  public static Optional<AttachmentRef> from(RawEvent event) {
    if (event == null || !MESSAGE_EVENT_TYPE.equals(event.type())) return Optional.empty();
    JsonNode content = event.content();
    String msgtype = content.path("msgtype").asText("");
    if (!ATTACHMENT_MSGTYPES.contains(msgtype)) return Optional.empty();

    String url = content.path("url").asText("").trim();
    if (!url.toLowerCase(Locale.ROOT).startsWith("mxc://")) return Optional.empty();

    String filename = content.path("filename").asText("").trim();
    if (filename.isEmpty()) filename = content.path("body").asText("").trim();

    JsonNode info = content.path("info");
    long size = Math.max(0L, info.path("size").asLong(0L));
    String mime = info.path("mimetype").asText("").trim();

    return Optional.of(
        new AttachmentRef(
            url, filename, size, mime.isEmpty() ? null : mime, MSGTYPE_IMAGE.equals(msgtype)));
  }
}
