package cafe.woden.roomarchiver.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Attachment row keyed by its content reference ({@code fetchUrlMatrix}).
 *
 * <p>{@code cached} holds iff {@code data} is non-empty and the most recent fetch succeeded.
 */
public record ArchivedAttachment(
    String fetchUrlMatrix,
    String fetchUrlHttp,
    String filename,
    long size,
    String mimeType,
    boolean image,
    boolean cached,
    byte[] data,
    String lastFetchStatus,
    Instant lastFetchTs,
    Instant retrievalTs,
    String roomId,
    String eventId) {

  // Column widths of archive_attachment.
  public static final int MAX_MIME_TYPE_LENGTH = 255;
  public static final int MAX_STATUS_LENGTH = 1024;

  public ArchivedAttachment {
    Objects.requireNonNull(fetchUrlMatrix, "fetchUrlMatrix");
    Objects.requireNonNull(fetchUrlHttp, "fetchUrlHttp");
    filename = Objects.toString(filename, "");
    if (size < 0) size = 0;
    if (data != null && data.length == 0) data = null;
    if (cached && data == null) {
      throw new IllegalArgumentException("cached attachment without data: " + fetchUrlMatrix);
    }
    if (mimeType != null && mimeType.length() > MAX_MIME_TYPE_LENGTH) {
      mimeType = null;
    }
    lastFetchStatus = truncate(Objects.toString(lastFetchStatus, ""), MAX_STATUS_LENGTH);
  }

  private static String truncate(String s, int max) {
    return s.length() <= max ? s : s.substring(0, max);
  }
}
