package cafe.woden.roomarchiver.config;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Archiving run configuration.
 *
 * <p>Everything has a default so an empty {@code archiver} section still binds.
 */
@ConfigurationProperties(prefix = "archiver")
public record ArchiverProperties(
    /** Rooms to archive, in order. Empty (default) means every joined room. */
    List<String> rooms,

    /** Rooms that are never archived, even when listed in {@code rooms}. */
    List<String> excludedRooms,

    /**
     * Attachment size ceiling in bytes. Downloads whose declared length is at or above it are
     * rejected. Default: 1 TiB.
     */
    Long maxAttachmentBytes,

    /** Events requested per pagination call and processed per frontier batch. Default: 1000. */
    Integer batchSize,

    /** Number of most recent stored events compared against incoming batches. Default: 1000. */
    Integer knownRecentWindow,

    /** Rooms processed concurrently. Default: 1 (sequential). */
    Integer roomParallelism,

    /** Master toggle for attachment caching. Default: true. */
    Boolean fetchAttachments,

    /**
     * If true (default), uncached attachments first seen in a room are re-attempted after the
     * room's event pass.
     */
    Boolean retryPendingAttachments,

    /** Remote homeserver connection. */
    Source source,

    /** Local archive database. */
    Store store
) {

  public static final long DEFAULT_MAX_ATTACHMENT_BYTES = 1L << 40;
  public static final int DEFAULT_BATCH_SIZE = 1000;
  public static final int DEFAULT_KNOWN_RECENT_WINDOW = 1000;

  /** Homeserver and credentials. */
  public record Source(
      /** Base URL. Default: {@code https://matrix.org}. */
      String homeserver,

      String user,

      String password,

      /** Pre-issued access token; when set, no password login is performed. */
      String accessToken,

      /** Device display name used for password logins. */
      String deviceName,

      Integer connectTimeoutMs,

      Integer readTimeoutMs,

      /** Path prefix for content downloads, joined with {@code <server>/<mediaId>}. */
      String mediaDownloadPath
  ) {
    public Source {
      homeserver = trimToDefault(homeserver, "https://matrix.org");
      while (homeserver.endsWith("/")) homeserver = homeserver.substring(0, homeserver.length() - 1);
      user = Objects.toString(user, "").trim();
      password = Objects.toString(password, "");
      accessToken = Objects.toString(accessToken, "").trim();
      deviceName = trimToDefault(deviceName, "Matrix Archiver");
      if (connectTimeoutMs == null || connectTimeoutMs <= 0) connectTimeoutMs = 20_000;
      if (readTimeoutMs == null || readTimeoutMs <= 0) readTimeoutMs = 60_000;
      mediaDownloadPath = trimToDefault(mediaDownloadPath, "/_matrix/media/v3/download/");
      if (!mediaDownloadPath.endsWith("/")) mediaDownloadPath = mediaDownloadPath + "/";
    }

    public boolean hasAccessToken() {
      return !accessToken.isEmpty();
    }
  }

  /** Embedded HSQLDB file settings, or an explicit JDBC URL. */
  public record Store(
      /** Explicit JDBC URL. When set, {@code directory}/{@code fileBaseName} are ignored. */
      String jdbcUrl,

      /** Directory holding the HSQLDB files. Default: current directory. */
      String directory,

      /** Base filename (no extension). HSQLDB will create .data/.script/.properties files. */
      String fileBaseName,

      String username,

      String password,

      Integer maxPoolSize
  ) {
    public Store {
      jdbcUrl = Objects.toString(jdbcUrl, "").trim();
      directory = trimToDefault(directory, ".");
      fileBaseName = trimToDefault(fileBaseName, "archive");
      username = trimToDefault(username, "SA");
      password = Objects.toString(password, "");
      if (maxPoolSize == null || maxPoolSize <= 0) maxPoolSize = 4;
    }
  }

  public ArchiverProperties {
    rooms = cleanIds(rooms);
    excludedRooms = cleanIds(excludedRooms);
    if (maxAttachmentBytes == null || maxAttachmentBytes <= 0) {
      maxAttachmentBytes = DEFAULT_MAX_ATTACHMENT_BYTES;
    }
    if (batchSize == null || batchSize <= 0) batchSize = DEFAULT_BATCH_SIZE;
    if (knownRecentWindow == null || knownRecentWindow <= 0) {
      knownRecentWindow = DEFAULT_KNOWN_RECENT_WINDOW;
    }
    if (roomParallelism == null || roomParallelism <= 0) roomParallelism = 1;
    if (fetchAttachments == null) fetchAttachments = Boolean.TRUE;
    if (retryPendingAttachments == null) retryPendingAttachments = Boolean.TRUE;
    if (source == null) source = new Source(null, null, null, null, null, null, null, null);
    if (store == null) store = new Store(null, null, null, null, null, null);
  }

  public Set<String> excludedRoomSet() {
    return Set.copyOf(excludedRooms);
  }

  /** All defaults; handy for tests and for wiring without a property source. */
  public static ArchiverProperties defaults() {
    return new ArchiverProperties(null, null, null, null, null, null, null, null, null, null);
  }

  private static List<String> cleanIds(List<String> ids) {
    if (ids == null) return List.of();
    return ids.stream()
        .filter(Objects::nonNull)
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .distinct()
        .collect(Collectors.toUnmodifiableList());
  }

  private static String trimToDefault(String value, String fallback) {
    String v = Objects.toString(value, "").trim();
    return v.isEmpty() ? fallback : v;
  }
}
