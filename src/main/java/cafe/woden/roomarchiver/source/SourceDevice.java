package cafe.woden.roomarchiver.source;

/** Device as reported by the source. {@code lastSeenTsMillis} is null when never seen. */
public record SourceDevice(
    String userId, String deviceId, String displayName, Long lastSeenTsMillis, String lastSeenIp) {}
