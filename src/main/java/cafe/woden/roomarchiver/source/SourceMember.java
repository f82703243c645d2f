package cafe.woden.roomarchiver.source;

public record SourceMember(String userId, String displayName, String avatarUrl) {}
