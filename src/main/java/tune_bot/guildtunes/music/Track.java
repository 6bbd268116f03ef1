package tune_bot.guildtunes.music;

import java.util.Objects;

/**
 * One queued song.
 *
 * @param title           display title
 * @param artist          performer label, may already be a joined multi-artist string
 * @param url             platform reference or direct stream url
 * @param durationSeconds length in seconds, never negative
 * @param thumbnailUrl    optional artwork, may be null
 * @param requestedBy     who asked for it
 * @param platform        source platform
 */
public record Track(String title,
                    String artist,
                    String url,
                    long durationSeconds,
                    String thumbnailUrl,
                    String requestedBy,
                    Platform platform) {

    public Track {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(platform, "platform");
        if (durationSeconds < 0) {
            throw new IllegalArgumentException("durationSeconds must be >= 0: " + durationSeconds);
        }
        title = title != null ? title : "";
        artist = artist != null ? artist : "";
        requestedBy = requestedBy != null ? requestedBy : "";
    }

    /** Deterministic key used to share resolution work: {@code platform:url}. */
    public String fingerprint() {
        return platform.name().toLowerCase() + ":" + url;
    }

    public Track requestedBy(String user) {
        return new Track(title, artist, url, durationSeconds, thumbnailUrl, user, platform);
    }
}
