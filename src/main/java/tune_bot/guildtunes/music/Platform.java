package tune_bot.guildtunes.music;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Where a track comes from. Natively streamable platforms are played straight from their own
 * url; the others have to be resolved to a native address first.
 */
public enum Platform {
    YOUTUBE("YouTube", true,
            "^(https?://)?(www\\.)?(youtube\\.com/watch\\?v=|youtu\\.be/|youtube\\.com/embed/|youtube\\.com/v/)[a-zA-Z0-9_-]{11}(&.*)?$"),
    SPOTIFY("Spotify", false,
            "^https?://(open\\.)?spotify\\.com/(track|album|playlist)/[a-zA-Z0-9]+(\\?.*)?$"),
    SOUNDCLOUD("SoundCloud", true,
            "^https?://(www\\.)?soundcloud\\.com/[a-zA-Z0-9_-]+/[a-zA-Z0-9_-]+$");

    private final String displayName;
    private final boolean nativeStreamable;
    private final Pattern urlPattern;

    Platform(String displayName, boolean nativeStreamable, String urlRegex) {
        this.displayName = displayName;
        this.nativeStreamable = nativeStreamable;
        this.urlPattern = Pattern.compile(urlRegex);
    }

    public String displayName() {
        return displayName;
    }

    public boolean isNativeStreamable() {
        return nativeStreamable;
    }

    public boolean matches(String url) {
        return url != null && urlPattern.matcher(url).matches();
    }

    public static Optional<Platform> fromUrl(String url) {
        for (Platform p : values()) {
            if (p.matches(url)) return Optional.of(p);
        }
        return Optional.empty();
    }
}
