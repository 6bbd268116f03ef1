package tune_bot.guildtunes.resolve;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tune_bot.guildtunes.error.ResolutionException;
import tune_bot.guildtunes.music.Platform;
import tune_bot.guildtunes.music.Track;

import java.util.List;

/**
 * Resolver for platforms that can't be streamed directly. A track is resolved by finding its
 * equivalent on a native platform, trying progressively looser queries.
 */
public class CrossPlatformResolver implements TrackResolver {

    private static final Logger log = LoggerFactory.getLogger(CrossPlatformResolver.class);

    private final Platform platform;
    private final TrackResolver nativeResolver;

    public CrossPlatformResolver(Platform platform, TrackResolver nativeResolver) {
        if (platform.isNativeStreamable()) {
            throw new IllegalArgumentException(platform + " is natively streamable");
        }
        if (!nativeResolver.platform().isNativeStreamable()) {
            throw new IllegalArgumentException("delegate must be native, got " + nativeResolver.platform());
        }
        this.platform = platform;
        this.nativeResolver = nativeResolver;
    }

    @Override
    public Platform platform() {
        return platform;
    }

    /** This platform's own catalogue isn't searchable here; tracks arrive already built. */
    @Override
    public List<Track> search(String query, String requestedBy) {
        log.debug("{} catalogue search not available, query: {}", platform.displayName(), query);
        return List.of();
    }

    @Override
    public String resolve(Track track) {
        for (String query : candidateQueries(track)) {
            List<Track> found = nativeResolver.search(query, track.requestedBy());
            if (!found.isEmpty()) {
                Track best = found.get(0);
                log.info("Resolved {} track '{}' to {}", platform.displayName(), track.title(), best.url());
                return nativeResolver.resolve(best);
            }
            log.warn("No results for '{}', trying a looser query", query);
        }
        throw new ResolutionException("No " + nativeResolver.platform().displayName()
                + " equivalent found for " + platform.displayName() + " track: "
                + track.title() + " by " + track.artist());
    }

    @Override
    public boolean validateUrl(String url) {
        return platform.matches(url);
    }

    static List<String> candidateQueries(Track track) {
        return List.of(
                "\"" + track.title() + "\" \"" + track.artist() + "\"",
                track.title() + " " + track.artist(),
                track.title() + " " + track.artist() + " official");
    }
}
