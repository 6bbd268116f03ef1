package tune_bot.guildtunes.resolve;

import tune_bot.guildtunes.music.Platform;
import tune_bot.guildtunes.music.Track;

import java.util.List;
import java.util.Optional;

/**
 * One per platform. Turns queries and urls into {@link Track}s and tracks into a streamable
 * address.
 */
public interface TrackResolver {

    Platform platform();

    /** Search results, best first. Failures are reported and yield an empty list. */
    List<Track> search(String query, String requestedBy);

    /**
     * @return an address the audio backend can stream
     * @throws tune_bot.guildtunes.error.ResolutionException when the lookup fails
     */
    String resolve(Track track);

    boolean validateUrl(String url);

    default Optional<Track> fromUrl(String url, String requestedBy) {
        return Optional.empty();
    }
}
