package tune_bot.guildtunes.resolve;

import org.springframework.stereotype.Component;
import tune_bot.guildtunes.error.ConfigurationException;
import tune_bot.guildtunes.error.ErrorReporter;
import tune_bot.guildtunes.error.MusicException;
import tune_bot.guildtunes.music.Platform;
import tune_bot.guildtunes.music.Track;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Platform to resolver lookup. */
@Component
public class TrackResolverRegistry {

    private final Map<Platform, TrackResolver> resolvers = new EnumMap<>(Platform.class);
    private final ErrorReporter errorReporter;

    public TrackResolverRegistry(List<TrackResolver> resolvers, ErrorReporter errorReporter) {
        this.errorReporter = errorReporter;
        for (TrackResolver r : resolvers) {
            TrackResolver previous = this.resolvers.put(r.platform(), r);
            if (previous != null) {
                throw new IllegalStateException("Two resolvers registered for " + r.platform());
            }
        }
    }

    public Optional<TrackResolver> find(Platform platform) {
        return Optional.ofNullable(resolvers.get(platform));
    }

    public TrackResolver require(Platform platform) {
        TrackResolver r = resolvers.get(platform);
        if (r == null) {
            throw new ConfigurationException("Unsupported platform: " + platform);
        }
        return r;
    }

    public Collection<TrackResolver> all() {
        return resolvers.values();
    }

    /**
     * Urls go to the resolver that recognises them; anything else is a YouTube search.
     */
    public List<Track> search(String query, String requestedBy) {
        for (TrackResolver r : resolvers.values()) {
            if (r.validateUrl(query)) {
                try {
                    return r.fromUrl(query, requestedBy).map(List::of).orElse(List.of());
                } catch (MusicException e) {
                    errorReporter.serviceError(r.platform().displayName(), "loading url", e);
                    return List.of();
                }
            }
        }
        return require(Platform.YOUTUBE).search(query, requestedBy);
    }
}
