package tune_bot.guildtunes.resolve;

import com.sedmelluq.discord.lavaplayer.player.AudioLoadResultHandler;
import com.sedmelluq.discord.lavaplayer.player.AudioPlayerManager;
import com.sedmelluq.discord.lavaplayer.tools.FriendlyException;
import com.sedmelluq.discord.lavaplayer.track.AudioPlaylist;
import com.sedmelluq.discord.lavaplayer.track.AudioTrack;
import com.sedmelluq.discord.lavaplayer.track.AudioTrackInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tune_bot.guildtunes.error.ErrorReporter;
import tune_bot.guildtunes.error.ResolutionException;
import tune_bot.guildtunes.music.Platform;
import tune_bot.guildtunes.music.Track;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;

/**
 * Resolver for natively streamable platforms backed by lavaplayer's source managers.
 * Search goes through the platform's search prefix ({@code ytsearch:}, {@code scsearch:}).
 */
public class LavaplayerSearchResolver implements TrackResolver {

    private static final Logger log = LoggerFactory.getLogger(LavaplayerSearchResolver.class);
    static final int SEARCH_LIMIT = 5;

    private final AudioPlayerManager audioPlayerManager;
    private final Platform platform;
    private final String searchPrefix;
    private final ErrorReporter errorReporter;

    public LavaplayerSearchResolver(AudioPlayerManager audioPlayerManager, Platform platform,
                                    String searchPrefix, ErrorReporter errorReporter) {
        if (!platform.isNativeStreamable()) {
            throw new IllegalArgumentException(platform + " is not natively streamable");
        }
        this.audioPlayerManager = audioPlayerManager;
        this.platform = platform;
        this.searchPrefix = searchPrefix;
        this.errorReporter = errorReporter;
    }

    @Override
    public Platform platform() {
        return platform;
    }

    @Override
    public List<Track> search(String query, String requestedBy) {
        try {
            List<AudioTrack> found = load(searchPrefix + query);
            if (found.isEmpty()) {
                log.warn("No {} results found for query: {}", platform.displayName(), query);
                return List.of();
            }
            List<Track> tracks = new ArrayList<>();
            for (AudioTrack t : found.subList(0, Math.min(SEARCH_LIMIT, found.size()))) {
                tracks.add(toTrack(t, requestedBy));
            }
            log.info("Found {} {} results for query: {}", tracks.size(), platform.displayName(), query);
            return tracks;
        } catch (ResolutionException e) {
            errorReporter.serviceError(platform.displayName(), "searching", e);
            return List.of();
        }
    }

    /** Native tracks stream from their own url. */
    @Override
    public String resolve(Track track) {
        return track.url();
    }

    @Override
    public boolean validateUrl(String url) {
        return platform.matches(url);
    }

    @Override
    public Optional<Track> fromUrl(String url, String requestedBy) {
        if (!validateUrl(url)) return Optional.empty();
        List<AudioTrack> found = load(url);
        return found.isEmpty() ? Optional.empty() : Optional.of(toTrack(found.get(0), requestedBy));
    }

    private List<AudioTrack> load(String identifier) {
        List<AudioTrack> result = new ArrayList<>();
        List<FriendlyException> failure = new ArrayList<>(1);
        try {
            audioPlayerManager.loadItem(identifier, new AudioLoadResultHandler() {
                @Override
                public void trackLoaded(AudioTrack track) {
                    result.add(track);
                }

                @Override
                public void playlistLoaded(AudioPlaylist playlist) {
                    AudioTrack selected = playlist.getSelectedTrack();
                    if (selected != null && !playlist.isSearchResult()) {
                        result.add(selected);
                    } else {
                        result.addAll(playlist.getTracks());
                    }
                }

                @Override
                public void noMatches() {
                    // empty result
                }

                @Override
                public void loadFailed(FriendlyException exception) {
                    failure.add(exception);
                }
            }).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ResolutionException("Interrupted while loading " + identifier, e);
        } catch (ExecutionException e) {
            throw new ResolutionException("Loading " + identifier + " failed", e.getCause());
        }
        if (!failure.isEmpty()) {
            throw new ResolutionException("Loading " + identifier + " failed: " + failure.get(0).getMessage(), failure.get(0));
        }
        return result;
    }

    private Track toTrack(AudioTrack audioTrack, String requestedBy) {
        AudioTrackInfo info = audioTrack.getInfo();
        long seconds = info.isStream ? 0 : Math.max(0, info.length / 1000);
        String url = info.uri != null ? info.uri : info.identifier;
        return new Track(info.title, info.author, url, seconds, info.artworkUrl, requestedBy, platform);
    }
}
