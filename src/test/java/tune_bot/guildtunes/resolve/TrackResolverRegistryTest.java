package tune_bot.guildtunes.resolve;

import org.junit.jupiter.api.Test;
import tune_bot.guildtunes.error.ConfigurationException;
import tune_bot.guildtunes.error.ErrorReporter;
import tune_bot.guildtunes.music.Platform;
import tune_bot.guildtunes.support.FakeResolver;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static tune_bot.guildtunes.support.Tracks.youtube;

class TrackResolverRegistryTest {

    @Test
    void findsRegisteredResolvers() {
        FakeResolver youtube = FakeResolver.answering(Platform.YOUTUBE);
        TrackResolverRegistry registry = new TrackResolverRegistry(List.of(youtube), new ErrorReporter());

        assertThat(registry.find(Platform.YOUTUBE)).containsSame(youtube);
        assertThat(registry.find(Platform.SPOTIFY)).isEmpty();
        assertThat(registry.all()).containsExactly(youtube);
    }

    @Test
    void requireUnknownPlatformFails() {
        TrackResolverRegistry registry = new TrackResolverRegistry(List.of(), new ErrorReporter());

        assertThatThrownBy(() -> registry.require(Platform.SOUNDCLOUD))
                .isInstanceOf(ConfigurationException.class)
                .hasMessage("Unsupported platform: SOUNDCLOUD");
    }

    @Test
    void duplicatePlatformIsRejected() {
        assertThatThrownBy(() -> new TrackResolverRegistry(
                List.of(FakeResolver.answering(Platform.YOUTUBE), FakeResolver.answering(Platform.YOUTUBE)),
                new ErrorReporter()))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void plainQueryIsYoutubeSearch() {
        FakeResolver youtube = FakeResolver.answering(Platform.YOUTUBE);
        youtube.searchResults = List.of(youtube("hit"));
        TrackResolverRegistry registry = new TrackResolverRegistry(List.of(youtube), new ErrorReporter());

        assertThat(registry.search("never gonna give you up", "me")).containsExactly(youtube("hit"));
        assertThat(youtube.searches).containsExactly("never gonna give you up");
    }

    @Test
    void urlWithoutLoaderFindsNothing() {
        FakeResolver youtube = FakeResolver.answering(Platform.YOUTUBE);
        FakeResolver spotify = FakeResolver.answering(Platform.SPOTIFY);
        TrackResolverRegistry registry = new TrackResolverRegistry(List.of(youtube, spotify), new ErrorReporter());

        assertThat(registry.search("https://open.spotify.com/track/abc123", "me")).isEmpty();
        assertThat(youtube.searches).isEmpty();
    }
}
