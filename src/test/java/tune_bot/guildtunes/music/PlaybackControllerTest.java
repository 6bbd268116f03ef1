package tune_bot.guildtunes.music;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import tune_bot.guildtunes.audio.PlayerEvent;
import tune_bot.guildtunes.prebuffer.PrebufferCache;
import tune_bot.guildtunes.resolve.TrackResolverRegistry;
import tune_bot.guildtunes.support.FakeAudioBackend;
import tune_bot.guildtunes.support.FakeAudioBackend.FakePlayer;
import tune_bot.guildtunes.support.FakeConnection;
import tune_bot.guildtunes.support.FakeResolver;
import tune_bot.guildtunes.support.RecordingErrorReporter;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static tune_bot.guildtunes.support.Tracks.spotify;
import static tune_bot.guildtunes.support.Tracks.youtube;

class PlaybackControllerTest {

    private static final long GUILD = 7L;

    private QueueManager queues;
    private FakeAudioBackend backend;
    private FakeConnection connection;
    private FakeResolver spotifyResolver;
    private RecordingErrorReporter errors;
    private PrebufferCache cache;
    private PlaybackController controller;
    private ExecutorService background;

    @BeforeEach
    void setUp() {
        queues = new QueueManager(100, 0.5f);
        backend = new FakeAudioBackend();
        connection = new FakeConnection(GUILD);
        spotifyResolver = FakeResolver.answering(Platform.SPOTIFY);
        errors = new RecordingErrorReporter();
        cache = new PrebufferCache(new TrackResolverRegistry(List.of(spotifyResolver), errors),
                Runnable::run, 50, 2, Duration.ZERO);
        controller = new PlaybackController(queues, cache, backend, errors, Runnable::run, 3);
        background = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() {
        background.shutdownNow();
    }

    private FakePlayer player() {
        return backend.lastPlayer();
    }

    private List<String> titles() {
        return queues.snapshot(GUILD).stream().map(Track::title).toList();
    }

    @Test
    void playStartsCurrentTrack() {
        Track a = youtube("a");
        queues.enqueue(GUILD, a);

        controller.play(GUILD, connection);

        QueueStatus status = controller.status(GUILD);
        assertThat(status.playing()).isTrue();
        assertThat(status.paused()).isFalse();
        assertThat(status.currentTrack()).isEqualTo(a);
        assertThat(player().played).containsExactly(a.url());
        assertThat(player().current().volume).isEqualTo(0.5f);
        assertThat(connection.subscriptions.get()).isEqualTo(1);
    }

    @Test
    void playWithEmptyQueueDoesNothing() {
        controller.play(GUILD, connection);

        assertThat(backend.players).isEmpty();
        assertThat(controller.status(GUILD).playing()).isFalse();
    }

    @Test
    void skipPlaysNextTrackExactlyOnce() {
        Track b = youtube("b");
        queues.enqueue(GUILD, youtube("a"));
        queues.enqueue(GUILD, b);
        queues.enqueue(GUILD, youtube("c"));
        controller.play(GUILD, connection);

        Track now = controller.skip(GUILD);

        // the idle signal from stopping "a" must not advance again
        assertThat(now).isEqualTo(b);
        assertThat(titles()).containsExactly("b", "c");
        assertThat(player().played).containsExactly(youtube("a").url(), b.url());
        assertThat(controller.status(GUILD).playing()).isTrue();
    }

    @Test
    void skipOnLastTrackEmptiesQueue() {
        queues.enqueue(GUILD, youtube("a"));
        controller.play(GUILD, connection);

        assertThat(controller.skip(GUILD)).isNull();

        QueueStatus status = controller.status(GUILD);
        assertThat(status.queueLength()).isZero();
        assertThat(status.playing()).isFalse();
        assertThat(player().current()).isNull();
    }

    @Test
    void skipWhenNotPlayingReturnsNull() {
        queues.enqueue(GUILD, youtube("a"));

        assertThat(controller.skip(GUILD)).isNull();
        assertThat(titles()).containsExactly("a");
    }

    @Test
    void volumeRefusedWhilePaused() {
        queues.enqueue(GUILD, youtube("a"));
        controller.play(GUILD, connection);
        assertThat(controller.pause(GUILD)).isTrue();

        assertThat(controller.setVolume(GUILD, 0.8f)).isFalse();

        assertThat(controller.status(GUILD).volume()).isEqualTo(0.5f);
        assertThat(player().current().volume).isEqualTo(0.5f);
    }

    @Test
    void volumeAppliedWhilePlaying() {
        queues.enqueue(GUILD, youtube("a"));
        controller.play(GUILD, connection);

        assertThat(controller.setVolume(GUILD, 0.8f)).isTrue();

        assertThat(controller.status(GUILD).volume()).isEqualTo(0.8f);
        assertThat(player().current().volume).isEqualTo(0.8f);
    }

    @Test
    void volumeWithoutPlayerIsRefused() {
        assertThat(controller.setVolume(GUILD, 0.3f)).isFalse();
    }

    @Test
    void pauseAndResumeAreIdempotent() {
        queues.enqueue(GUILD, youtube("a"));
        controller.play(GUILD, connection);

        assertThat(controller.pause(GUILD)).isTrue();
        assertThat(controller.pause(GUILD)).isFalse();
        assertThat(controller.status(GUILD).paused()).isTrue();

        assertThat(controller.resume(GUILD)).isTrue();
        assertThat(controller.resume(GUILD)).isFalse();
        assertThat(controller.status(GUILD).paused()).isFalse();
        assertThat(controller.status(GUILD).stateLabel()).isEqualTo("Playing");
    }

    @Test
    void pauseWithoutPlaybackIsRefused() {
        assertThat(controller.pause(GUILD)).isFalse();
        assertThat(controller.resume(GUILD)).isFalse();
    }

    @Test
    void finishedTrackAdvancesToNext() {
        Track b = youtube("b");
        queues.enqueue(GUILD, youtube("a"));
        queues.enqueue(GUILD, b);
        controller.play(GUILD, connection);

        player().finish();

        assertThat(titles()).containsExactly("b");
        assertThat(player().played).containsExactly(youtube("a").url(), b.url());
        assertThat(controller.status(GUILD).playing()).isTrue();
    }

    @Test
    void finishedLastTrackStopsButStaysConnected() {
        queues.enqueue(GUILD, youtube("a"));
        controller.play(GUILD, connection);

        player().finish();

        QueueStatus status = controller.status(GUILD);
        assertThat(status.queueLength()).isZero();
        assertThat(status.playing()).isFalse();
        assertThat(connection.destroyed).isFalse();
    }

    @Test
    void failedStartRecoversWithNextTrack() {
        Track a = youtube("a");
        Track b = youtube("b");
        backend.failingAddresses.add(a.url());
        queues.enqueue(GUILD, a);
        queues.enqueue(GUILD, b);

        controller.play(GUILD, connection);

        assertThat(errors.voiceErrors).hasSize(1);
        assertThat(titles()).containsExactly("b");
        assertThat(player().played).containsExactly(b.url());
        assertThat(controller.status(GUILD).playing()).isTrue();
    }

    @Test
    void skipPastTrackThatFailsToStart() {
        Track c = youtube("c");
        backend.failingAddresses.add(youtube("b").url());
        queues.enqueue(GUILD, youtube("a"));
        queues.enqueue(GUILD, youtube("b"));
        queues.enqueue(GUILD, c);
        controller.play(GUILD, connection);

        assertThat(controller.skip(GUILD)).isEqualTo(c);

        assertThat(titles()).containsExactly("c");
        assertThat(player().played).containsExactly(youtube("a").url(), c.url());
        assertThat(errors.voiceErrors).hasSize(1);
        assertThat(controller.status(GUILD).playing()).isTrue();
    }

    @Test
    void skipGivesUpAfterBoundedAttempts() {
        queues.enqueue(GUILD, youtube("a"));
        for (String name : List.of("b", "c", "d")) {
            backend.failingAddresses.add(youtube(name).url());
            queues.enqueue(GUILD, youtube(name));
        }
        queues.enqueue(GUILD, youtube("e"));
        controller.play(GUILD, connection);

        assertThat(controller.skip(GUILD)).isNull();

        assertThat(titles()).containsExactly("d", "e");
        assertThat(player().played).containsExactly(youtube("a").url());
        assertThat(controller.status(GUILD).playing()).isFalse();
    }

    @Test
    @Timeout(10)
    void idleQueuedBeforeSkipIsIgnoredWhileSkipRuns() throws Exception {
        List<Runnable> deferred = new CopyOnWriteArrayList<>();
        PlaybackController deferring = new PlaybackController(queues, cache, backend, errors, deferred::add, 3);
        Track b = youtube("b");
        queues.enqueue(GUILD, youtube("a"));
        queues.enqueue(GUILD, b);
        deferring.play(GUILD, connection);

        // accepted now, handled only once the skip below is under way
        deferring.onPlayerEvent(GUILD, PlayerEvent.idle());
        assertThat(deferred).hasSize(1);

        CountDownLatch gate = new CountDownLatch(1);
        backend.loadGate = gate;
        Future<Track> skipped = background.submit(() -> deferring.skip(GUILD));
        assertThat(backend.loading.await(5, TimeUnit.SECONDS)).isTrue();

        deferred.forEach(Runnable::run);
        gate.countDown();

        assertThat(skipped.get(5, TimeUnit.SECONDS)).isEqualTo(b);
        assertThat(titles()).containsExactly("b");
        assertThat(player().played).containsExactly(youtube("a").url(), b.url());
    }

    @Test
    void syntheticIdleAdvancesLikeBackendIdle() {
        Track b = youtube("b");
        queues.enqueue(GUILD, youtube("a"));
        queues.enqueue(GUILD, b);
        controller.play(GUILD, connection);

        controller.onPlayerEvent(GUILD, PlayerEvent.idle());

        assertThat(titles()).containsExactly("b");
        assertThat(player().played).endsWith(b.url());
    }

    @Test
    void recoveryGivesUpAfterBoundedAttempts() {
        for (String name : List.of("a", "b", "c", "d")) {
            backend.failingAddresses.add(youtube(name).url());
            queues.enqueue(GUILD, youtube(name));
        }
        queues.enqueue(GUILD, youtube("e"));

        controller.play(GUILD, connection);

        // "a" fails, then three more failures end the recovery
        assertThat(player().resourceAttempts.get()).isEqualTo(4);
        assertThat(player().played).isEmpty();
        assertThat(titles()).containsExactly("d", "e");
        assertThat(controller.status(GUILD).playing()).isFalse();
    }

    @Test
    void previousStepsBackWithoutRemoving() {
        Track a = youtube("a");
        Track b = youtube("b");
        queues.enqueue(GUILD, a);
        queues.enqueue(GUILD, b);
        GuildQueue q = queues.getOrCreate(GUILD);
        synchronized (q) {
            q.setCurrentIndex(1);
        }
        controller.play(GUILD, connection);

        assertThat(controller.previous(GUILD)).isEqualTo(a);

        assertThat(titles()).containsExactly("a", "b");
        assertThat(q.currentIndex()).isZero();
        assertThat(player().played).containsExactly(b.url(), a.url());
    }

    @Test
    void previousThatFailsToStartIsNotRetried() {
        Track a = youtube("a");
        Track b = youtube("b");
        backend.failingAddresses.add(a.url());
        queues.enqueue(GUILD, a);
        queues.enqueue(GUILD, b);
        GuildQueue q = queues.getOrCreate(GUILD);
        synchronized (q) {
            q.setCurrentIndex(1);
        }
        controller.play(GUILD, connection);

        assertThat(controller.previous(GUILD)).isNull();

        assertThat(titles()).containsExactly("a", "b");
        assertThat(player().resourceAttempts.get()).isEqualTo(2);
        assertThat(player().played).containsExactly(b.url());
        assertThat(errors.voiceErrors).hasSize(1);
    }

    @Test
    void previousAtFirstTrackReturnsNull() {
        queues.enqueue(GUILD, youtube("a"));
        controller.play(GUILD, connection);

        assertThat(controller.previous(GUILD)).isNull();
    }

    @Test
    void previousWhenNotPlayingReturnsNull() {
        queues.enqueue(GUILD, youtube("a"));

        assertThat(controller.previous(GUILD)).isNull();
    }

    @Test
    void stopClearsQueueWithoutAdvancing() {
        queues.enqueue(GUILD, youtube("a"));
        queues.enqueue(GUILD, youtube("b"));
        controller.play(GUILD, connection);

        controller.stop(GUILD);

        assertThat(titles()).isEmpty();
        assertThat(player().played).containsExactly(youtube("a").url());
        assertThat(player().current()).isNull();
    }

    @Test
    void disconnectTearsDownGuild() {
        queues.enqueue(GUILD, youtube("a"));
        queues.enqueue(GUILD, youtube("b"));
        controller.play(GUILD, connection);
        FakePlayer first = player();

        controller.disconnect(GUILD);

        assertThat(first.destroyed).isTrue();
        assertThat(first.played).containsExactly(youtube("a").url());
        assertThat(connection.destroyed).isTrue();
        assertThat(controller.status(GUILD).queueLength()).isZero();

        FakeConnection again = new FakeConnection(GUILD);
        queues.enqueue(GUILD, youtube("c"));
        controller.play(GUILD, again);

        assertThat(backend.players).hasSize(2);
        assertThat(player().played).containsExactly(youtube("c").url());
    }

    @Test
    void indirectTrackIsResolvedAndNextOnesPrebuffered() {
        Track first = spotify("s1");
        queues.enqueue(GUILD, first);
        queues.enqueue(GUILD, spotify("s2"));

        controller.play(GUILD, connection);

        assertThat(player().played).containsExactly("resolved://" + first.url());
        assertThat(spotifyResolver.calls.get()).isEqualTo(2);
        assertThat(controller.cacheStats().resolved()).isEqualTo(2);
    }

    @Test
    void playerErrorIsReported() {
        queues.enqueue(GUILD, youtube("a"));
        controller.play(GUILD, connection);

        player().fail(new IllegalStateException("decoder blew up"));

        assertThat(errors.playerErrors).hasSize(1);
        assertThat(titles()).containsExactly("a");
    }

    @Test
    @Timeout(10)
    void overlappingPlayIsDropped() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        spotifyResolver.gated(release);
        queues.enqueue(GUILD, spotify("slow"));

        Future<?> first = background.submit(() -> controller.play(GUILD, connection));
        assertThat(spotifyResolver.entered.await(5, TimeUnit.SECONDS)).isTrue();

        controller.play(GUILD, connection);
        release.countDown();
        first.get(5, TimeUnit.SECONDS);

        assertThat(backend.players).hasSize(1);
        assertThat(player().played).hasSize(1);
        assertThat(spotifyResolver.calls.get()).isEqualTo(1);
    }
}
