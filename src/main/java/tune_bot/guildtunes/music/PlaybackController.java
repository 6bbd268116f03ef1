package tune_bot.guildtunes.music;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import tune_bot.guildtunes.audio.AudioBackend;
import tune_bot.guildtunes.audio.AudioResource;
import tune_bot.guildtunes.audio.GuildAudioPlayer;
import tune_bot.guildtunes.audio.PlayerEvent;
import tune_bot.guildtunes.audio.PlayerStatus;
import tune_bot.guildtunes.audio.VoiceConnection;
import tune_bot.guildtunes.error.ErrorReporter;
import tune_bot.guildtunes.prebuffer.CacheStats;
import tune_bot.guildtunes.prebuffer.PrebufferCache;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Per-guild playback state machine (idle, loading, playing, paused) driving the audio backend
 * from the guild's queue.
 * <p>
 * Two per-guild try-locks keep commands and player events from stepping on each other:
 * {@code playInProgress} drops a {@link #play} that overlaps another, and
 * {@code skipInProgress} makes the idle signal caused by stopping the current track during
 * {@link #skip}/{@link #previous} a no-op, so the queue is advanced only once. A caller that
 * finds a guard held does nothing. Guards are released on every exit path.
 */
@Component
public class PlaybackController {

    private static final Logger log = LoggerFactory.getLogger(PlaybackController.class);

    private enum StartOutcome { STARTED, NOTHING_TO_PLAY, DROPPED, FAILED }

    private final QueueManager queueManager;
    private final PrebufferCache prebufferCache;
    private final AudioBackend audioBackend;
    private final ErrorReporter errorReporter;
    private final Executor eventExecutor;
    private final int maxSkipAttempts;

    private final Map<Long, GuildSession> sessions = new ConcurrentHashMap<>();

    public PlaybackController(QueueManager queueManager,
                              PrebufferCache prebufferCache,
                              AudioBackend audioBackend,
                              ErrorReporter errorReporter,
                              @Qualifier("musicEventExecutor") Executor eventExecutor,
                              @Value("${music.max-skip-attempts:3}") int maxSkipAttempts) {
        if (maxSkipAttempts < 1) throw new IllegalArgumentException("maxSkipAttempts must be positive");
        this.queueManager = queueManager;
        this.prebufferCache = prebufferCache;
        this.audioBackend = audioBackend;
        this.errorReporter = errorReporter;
        this.eventExecutor = eventExecutor;
        this.maxSkipAttempts = maxSkipAttempts;
    }

    /**
     * Starts the queue's current track on {@code connection}. Does nothing when the queue has no
     * current track or another play is already running for the guild. A failure is reported and
     * recovered from by skipping to the next track.
     */
    public void play(long guildId, VoiceConnection connection) {
        GuildSession session = session(guildId);
        if (startCurrent(session, connection) == StartOutcome.FAILED) {
            advanceAndStart(session);
        }
    }

    /**
     * Stops the current track and moves to the next one.
     *
     * @return the track now playing, or null when nothing was playing, the queue ran out (the
     *         queue is then cleared) or a skip was already in progress
     */
    public Track skip(long guildId) {
        GuildQueue queue = queueManager.getOrCreate(guildId);
        if (!queue.isPlaying() || queue.isEmpty()) {
            return null;
        }
        return advanceAndStart(session(guildId));
    }

    /**
     * Steps back one track without removing anything.
     *
     * @return the previous track, or null when not playing, already at the first track, or it
     *         failed to start
     */
    public Track previous(long guildId) {
        if (!queueManager.getOrCreate(guildId).isPlaying()) {
            return null;
        }
        GuildSession session = session(guildId);
        if (!session.skipInProgress().compareAndSet(false, true)) {
            log.debug("Skip already in progress in guild {}, dropping previous", guildId);
            return null;
        }
        try {
            session.existingPlayer().ifPresent(GuildAudioPlayer::stop);
            Track previous = queueManager.stepBack(guildId);
            if (previous == null) {
                return null;
            }
            VoiceConnection connection = session.connection();
            if (connection != null && startCurrent(session, connection) == StartOutcome.FAILED) {
                return null;
            }
            return previous;
        } finally {
            session.skipInProgress().set(false);
        }
    }

    public boolean pause(long guildId) {
        Optional<GuildAudioPlayer> player = existingPlayer(guildId);
        GuildQueue queue = queueManager.getOrCreate(guildId);
        synchronized (queue) {
            if (player.isEmpty() || !queue.isPlaying() || queue.isPaused()) {
                return false;
            }
            player.get().pause();
            queue.setPaused(true);
        }
        log.info("Paused playback in guild {}", guildId);
        return true;
    }

    public boolean resume(long guildId) {
        Optional<GuildAudioPlayer> player = existingPlayer(guildId);
        GuildQueue queue = queueManager.getOrCreate(guildId);
        synchronized (queue) {
            if (player.isEmpty() || !queue.isPlaying() || !queue.isPaused()) {
                return false;
            }
            player.get().unpause();
            queue.setPaused(false);
        }
        log.info("Resumed playback in guild {}", guildId);
        return true;
    }

    /** Clears the whole queue and stops the audio. */
    public void stop(long guildId) {
        queueManager.clear(guildId);
        existingPlayer(guildId).ifPresent(GuildAudioPlayer::stop);
        log.info("Stopped playback in guild {}", guildId);
    }

    /**
     * Changes the live volume. Only allowed while a resource is bound and actively playing;
     * a paused player refuses the change.
     *
     * @param volume gain in [0,1]
     */
    public boolean setVolume(long guildId, float volume) {
        Optional<GuildAudioPlayer> player = existingPlayer(guildId);
        if (player.isEmpty() || player.get().status() != PlayerStatus.PLAYING) {
            return false;
        }
        Optional<AudioResource> resource = player.get().currentResource();
        if (resource.isEmpty()) {
            return false;
        }
        resource.get().setVolume(volume);
        queueManager.setVolume(guildId, volume);
        log.info("Set volume to {} in guild {}", volume, guildId);
        return true;
    }

    /** Full teardown of the guild: queue, guards, lookahead state, audio and connection. */
    public void disconnect(long guildId) {
        queueManager.clear(guildId);
        GuildSession session = sessions.remove(guildId);
        prebufferCache.clearForTenant(guildId);
        if (session != null) {
            session.playInProgress().set(false);
            session.skipInProgress().set(false);
            session.events().close();
            session.existingPlayer().ifPresent(player -> {
                player.stop();
                player.destroy();
            });
            VoiceConnection connection = session.connection();
            if (connection != null) {
                connection.destroy();
            }
        }
        queueManager.drop(guildId);
        log.info("Disconnected from guild {}", guildId);
    }

    /** Starts background resolution of the tracks after the current one. */
    public void triggerPrebuffer(long guildId) {
        GuildQueue queue = queueManager.getOrCreate(guildId);
        List<Track> tracks;
        int currentIndex;
        synchronized (queue) {
            tracks = queue.tracks();
            currentIndex = queue.currentIndex();
        }
        try {
            prebufferCache.scheduleLookahead(tracks, currentIndex, guildId);
        } catch (RuntimeException e) {
            log.warn("Prebuffer scheduling failed in guild {}: {}", guildId, e.getMessage(), e);
        }
    }

    public void shuffle(long guildId) {
        queueManager.shuffle(guildId);
        triggerPrebuffer(guildId);
    }

    public QueueStatus status(long guildId) {
        return queueManager.status(guildId);
    }

    public CacheStats cacheStats() {
        return prebufferCache.stats();
    }

    /** Delivers a player event for the guild, as the audio backend would. */
    public void onPlayerEvent(long guildId, PlayerEvent event) {
        signal(session(guildId), event);
    }

    // ---- internals ----

    private GuildSession session(long guildId) {
        return sessions.computeIfAbsent(guildId, id -> {
            GuildSession session = new GuildSession(id);
            session.attachEvents(new GuildEventChannel(id, eventExecutor, event -> handleEvent(session, event)));
            return session;
        });
    }

    private Optional<GuildAudioPlayer> existingPlayer(long guildId) {
        GuildSession session = sessions.get(guildId);
        return session == null ? Optional.empty() : session.existingPlayer();
    }

    private StartOutcome startCurrent(GuildSession session, VoiceConnection connection) {
        long guildId = session.guildId();
        Track current = queueManager.currentTrack(guildId);
        if (current == null) {
            log.info("No track to play in guild {}", guildId);
            return StartOutcome.NOTHING_TO_PLAY;
        }
        if (!session.playInProgress().compareAndSet(false, true)) {
            log.debug("Play already in progress in guild {}, dropping request", guildId);
            return StartOutcome.DROPPED;
        }
        try {
            GuildAudioPlayer player = session.player(
                    () -> audioBackend.createPlayer(guildId, event -> signal(session, event)));
            session.bindConnection(connection);

            String address = current.platform().isNativeStreamable()
                    ? current.url()
                    : prebufferCache.resolve(current, guildId);
            AudioResource resource = player.createResource(address);
            GuildQueue queue = queueManager.getOrCreate(guildId);
            resource.setVolume(queue.volume());
            player.play(resource);
            connection.subscribe(player);
            queue.markStarted();

            log.info("Now playing in guild {}: {} by {}", guildId, current.title(), current.artist());
        } catch (RuntimeException e) {
            errorReporter.voiceError(guildId, e);
            return StartOutcome.FAILED;
        } finally {
            session.playInProgress().set(false);
        }
        triggerPrebuffer(guildId);
        return StartOutcome.STARTED;
    }

    /**
     * Stops the current track, advances, and starts whatever is next. A track that fails to
     * start is advanced past too, up to {@code maxSkipAttempts} times. Runs under the skip guard.
     */
    private Track advanceAndStart(GuildSession session) {
        long guildId = session.guildId();
        if (!session.skipInProgress().compareAndSet(false, true)) {
            log.debug("Skip already in progress in guild {}, dropping request", guildId);
            return null;
        }
        try {
            session.existingPlayer().ifPresent(GuildAudioPlayer::stop);
            Track next = queueManager.advance(guildId);
            int failures = 0;
            while (next != null) {
                VoiceConnection connection = session.connection();
                if (connection == null) {
                    return next;
                }
                if (startCurrent(session, connection) != StartOutcome.FAILED) {
                    return next;
                }
                if (++failures >= maxSkipAttempts) {
                    log.error("Giving up in guild {} after {} tracks failed to start", guildId, failures);
                    queueManager.getOrCreate(guildId).setPlaying(false);
                    return null;
                }
                next = queueManager.advance(guildId);
            }
            stop(guildId);
            return null;
        } finally {
            session.skipInProgress().set(false);
        }
    }

    private void signal(GuildSession session, PlayerEvent event) {
        if (event.type() == PlayerEvent.Type.IDLE && session.skipInProgress().get()) {
            log.debug("Ignoring idle signal in guild {}: skip in progress", session.guildId());
            return;
        }
        session.events().publish(event);
    }

    private void handleEvent(GuildSession session, PlayerEvent event) {
        switch (event.type()) {
            case STATE_CHANGE -> log.debug("Player state changed from {} to {} in guild {}",
                    event.from(), event.to(), session.guildId());
            case ERROR -> errorReporter.playerError(session.guildId(), event.error());
            case IDLE -> handleIdle(session);
        }
    }

    /** The current track finished on its own. */
    private void handleIdle(GuildSession session) {
        long guildId = session.guildId();
        if (sessions.get(guildId) != session) {
            return; // disconnected
        }
        if (session.skipInProgress().get()) {
            log.debug("Ignoring idle in guild {}: skip in progress", guildId);
            return;
        }
        GuildQueue queue = queueManager.getOrCreate(guildId);
        if (!queue.isPlaying()) {
            return;
        }
        Track next = queueManager.advance(guildId);
        if (next == null) {
            queue.setPlaying(false);
            log.info("Playback finished in guild {}", guildId);
            return;
        }
        VoiceConnection connection = session.connection();
        if (connection != null) {
            play(guildId, connection);
        }
    }
}
