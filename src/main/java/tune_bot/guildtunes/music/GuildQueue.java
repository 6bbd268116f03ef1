package tune_bot.guildtunes.music;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-guild ordered track list with a current-position pointer and play/pause/volume flags.
 * <p>
 * Non-empty: {@code 0 <= currentIndex < size}. Empty: {@code currentIndex == 0} and not playing.
 * All access goes through this instance's monitor; {@link QueueManager} holds it for compound
 * operations.
 */
public class GuildQueue {

    private final long guildId;
    private final List<Track> tracks = new ArrayList<>();
    private int currentIndex = 0;
    private boolean playing = false;
    private boolean paused = false;
    private float volume;

    GuildQueue(long guildId, float defaultVolume) {
        this.guildId = guildId;
        this.volume = clampVolume(defaultVolume);
    }

    public long guildId() {
        return guildId;
    }

    public synchronized List<Track> tracks() {
        return List.copyOf(tracks);
    }

    public synchronized int size() {
        return tracks.size();
    }

    public synchronized boolean isEmpty() {
        return tracks.isEmpty();
    }

    public synchronized int currentIndex() {
        return currentIndex;
    }

    public synchronized boolean isPlaying() {
        return playing;
    }

    public synchronized void setPlaying(boolean playing) {
        this.playing = playing && !tracks.isEmpty();
        if (!this.playing) paused = false;
    }

    public synchronized boolean isPaused() {
        return paused;
    }

    public synchronized void setPaused(boolean paused) {
        this.paused = paused;
    }

    /** Playback of the current track has started. */
    public synchronized void markStarted() {
        setPlaying(true);
        paused = false;
    }

    public synchronized float volume() {
        return volume;
    }

    public synchronized void setVolume(float volume) {
        this.volume = clampVolume(volume);
    }

    // ---- used by QueueManager while holding the monitor ----

    List<Track> mutableTracks() {
        return tracks;
    }

    void setCurrentIndex(int currentIndex) {
        this.currentIndex = currentIndex;
    }

    synchronized void reset() {
        tracks.clear();
        currentIndex = 0;
        playing = false;
        paused = false;
    }

    static float clampVolume(float v) {
        if (Float.isNaN(v)) return 0f;
        return Math.max(0f, Math.min(1f, v));
    }
}
