package tune_bot.guildtunes.music;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns every guild's {@link GuildQueue} and the pointer-advance semantics over it.
 */
@Component
public class QueueManager {

    private static final Logger log = LoggerFactory.getLogger(QueueManager.class);

    private final Map<Long, GuildQueue> queues = new ConcurrentHashMap<>();
    private final int maxQueueSize;
    private final float defaultVolume;
    private final Random random;

    public QueueManager(@Value("${music.max-queue-size:100}") int maxQueueSize,
                        @Value("${music.default-volume:0.5}") float defaultVolume) {
        this(maxQueueSize, defaultVolume, new Random());
    }

    QueueManager(int maxQueueSize, float defaultVolume, Random random) {
        if (maxQueueSize < 1) throw new IllegalArgumentException("maxQueueSize must be positive");
        this.maxQueueSize = maxQueueSize;
        this.defaultVolume = GuildQueue.clampVolume(defaultVolume);
        this.random = random;
    }

    public GuildQueue getOrCreate(long guildId) {
        return queues.computeIfAbsent(guildId, id -> new GuildQueue(id, defaultVolume));
    }

    /** @return false when the queue is already at capacity */
    public boolean enqueue(long guildId, Track track) {
        GuildQueue q = getOrCreate(guildId);
        synchronized (q) {
            List<Track> tracks = q.mutableTracks();
            if (tracks.size() >= maxQueueSize) {
                log.warn("Queue full for guild {}, cannot add: {}", guildId, track.title());
                return false;
            }
            tracks.add(track);
            if (!q.isPlaying() && tracks.size() == 1) {
                q.setCurrentIndex(0);
            }
        }
        log.info("Added to queue in guild {}: {} by {}", guildId, track.title(), track.artist());
        return true;
    }

    public Track currentTrack(long guildId) {
        GuildQueue q = getOrCreate(guildId);
        synchronized (q) {
            return at(q, q.currentIndex());
        }
    }

    public Track peekNext(long guildId) {
        GuildQueue q = getOrCreate(guildId);
        synchronized (q) {
            return at(q, q.currentIndex() + 1);
        }
    }

    /**
     * Removes the track at the pointer (finished or skipped) and wraps the pointer to the start
     * when it falls off the end.
     *
     * @return the new current track, or null when the queue is now empty
     */
    public Track advance(long guildId) {
        GuildQueue q = getOrCreate(guildId);
        synchronized (q) {
            List<Track> tracks = q.mutableTracks();
            if (tracks.isEmpty() || q.currentIndex() >= tracks.size()) {
                return null;
            }
            tracks.remove(q.currentIndex());
            if (q.currentIndex() >= tracks.size()) {
                q.setCurrentIndex(0);
            }
            if (tracks.isEmpty()) {
                q.setPlaying(false);
            }
            return at(q, q.currentIndex());
        }
    }

    /** Non-destructive move back one position; null when already at the first track. */
    public Track stepBack(long guildId) {
        GuildQueue q = getOrCreate(guildId);
        synchronized (q) {
            if (q.currentIndex() <= 0) return null;
            q.setCurrentIndex(q.currentIndex() - 1);
            return at(q, q.currentIndex());
        }
    }

    /** @return the removed track, or null for an index outside the queue */
    public Track remove(long guildId, int index) {
        GuildQueue q = getOrCreate(guildId);
        Track removed;
        synchronized (q) {
            List<Track> tracks = q.mutableTracks();
            if (index < 0 || index >= tracks.size()) return null;
            removed = tracks.remove(index);
            if (index < q.currentIndex()) {
                q.setCurrentIndex(q.currentIndex() - 1);
            } else if (index == q.currentIndex() && q.currentIndex() >= tracks.size()) {
                q.setCurrentIndex(0);
            }
            if (tracks.isEmpty()) q.setPlaying(false);
        }
        log.info("Removed from queue in guild {}: {}", guildId, removed.title());
        return removed;
    }

    /** Keeps the current track first and shuffles the rest behind it. */
    public void shuffle(long guildId) {
        GuildQueue q = getOrCreate(guildId);
        synchronized (q) {
            List<Track> tracks = q.mutableTracks();
            if (tracks.size() <= 1) return;

            Track current = at(q, q.currentIndex());
            List<Track> rest = new ArrayList<>(tracks.size());
            for (int i = 0; i < tracks.size(); i++) {
                if (i != q.currentIndex()) rest.add(tracks.get(i));
            }
            for (int i = rest.size() - 1; i > 0; i--) {
                int j = random.nextInt(i + 1);
                Track tmp = rest.get(i);
                rest.set(i, rest.get(j));
                rest.set(j, tmp);
            }
            tracks.clear();
            if (current != null) tracks.add(current);
            tracks.addAll(rest);
            q.setCurrentIndex(0);
        }
        log.info("Shuffled queue for guild {}", guildId);
    }

    /** Empties the queue and resets the flags; volume is kept. */
    public void clear(long guildId) {
        getOrCreate(guildId).reset();
        log.info("Cleared queue for guild {}", guildId);
    }

    public void setVolume(long guildId, float volume) {
        GuildQueue q = getOrCreate(guildId);
        q.setVolume(volume);
        log.info("Set volume to {} for guild {}", q.volume(), guildId);
    }

    public List<Track> snapshot(long guildId) {
        return getOrCreate(guildId).tracks();
    }

    public QueueStatus status(long guildId) {
        GuildQueue q = getOrCreate(guildId);
        synchronized (q) {
            return new QueueStatus(at(q, q.currentIndex()), q.size(), q.currentIndex(),
                    q.isPlaying(), q.isPaused(), q.volume());
        }
    }

    /** Forgets the guild entirely; the next access starts from a fresh default queue. */
    public void drop(long guildId) {
        queues.remove(guildId);
    }

    private static Track at(GuildQueue q, int index) {
        List<Track> tracks = q.mutableTracks();
        return index >= 0 && index < tracks.size() ? tracks.get(index) : null;
    }
}
