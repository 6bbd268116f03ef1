package tune_bot.guildtunes.prebuffer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import tune_bot.guildtunes.error.ResolutionException;
import tune_bot.guildtunes.music.Track;
import tune_bot.guildtunes.resolve.TrackResolver;
import tune_bot.guildtunes.resolve.TrackResolverRegistry;

import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Resolves tracks from indirect platforms ahead of time so playback doesn't wait on the
 * lookup. Keys are {@code platform:url} and shared by every guild, so two guilds asking for the
 * same track share one in-flight resolution. Memory is bounded by insertion-order eviction.
 */
@Component
public class PrebufferCache {

    private static final Logger log = LoggerFactory.getLogger(PrebufferCache.class);

    private final TrackResolverRegistry resolvers;
    private final Executor executor;
    private final int maxEntries;
    private final int lookahead;
    private final long cooldownNanos;

    /** Insertion ordered; guarded by {@code this}. */
    private final LinkedHashMap<String, PrebufferEntry> entries = new LinkedHashMap<>();
    private final Map<Long, Long> lastLookahead = new ConcurrentHashMap<>();

    public PrebufferCache(TrackResolverRegistry resolvers,
                          @Qualifier("prebufferExecutor") Executor executor,
                          @Value("${music.prebuffer.max-entries:50}") int maxEntries,
                          @Value("${music.prebuffer.lookahead:2}") int lookahead,
                          @Value("${music.prebuffer.cooldown:1s}") Duration cooldown) {
        if (maxEntries < 1) throw new IllegalArgumentException("maxEntries must be positive");
        this.resolvers = resolvers;
        this.executor = executor;
        this.maxEntries = maxEntries;
        this.lookahead = lookahead;
        this.cooldownNanos = cooldown.toNanos();
    }

    /**
     * Starts background resolution for the next few tracks after {@code currentIndex}. Never
     * blocks and never throws; failures only drop the entry.
     */
    public void scheduleLookahead(List<Track> tracks, int currentIndex, long guildId) {
        if (cooldownNanos > 0) {
            long now = System.nanoTime();
            Long last = lastLookahead.get(guildId);
            if (last != null && now - last < cooldownNanos) {
                log.debug("Skipping prebuffer for guild {}: cooldown active", guildId);
                return;
            }
            lastLookahead.put(guildId, now);
        }

        int from = Math.min(tracks.size(), currentIndex + 1);
        int to = Math.min(tracks.size(), from + lookahead);
        log.debug("Prebuffer check in guild {}: {} tracks from index {}", guildId, to - from, from);

        for (Track track : tracks.subList(from, to)) {
            if (track.platform().isNativeStreamable()) {
                log.debug("Not prebuffering {} ({}): streams directly", track.title(), track.platform());
                continue;
            }
            Optional<TrackResolver> resolver = resolvers.find(track.platform());
            if (resolver.isEmpty()) {
                log.warn("Not prebuffering {}: no resolver for {}", track.title(), track.platform());
                continue;
            }
            if (contains(track.fingerprint())) {
                continue;
            }
            log.info("Prebuffering {} by {} for guild {}", track.title(), track.artist(), guildId);
            acquire(track, resolver.get());
        }
    }

    /**
     * Streamable address for {@code track}. Native platforms return their own url. Otherwise a
     * resolved entry is returned directly and a miss starts a shared resolution that is awaited
     * once. A pending entry started by another caller is awaited too; if it fails, one fresh
     * resolution is tried (shared with any other caller falling back at the same time) before
     * giving up.
     *
     * @throws tune_bot.guildtunes.error.ConfigurationException for a platform without a resolver
     * @throws ResolutionException when the resolution fails, or the fresh attempt fails too
     */
    public String resolve(Track track, long guildId) {
        if (track.platform().isNativeStreamable()) {
            return track.url();
        }
        TrackResolver resolver = resolvers.require(track.platform());

        PrebufferEntry cached = peek(track.fingerprint());
        if (cached != null && cached.isResolved()) {
            log.info("Prebuffer cache hit in guild {}: {}", guildId, track.title());
            return cached.resolvedAddress().orElseThrow();
        }

        Acquired acquired = acquire(track, resolver);
        if (acquired.started()) {
            return await(acquired.entry(), track);
        }
        log.info("Waiting for in-flight prebuffer in guild {}: {}", guildId, track.title());
        try {
            return await(acquired.entry(), track);
        } catch (ResolutionException first) {
            log.warn("Prebuffer failed for {}, fetching fresh: {}", track.title(), first.getMessage());
            return await(acquire(track, resolver).entry(), track);
        }
    }

    /** Trims the oldest entries once the cache is over its limit, leaving some headroom. */
    public synchronized void evictIfOverCapacity() {
        if (entries.size() <= maxEntries) return;
        int target = maxEntries - maxEntries / 5;
        int removed = 0;
        Iterator<PrebufferEntry> it = entries.values().iterator();
        while (entries.size() > target && it.hasNext()) {
            it.next();
            it.remove();
            removed++;
        }
        log.info("Cleaned up prebuffer cache, removed {} entries", removed);
    }

    /**
     * Entries are shared between guilds and are left alone; only the guild's own lookahead
     * state is dropped.
     */
    public void clearForTenant(long guildId) {
        lastLookahead.remove(guildId);
        log.info("Cleared prebuffer state for guild {}", guildId);
    }

    public synchronized CacheStats stats() {
        int resolved = 0;
        int pending = 0;
        for (PrebufferEntry e : entries.values()) {
            if (e.isResolved()) resolved++;
            else if (e.isPending()) pending++;
        }
        return new CacheStats(entries.size(), resolved, pending);
    }

    synchronized boolean contains(String key) {
        return entries.containsKey(key);
    }

    private synchronized PrebufferEntry peek(String key) {
        return entries.get(key);
    }

    /** An entry and whether this call started its resolution. */
    private record Acquired(PrebufferEntry entry, boolean started) {
    }

    /** The existing entry for the track, or a new pending one whose resolution is started. */
    private Acquired acquire(Track track, TrackResolver resolver) {
        CompletableFuture<String> raw;
        PrebufferEntry entry;
        synchronized (this) {
            PrebufferEntry existing = entries.get(track.fingerprint());
            if (existing != null) return new Acquired(existing, false);

            raw = new CompletableFuture<>();
            entry = new PrebufferEntry(track.fingerprint());
            PrebufferEntry self = entry;
            entry.attach(raw.whenComplete((address, error) -> settle(self, track, address, error)));
            entries.put(entry.key(), entry);
            evictIfOverCapacity();
        }

        try {
            executor.execute(() -> {
                try {
                    raw.complete(resolver.resolve(track));
                } catch (Throwable t) {
                    raw.completeExceptionally(t);
                }
            });
        } catch (RejectedExecutionException e) {
            raw.completeExceptionally(new ResolutionException("Prebuffer executor rejected " + track.title(), e));
        }
        return new Acquired(entry, true);
    }

    private void settle(PrebufferEntry entry, Track track, String address, Throwable error) {
        if (error == null) {
            entry.markResolved(address);
            log.info("Prebuffered {} successfully", track.title());
            return;
        }
        synchronized (this) {
            entries.remove(entry.key(), entry);
        }
        log.warn("Failed to prebuffer {}: {}", track.title(), error.getMessage());
    }

    private static String await(PrebufferEntry entry, Track track) {
        try {
            return entry.future().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ResolutionException("Interrupted while resolving " + track.title(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ResolutionException re) throw re;
            throw new ResolutionException("Resolving " + track.title() + " failed", cause);
        }
    }
}
