package tune_bot.guildtunes.music;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tune_bot.guildtunes.audio.PlayerEvent;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Per-guild event queue drained by at most one task at a time, so a guild's player events are
 * handled one after another in arrival order whatever thread emitted them.
 */
final class GuildEventChannel {

    private static final Logger log = LoggerFactory.getLogger(GuildEventChannel.class);

    private final long guildId;
    private final Executor executor;
    private final Consumer<PlayerEvent> consumer;
    private final Queue<PlayerEvent> pending = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean draining = new AtomicBoolean(false);
    private volatile boolean closed = false;

    GuildEventChannel(long guildId, Executor executor, Consumer<PlayerEvent> consumer) {
        this.guildId = guildId;
        this.executor = executor;
        this.consumer = consumer;
    }

    void publish(PlayerEvent event) {
        if (closed) return;
        pending.add(event);
        schedule();
    }

    void close() {
        closed = true;
        pending.clear();
    }

    private void schedule() {
        if (!draining.compareAndSet(false, true)) return;
        try {
            executor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            draining.set(false);
            log.error("Event executor rejected events for guild {}; {} pending", guildId, pending.size(), e);
        }
    }

    private void drain() {
        try {
            PlayerEvent event;
            while (!closed && (event = pending.poll()) != null) {
                try {
                    consumer.accept(event);
                } catch (RuntimeException e) {
                    log.error("Failed to handle {} event in guild {}", event.type(), guildId, e);
                }
            }
        } finally {
            draining.set(false);
        }
        if (!closed && !pending.isEmpty()) {
            schedule();
        }
    }
}
