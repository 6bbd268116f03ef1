package tune_bot.guildtunes.music;

import tune_bot.guildtunes.audio.GuildAudioPlayer;
import tune_bot.guildtunes.audio.VoiceConnection;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Controller-side state of one guild: audio player, bound connection, the two non-blocking
 * guards and the event channel.
 */
final class GuildSession {

    private final long guildId;
    private final AtomicBoolean playInProgress = new AtomicBoolean(false);
    private final AtomicBoolean skipInProgress = new AtomicBoolean(false);
    private volatile GuildAudioPlayer player;
    private volatile VoiceConnection connection;
    private volatile GuildEventChannel events;

    GuildSession(long guildId) {
        this.guildId = guildId;
    }

    long guildId() {
        return guildId;
    }

    AtomicBoolean playInProgress() {
        return playInProgress;
    }

    AtomicBoolean skipInProgress() {
        return skipInProgress;
    }

    synchronized GuildAudioPlayer player(Supplier<GuildAudioPlayer> factory) {
        if (player == null) {
            player = factory.get();
        }
        return player;
    }

    Optional<GuildAudioPlayer> existingPlayer() {
        return Optional.ofNullable(player);
    }

    VoiceConnection connection() {
        return connection;
    }

    void bindConnection(VoiceConnection connection) {
        this.connection = connection;
    }

    GuildEventChannel events() {
        return events;
    }

    void attachEvents(GuildEventChannel events) {
        this.events = events;
    }
}
