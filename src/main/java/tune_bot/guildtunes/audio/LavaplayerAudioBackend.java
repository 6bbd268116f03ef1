package tune_bot.guildtunes.audio;

import com.sedmelluq.discord.lavaplayer.player.AudioLoadResultHandler;
import com.sedmelluq.discord.lavaplayer.player.AudioPlayer;
import com.sedmelluq.discord.lavaplayer.player.AudioPlayerManager;
import com.sedmelluq.discord.lavaplayer.player.event.AudioEventAdapter;
import com.sedmelluq.discord.lavaplayer.tools.FriendlyException;
import com.sedmelluq.discord.lavaplayer.track.AudioPlaylist;
import com.sedmelluq.discord.lavaplayer.track.AudioTrack;
import com.sedmelluq.discord.lavaplayer.track.AudioTrackEndReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import tune_bot.guildtunes.error.VoiceException;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * lavaplayer implementation of the audio backend. Track end (other than replacement) is
 * reported as an idle signal, exceptions and stuck tracks as errors.
 */
@Component
public class LavaplayerAudioBackend implements AudioBackend {

    private static final Logger log = LoggerFactory.getLogger(LavaplayerAudioBackend.class);

    private final AudioPlayerManager audioPlayerManager;

    public LavaplayerAudioBackend(AudioPlayerManager audioPlayerManager) {
        this.audioPlayerManager = audioPlayerManager;
    }

    @Override
    public GuildAudioPlayer createPlayer(long guildId, PlayerEventListener listener) {
        LavaGuildAudioPlayer player = new LavaGuildAudioPlayer(guildId, audioPlayerManager.createPlayer(), listener);
        log.debug("Created audio player for guild {}", guildId);
        return player;
    }

    final class LavaGuildAudioPlayer extends AudioEventAdapter implements GuildAudioPlayer {
        private final long guildId;
        private final AudioPlayer player;
        private final PlayerEventListener listener;
        private final AudioPlayerSendHandler sendHandler;
        private volatile LavaAudioResource current;

        LavaGuildAudioPlayer(long guildId, AudioPlayer player, PlayerEventListener listener) {
            this.guildId = guildId;
            this.player = player;
            this.listener = listener;
            this.sendHandler = new AudioPlayerSendHandler(player);
            this.player.addListener(this);
        }

        AudioPlayerSendHandler sendHandler() {
            return sendHandler;
        }

        @Override
        public AudioResource createResource(String address) {
            CompletableFuture<AudioTrack> loaded = new CompletableFuture<>();
            audioPlayerManager.loadItemOrdered(player, address, new AudioLoadResultHandler() {
                @Override
                public void trackLoaded(AudioTrack track) {
                    loaded.complete(track);
                }

                @Override
                public void playlistLoaded(AudioPlaylist playlist) {
                    AudioTrack first = playlist.getSelectedTrack();
                    if (first == null && !playlist.getTracks().isEmpty()) {
                        first = playlist.getTracks().get(0);
                    }
                    if (first != null) {
                        loaded.complete(first);
                    } else {
                        loaded.completeExceptionally(new VoiceException("No playable track in playlist at " + address));
                    }
                }

                @Override
                public void noMatches() {
                    loaded.completeExceptionally(new VoiceException("Nothing playable at " + address));
                }

                @Override
                public void loadFailed(FriendlyException exception) {
                    loaded.completeExceptionally(new VoiceException("Failed to load " + address + ": " + exception.getMessage(), exception));
                }
            });
            try {
                return new LavaAudioResource(address, loaded.get(), player);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new VoiceException("Interrupted while loading " + address, e);
            } catch (ExecutionException e) {
                if (e.getCause() instanceof VoiceException ve) throw ve;
                throw new VoiceException("Failed to load " + address, e.getCause());
            }
        }

        @Override
        public void play(AudioResource resource) {
            if (!(resource instanceof LavaAudioResource lava)) {
                throw new VoiceException("Resource was not created by this backend: " + resource.address());
            }
            current = lava;
            player.playTrack(lava.track());
        }

        @Override
        public void pause() {
            player.setPaused(true);
        }

        @Override
        public void unpause() {
            player.setPaused(false);
        }

        @Override
        public void stop() {
            current = null;
            player.stopTrack();
        }

        @Override
        public PlayerStatus status() {
            if (player.getPlayingTrack() == null) return PlayerStatus.IDLE;
            return player.isPaused() ? PlayerStatus.PAUSED : PlayerStatus.PLAYING;
        }

        @Override
        public Optional<AudioResource> currentResource() {
            return Optional.ofNullable(current);
        }

        @Override
        public void destroy() {
            current = null;
            player.destroy();
        }

        // ---- lavaplayer events ----

        @Override
        public void onPlayerPause(AudioPlayer player) {
            listener.onEvent(PlayerEvent.stateChange(PlayerStatus.PLAYING, PlayerStatus.PAUSED));
        }

        @Override
        public void onPlayerResume(AudioPlayer player) {
            listener.onEvent(PlayerEvent.stateChange(PlayerStatus.PAUSED, PlayerStatus.PLAYING));
        }

        @Override
        public void onTrackStart(AudioPlayer player, AudioTrack track) {
            listener.onEvent(PlayerEvent.stateChange(PlayerStatus.IDLE, PlayerStatus.PLAYING));
        }

        @Override
        public void onTrackEnd(AudioPlayer player, AudioTrack track, AudioTrackEndReason endReason) {
            if (endReason == AudioTrackEndReason.REPLACED) {
                return;
            }
            LavaAudioResource bound = current;
            if (bound != null && bound.track() == track) {
                current = null;
            }
            log.debug("Track ended in guild {}: {}", guildId, endReason);
            listener.onEvent(PlayerEvent.idle());
        }

        @Override
        public void onTrackException(AudioPlayer player, AudioTrack track, FriendlyException exception) {
            listener.onEvent(PlayerEvent.error(exception));
        }

        @Override
        public void onTrackStuck(AudioPlayer player, AudioTrack track, long thresholdMs) {
            listener.onEvent(PlayerEvent.error(new VoiceException("Track stuck for " + thresholdMs + "ms: " + track.getInfo().title)));
            player.stopTrack();
        }
    }

    static final class LavaAudioResource implements AudioResource {
        private final String address;
        private final AudioTrack track;
        private final AudioPlayer player;

        LavaAudioResource(String address, AudioTrack track, AudioPlayer player) {
            this.address = address;
            this.track = track;
            this.player = player;
        }

        AudioTrack track() {
            return track;
        }

        @Override
        public String address() {
            return address;
        }

        @Override
        public void setVolume(float volume) {
            player.setVolume(Math.round(Math.max(0f, Math.min(1f, volume)) * 100));
        }
    }
}
