package tune_bot.guildtunes.audio;

import java.util.Optional;

/** One guild's audio player. */
public interface GuildAudioPlayer {

    /**
     * Loads {@code address} into a playable resource. Blocks until loading finishes.
     *
     * @throws tune_bot.guildtunes.error.VoiceException when nothing playable can be built
     */
    AudioResource createResource(String address);

    void play(AudioResource resource);

    void pause();

    void unpause();

    /** Stops the current resource. Emits an idle signal if something was playing. */
    void stop();

    PlayerStatus status();

    /** The resource currently bound to the player, if any. */
    Optional<AudioResource> currentResource();

    void destroy();
}
