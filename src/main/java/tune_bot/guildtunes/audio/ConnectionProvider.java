package tune_bot.guildtunes.audio;

import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.entities.channel.middleman.AudioChannel;

/** Joins voice channels. */
public interface ConnectionProvider {

    /**
     * Joins {@code channel} and waits until the connection is ready.
     *
     * @throws tune_bot.guildtunes.error.VoiceException when it isn't ready within the timeout
     */
    VoiceConnection connect(Guild guild, AudioChannel channel);
}
