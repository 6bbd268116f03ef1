package tune_bot.guildtunes.audio;

import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.managers.AudioManager;
import tune_bot.guildtunes.error.VoiceException;

/** Voice connection backed by the guild's JDA {@link AudioManager}. */
public class JdaVoiceConnection implements VoiceConnection {

    private final Guild guild;

    public JdaVoiceConnection(Guild guild) {
        this.guild = guild;
    }

    @Override
    public long guildId() {
        return guild.getIdLong();
    }

    @Override
    public void subscribe(GuildAudioPlayer player) {
        if (!(player instanceof LavaplayerAudioBackend.LavaGuildAudioPlayer lava)) {
            throw new VoiceException("Cannot route audio from " + player.getClass().getSimpleName());
        }
        guild.getAudioManager().setSendingHandler(lava.sendHandler());
    }

    @Override
    public void destroy() {
        AudioManager audioManager = guild.getAudioManager();
        audioManager.setSendingHandler(null);
        audioManager.closeAudioConnection();
    }
}
