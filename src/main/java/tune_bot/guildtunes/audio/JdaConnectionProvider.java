package tune_bot.guildtunes.audio;

import net.dv8tion.jda.api.audio.hooks.ConnectionStatus;
import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.entities.channel.middleman.AudioChannel;
import net.dv8tion.jda.api.managers.AudioManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import tune_bot.guildtunes.error.VoiceException;

import java.time.Duration;

@Component
public class JdaConnectionProvider implements ConnectionProvider {

    private static final Logger log = LoggerFactory.getLogger(JdaConnectionProvider.class);
    private static final long POLL_MILLIS = 100;

    private final Duration timeout;

    public JdaConnectionProvider(@Value("${music.connection-timeout:30s}") Duration timeout) {
        this.timeout = timeout;
    }

    @Override
    public VoiceConnection connect(Guild guild, AudioChannel channel) {
        AudioManager audioManager = guild.getAudioManager();
        if (!audioManager.isConnected()) {
            audioManager.openAudioConnection(channel);
        }
        long deadline = System.nanoTime() + timeout.toNanos();
        while (audioManager.getConnectionStatus() != ConnectionStatus.CONNECTED) {
            if (System.nanoTime() >= deadline) {
                log.error("Voice connection in guild {} not ready after {}", guild.getId(), timeout);
                throw new VoiceException("Voice connection not ready within " + timeout.toSeconds() + "s");
            }
            try {
                Thread.sleep(POLL_MILLIS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new VoiceException("Interrupted while waiting for voice connection", e);
            }
        }
        return new JdaVoiceConnection(guild);
    }
}
