package tune_bot.guildtunes.error;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Single place where failures are reported. Recovery decisions stay with the caller;
 * this only records what happened and where.
 */
@Component
public class ErrorReporter {

    private static final Logger log = LoggerFactory.getLogger(ErrorReporter.class);

    public void voiceError(long guildId, Throwable error) {
        log.error("Voice error in guild {}: {}", guildId, error.getMessage(), error);
    }

    public void playerError(long guildId, Throwable error) {
        log.error("Audio player error in guild {}: {}", guildId, error.getMessage(), error);
    }

    public void serviceError(String platform, String operation, Throwable error) {
        log.error("Error {} {}: {}", operation, platform, error.getMessage(), error);
    }

    public void commandError(String command, Long guildId, String user, Throwable error) {
        log.error("Error in command /{} (guild {}, user {}): {}", command, guildId, user, error.getMessage(), error);
    }
}
