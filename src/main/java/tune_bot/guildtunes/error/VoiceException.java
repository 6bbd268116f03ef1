package tune_bot.guildtunes.error;

/** Voice connection or audio resource construction failed. */
public class VoiceException extends MusicException {

    public VoiceException(String message) {
        super(message);
    }

    public VoiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
