package tune_bot.guildtunes.error;

/** Missing settings or a platform without a registered resolver. Never retried. */
public class ConfigurationException extends MusicException {

    public ConfigurationException(String message) {
        super(message);
    }
}
