package tune_bot.guildtunes.error;

/** A platform lookup failed to produce a streamable address. */
public class ResolutionException extends MusicException {

    public ResolutionException(String message) {
        super(message);
    }

    public ResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
