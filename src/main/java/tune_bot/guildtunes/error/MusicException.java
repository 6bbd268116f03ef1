package tune_bot.guildtunes.error;

/** Base exception for everything that can go wrong while queueing or playing music. */
public class MusicException extends RuntimeException {

    public MusicException(String message) {
        super(message);
    }

    public MusicException(String message, Throwable cause) {
        super(message, cause);
    }
}
