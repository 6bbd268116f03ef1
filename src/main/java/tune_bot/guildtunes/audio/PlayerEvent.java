package tune_bot.guildtunes.audio;

/**
 * Signal emitted by a guild's audio player.
 *
 * @param type  what happened
 * @param from  previous status, for {@link Type#STATE_CHANGE}
 * @param to    new status, for {@link Type#STATE_CHANGE}
 * @param error cause, for {@link Type#ERROR}
 */
public record PlayerEvent(Type type, PlayerStatus from, PlayerStatus to, Throwable error) {

    public enum Type {
        STATE_CHANGE,
        /** The current track is over and nothing is playing. */
        IDLE,
        ERROR
    }

    public static PlayerEvent idle() {
        return new PlayerEvent(Type.IDLE, null, PlayerStatus.IDLE, null);
    }

    public static PlayerEvent stateChange(PlayerStatus from, PlayerStatus to) {
        return new PlayerEvent(Type.STATE_CHANGE, from, to, null);
    }

    public static PlayerEvent error(Throwable error) {
        return new PlayerEvent(Type.ERROR, null, null, error);
    }
}
