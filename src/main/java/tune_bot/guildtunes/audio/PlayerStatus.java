package tune_bot.guildtunes.audio;

public enum PlayerStatus {
    IDLE,
    PLAYING,
    PAUSED
}
