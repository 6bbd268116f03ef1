package tune_bot.guildtunes.audio;

/** Factory for per-guild audio players. */
public interface AudioBackend {

    GuildAudioPlayer createPlayer(long guildId, PlayerEventListener listener);
}
