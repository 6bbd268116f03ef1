package tune_bot.guildtunes.audio;

/** A guild's voice connection. */
public interface VoiceConnection {

    long guildId();

    /** Routes the player's audio into this connection. */
    void subscribe(GuildAudioPlayer player);

    void destroy();
}
