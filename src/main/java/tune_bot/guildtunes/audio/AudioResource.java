package tune_bot.guildtunes.audio;

/** A loaded, playable stream bound to one address. */
public interface AudioResource {

    String address();

    /** @param volume gain in [0,1] */
    void setVolume(float volume);
}
