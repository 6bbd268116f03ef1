package tune_bot.guildtunes.music;

/** Read-only view of a guild's queue for display. */
public record QueueStatus(Track currentTrack, int queueLength, int currentIndex,
                          boolean playing, boolean paused, float volume) {

    public String stateLabel() {
        if (!playing) return "Stopped";
        return paused ? "Paused" : "Playing";
    }
}
