package tune_bot.guildtunes.audio;

@FunctionalInterface
public interface PlayerEventListener {

    void onEvent(PlayerEvent event);
}
