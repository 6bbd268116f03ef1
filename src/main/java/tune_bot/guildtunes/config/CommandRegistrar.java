package tune_bot.guildtunes.config;

import net.dv8tion.jda.api.events.session.ReadyEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import net.dv8tion.jda.api.interactions.commands.OptionType;
import net.dv8tion.jda.api.interactions.commands.build.CommandData;
import net.dv8tion.jda.api.interactions.commands.build.Commands;
import net.dv8tion.jda.api.interactions.commands.build.OptionData;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/** Registers the slash commands on every guild once JDA is ready. */
@Component
public class CommandRegistrar extends ListenerAdapter {

    private static final Logger log = LoggerFactory.getLogger(CommandRegistrar.class);

    static List<CommandData> commands() {
        return List.of(
                Commands.slash("play", "Play a song or add it to the queue")
                        .addOptions(new OptionData(OptionType.STRING, "query", "Song title, artist, or URL", true)),
                Commands.slash("skip", "Skip the current song"),
                Commands.slash("previous", "Go back to the previous song"),
                Commands.slash("pause", "Pause playback"),
                Commands.slash("resume", "Resume playback"),
                Commands.slash("stop", "Stop playback and clear the queue"),
                Commands.slash("volume", "Set the volume")
                        .addOptions(new OptionData(OptionType.INTEGER, "level", "Volume 0-100", true)
                                .setRequiredRange(0, 100)),
                Commands.slash("queue", "Show the current music queue"),
                Commands.slash("nowplaying", "Show the current song"),
                Commands.slash("shuffle", "Shuffle the upcoming songs"),
                Commands.slash("leave", "Disconnect from the voice channel")
        );
    }

    @Override
    public void onReady(@NotNull ReadyEvent event) {
        List<CommandData> commands = commands();
        event.getJDA().getGuilds().forEach(guild ->
                guild.updateCommands()
                        .addCommands(commands)
                        .queue(ok -> log.info("Registered {} commands in guild {}", commands.size(), guild.getName()),
                                err -> log.warn("Command registration failed in guild {}: {}", guild.getName(), err.getMessage()))
        );
    }
}
