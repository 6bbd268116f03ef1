package tune_bot.guildtunes.config;

import net.dv8tion.jda.api.interactions.commands.build.CommandData;
import net.dv8tion.jda.api.interactions.commands.build.SlashCommandData;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CommandRegistrarTest {

    @Test
    void registersEveryMusicCommand() {
        assertThat(CommandRegistrar.commands()).extracting(CommandData::getName)
                .containsExactlyInAnyOrder("play", "skip", "previous", "pause", "resume", "stop",
                        "volume", "queue", "nowplaying", "shuffle", "leave");
    }

    @Test
    void playAndVolumeTakeRequiredOptions() {
        for (CommandData data : CommandRegistrar.commands()) {
            SlashCommandData slash = (SlashCommandData) data;
            if (slash.getName().equals("play") || slash.getName().equals("volume")) {
                assertThat(slash.getOptions()).hasSize(1);
                assertThat(slash.getOptions().get(0).isRequired()).isTrue();
            }
        }
    }
}
