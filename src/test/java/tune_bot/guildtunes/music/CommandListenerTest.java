package tune_bot.guildtunes.music;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static tune_bot.guildtunes.support.Tracks.youtube;

class CommandListenerTest {

    @Test
    void replyNamesTrackThatActuallyStarted() {
        Track requested = youtube("requested");
        Track earlier = youtube("earlier");

        String reply = CommandListener.playReply(requested, new QueueStatus(earlier, 2, 0, true, false, 0.5f));

        assertThat(reply).startsWith("Now playing: **earlier**").doesNotContain("requested");
    }

    @Test
    void droppedPlayReportsQueuePosition() {
        Track requested = youtube("requested");

        String reply = CommandListener.playReply(requested, new QueueStatus(youtube("first"), 3, 0, false, false, 0.5f));

        assertThat(reply).isEqualTo("Added to queue: **requested** by **Artist requested** (Position: 3)");
    }

    @Test
    void nothingLeftToPlayIsReported() {
        Track requested = youtube("requested");

        String reply = CommandListener.playReply(requested, new QueueStatus(null, 0, 0, false, false, 0.5f));

        assertThat(reply).isEqualTo("Could not play **requested**.");
    }
}
