package tune_bot.guildtunes.music;

import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.entities.GuildVoiceState;
import net.dv8tion.jda.api.entities.Member;
import net.dv8tion.jda.api.entities.channel.middleman.AudioChannel;
import net.dv8tion.jda.api.entities.channel.unions.AudioChannelUnion;
import net.dv8tion.jda.api.events.guild.voice.GuildVoiceUpdateEvent;
import net.dv8tion.jda.api.events.interaction.command.SlashCommandInteractionEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import net.dv8tion.jda.api.interactions.commands.OptionMapping;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import tune_bot.guildtunes.audio.ConnectionProvider;
import tune_bot.guildtunes.audio.VoiceConnection;
import tune_bot.guildtunes.error.ErrorReporter;
import tune_bot.guildtunes.resolve.TrackResolverRegistry;
import tune_bot.guildtunes.ui.PlayerUI;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Slash-command front end. Every command maps onto one {@link PlaybackController} call; any
 * error that escapes is logged and answered with a generic failure message.
 */
@Component
public class CommandListener extends ListenerAdapter {

    private static final Logger log = LoggerFactory.getLogger(CommandListener.class);
    static final String GENERIC_FAILURE = "An error occurred while executing this command. Please try again.";

    private final PlaybackController controller;
    private final QueueManager queueManager;
    private final TrackResolverRegistry resolvers;
    private final ConnectionProvider connectionProvider;
    private final ErrorReporter errorReporter;
    private final Executor commandExecutor;

    // guild-user-query of /play commands still being processed
    private final Map<String, Boolean> playInFlight = new ConcurrentHashMap<>();

    public CommandListener(PlaybackController controller,
                           QueueManager queueManager,
                           TrackResolverRegistry resolvers,
                           ConnectionProvider connectionProvider,
                           ErrorReporter errorReporter,
                           @Qualifier("commandExecutor") Executor commandExecutor) {
        this.controller = controller;
        this.queueManager = queueManager;
        this.resolvers = resolvers;
        this.connectionProvider = connectionProvider;
        this.errorReporter = errorReporter;
        this.commandExecutor = commandExecutor;
    }

    @Override
    public void onSlashCommandInteraction(@NotNull SlashCommandInteractionEvent e) {
        Guild guild = e.getGuild();
        if (guild == null) {
            e.reply("This command only works in a server.").setEphemeral(true).queue();
            return;
        }
        log.info("/{} by {} in guild {}", e.getName(), e.getUser().getName(), guild.getId());

        // anything that may wait on a lookup or a voice connection leaves the gateway thread
        switch (e.getName()) {
            case "play" -> e.deferReply().queue(ok -> runAsync(e, () -> handlePlay(e, guild)), err -> deferFailed(e, err));
            case "skip" -> e.deferReply().queue(ok -> runAsync(e, () -> handleSkip(e, guild)), err -> deferFailed(e, err));
            case "previous" -> e.deferReply().queue(ok -> runAsync(e, () -> handlePrevious(e, guild)), err -> deferFailed(e, err));
            default -> guarded(e, () -> handleImmediate(e, guild));
        }
    }

    private void handleImmediate(SlashCommandInteractionEvent e, Guild guild) {
        long guildId = guild.getIdLong();
        switch (e.getName()) {
            case "pause" -> replyBoolean(e, controller.pause(guildId), "⏸ Paused.", "Nothing is playing.");
            case "resume" -> replyBoolean(e, controller.resume(guildId), "▶ Resumed.", "Nothing is paused.");
            case "stop" -> {
                controller.stop(guildId);
                e.reply("⏹ Stopped and cleared the queue.").queue();
            }
            case "volume" -> {
                int level = e.getOption("level", 50, OptionMapping::getAsInt);
                replyBoolean(e, controller.setVolume(guildId, level / 100f),
                        "🔊 Volume set to " + level + "%",
                        "Volume can only be changed while a song is playing.");
            }
            case "queue" -> {
                List<Track> tracks = queueManager.snapshot(guildId);
                if (tracks.isEmpty()) {
                    e.reply("The queue is empty.").setEphemeral(true).queue();
                    return;
                }
                e.replyEmbeds(PlayerUI.queue(tracks, controller.status(guildId))).queue();
            }
            case "nowplaying" -> {
                QueueStatus status = controller.status(guildId);
                if (status.currentTrack() == null || !status.playing()) {
                    e.reply("Nothing is playing.").setEphemeral(true).queue();
                    return;
                }
                e.replyEmbeds(PlayerUI.nowPlaying(status.currentTrack(), status)).queue();
            }
            case "shuffle" -> {
                if (queueManager.getOrCreate(guildId).size() <= 1) {
                    e.reply("Not enough songs to shuffle.").setEphemeral(true).queue();
                    return;
                }
                controller.shuffle(guildId);
                e.reply("🔀 Shuffled the queue.").queue();
            }
            case "leave" -> {
                controller.disconnect(guildId);
                guild.getAudioManager().closeAudioConnection();
                e.reply("👋 Left the voice channel.").queue();
            }
            default -> e.reply("Unknown command.").setEphemeral(true).queue();
        }
    }

    private void handlePlay(SlashCommandInteractionEvent e, Guild guild) {
        String query = e.getOption("query", OptionMapping::getAsString);
        Member member = e.getMember();
        AudioChannel channel = voiceChannelOf(member);
        if (query == null || query.isBlank()) {
            respond(e, "Tell me what to play.");
            return;
        }
        if (channel == null) {
            respond(e, "You need to be in a voice channel to play music!");
            return;
        }

        long guildId = guild.getIdLong();
        String key = guildId + "-" + e.getUser().getId() + "-" + query;
        if (playInFlight.putIfAbsent(key, Boolean.TRUE) != null) {
            respond(e, "A play command with this query is already being processed. Please wait...");
            return;
        }
        try {
            List<Track> found = resolvers.search(query, e.getUser().getName());
            if (found.isEmpty()) {
                respond(e, "No songs found for your query.");
                return;
            }
            Track track = found.get(0).requestedBy(e.getUser().getName());
            if (!queueManager.enqueue(guildId, track)) {
                respond(e, "Queue is full! Please try again later.");
                return;
            }

            if (!queueManager.getOrCreate(guildId).isPlaying()) {
                VoiceConnection connection = connectionProvider.connect(guild, channel);
                controller.play(guildId, connection);
                respond(e, playReply(track, controller.status(guildId)));
            } else {
                int position = queueManager.getOrCreate(guildId).size();
                controller.triggerPrebuffer(guildId);
                respond(e, "Added to queue: **" + track.title() + "** by **" + track.artist()
                        + "** (Position: " + position + ")");
            }
        } finally {
            playInFlight.remove(key);
        }
    }

    /**
     * Reply for a /play that tried to start playback. The controller may have started another
     * track, recovered past a broken one, or dropped the call while another play was running.
     */
    static String playReply(Track requested, QueueStatus status) {
        Track current = status.currentTrack();
        if (status.playing() && current != null) {
            return "Now playing: **" + current.title() + "** by **" + current.artist()
                    + "** (" + current.platform().displayName() + ")";
        }
        if (status.queueLength() > 0) {
            return "Added to queue: **" + requested.title() + "** by **" + requested.artist()
                    + "** (Position: " + status.queueLength() + ")";
        }
        return "Could not play **" + requested.title() + "**.";
    }

    private void handleSkip(SlashCommandInteractionEvent e, Guild guild) {
        Track next = controller.skip(guild.getIdLong());
        respond(e, next != null
                ? "⏭ Skipped! Now playing: **" + next.title() + "** by **" + next.artist() + "**"
                : "⏭ Skipped! No more songs in the queue.");
    }

    private void handlePrevious(SlashCommandInteractionEvent e, Guild guild) {
        Track previous = controller.previous(guild.getIdLong());
        respond(e, previous != null
                ? "⏮ Now playing: **" + previous.title() + "** by **" + previous.artist() + "**"
                : "There is no previous song.");
    }

    /** Leaves once the last human has left the bot's channel. */
    @Override
    public void onGuildVoiceUpdate(@NotNull GuildVoiceUpdateEvent event) {
        if (event.getMember().getUser().isBot()) return;

        Guild guild = event.getGuild();
        GuildVoiceState self = guild.getSelfMember().getVoiceState();
        AudioChannelUnion botChannel = self != null ? self.getChannel() : null;
        AudioChannelUnion left = event.getChannelLeft();
        if (botChannel == null || left == null || botChannel.getIdLong() != left.getIdLong()) return;

        boolean anyoneLeft = botChannel.getMembers().stream().anyMatch(m -> !m.getUser().isBot());
        if (!anyoneLeft) {
            log.info("All users left voice channel in guild {}, disconnecting", guild.getId());
            controller.disconnect(guild.getIdLong());
            guild.getAudioManager().closeAudioConnection();
        }
    }

    // ---- helpers ----

    private void deferFailed(SlashCommandInteractionEvent e, Throwable err) {
        log.warn("Could not acknowledge /{} in guild {}: {}", e.getName(), e.getGuild() != null ? e.getGuild().getId() : "-", err.getMessage());
    }

    private void runAsync(SlashCommandInteractionEvent e, Runnable work) {
        commandExecutor.execute(() -> guarded(e, work));
    }

    private void guarded(SlashCommandInteractionEvent e, Runnable work) {
        try {
            work.run();
        } catch (RuntimeException ex) {
            errorReporter.commandError(e.getName(), e.getGuild() != null ? e.getGuild().getIdLong() : null,
                    e.getUser().getName(), ex);
            if (e.isAcknowledged()) {
                e.getHook().editOriginal(GENERIC_FAILURE).queue(null, err -> log.error("Failed to send error message", err));
            } else {
                e.reply(GENERIC_FAILURE).setEphemeral(true).queue(null, err -> log.error("Failed to send error message", err));
            }
        }
    }

    private void replyBoolean(SlashCommandInteractionEvent e, boolean ok, String success, String failure) {
        if (ok) {
            e.reply(success).queue();
        } else {
            e.reply(failure).setEphemeral(true).queue();
        }
    }

    private void respond(SlashCommandInteractionEvent e, String content) {
        e.getHook().editOriginal(content).queue();
    }

    private static AudioChannel voiceChannelOf(Member member) {
        if (member == null || member.getVoiceState() == null || !member.getVoiceState().inAudioChannel()) {
            return null;
        }
        return member.getVoiceState().getChannel();
    }
}
