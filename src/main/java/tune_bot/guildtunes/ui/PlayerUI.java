package tune_bot.guildtunes.ui;

import net.dv8tion.jda.api.EmbedBuilder;
import net.dv8tion.jda.api.entities.MessageEmbed;
import tune_bot.guildtunes.music.QueueStatus;
import tune_bot.guildtunes.music.Track;

import java.awt.Color;
import java.time.Instant;
import java.util.List;

public final class PlayerUI {

    static final int QUEUE_PAGE_SIZE = 10;
    private static final Color ACCENT = new Color(0x0099FF);

    private PlayerUI() {
    }

    public static MessageEmbed nowPlaying(Track track, QueueStatus status) {
        return base("🎵 Now Playing")
                .setDescription("**" + track.title() + "** by " + track.artist())
                .addField("Duration", formatDuration(track.durationSeconds()), true)
                .addField("Platform", track.platform().displayName(), true)
                .addField("Requested by", track.requestedBy().isEmpty() ? "-" : track.requestedBy(), true)
                .addField("Status", status.stateLabel(), true)
                .addField("Volume", formatVolume(status.volume()), true)
                .setThumbnail(track.thumbnailUrl())
                .build();
    }

    public static MessageEmbed queue(List<Track> tracks, QueueStatus status) {
        EmbedBuilder eb = base("📋 Music Queue");
        if (tracks.isEmpty()) {
            return eb.setDescription("The queue is empty.").build();
        }
        eb.setDescription(queueLines(tracks, status.currentIndex()));
        eb.addField("Total Songs", String.valueOf(tracks.size()), true);
        eb.addField("Status", status.stateLabel(), true);
        eb.addField("Volume", formatVolume(status.volume()), true);
        if (tracks.size() > QUEUE_PAGE_SIZE) {
            eb.setFooter("... and " + (tracks.size() - QUEUE_PAGE_SIZE) + " more songs");
        }
        return eb.build();
    }

    static String queueLines(List<Track> tracks, int currentIndex) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < Math.min(QUEUE_PAGE_SIZE, tracks.size()); i++) {
            Track t = tracks.get(i);
            String prefix = i == currentIndex ? "▶️" : (i + 1) + ".";
            sb.append(prefix).append(" **").append(safe(t.title(), 70)).append("** by ")
                    .append(safe(t.artist(), 40)).append(" (").append(formatDuration(t.durationSeconds())).append(")\n");
        }
        return sb.toString();
    }

    public static String formatDuration(long seconds) {
        long h = seconds / 3600;
        long m = (seconds % 3600) / 60;
        long s = seconds % 60;
        if (h > 0) return String.format("%d:%02d:%02d", h, m, s);
        return String.format("%d:%02d", m, s);
    }

    public static String formatVolume(float volume) {
        return Math.round(volume * 100) + "%";
    }

    static String safe(String s, int max) {
        if (s == null) return "";
        return s.length() > max ? s.substring(0, max - 1) + "…" : s;
    }

    private static EmbedBuilder base(String title) {
        return new EmbedBuilder()
                .setTitle(title)
                .setColor(ACCENT)
                .setTimestamp(Instant.now());
    }
}
