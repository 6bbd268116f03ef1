package tune_bot.guildtunes.config;

import com.sedmelluq.discord.lavaplayer.player.AudioPlayerManager;
import com.sedmelluq.discord.lavaplayer.player.DefaultAudioPlayerManager;
import com.sedmelluq.discord.lavaplayer.source.AudioSourceManagers;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import tune_bot.guildtunes.error.ErrorReporter;
import tune_bot.guildtunes.music.Platform;
import tune_bot.guildtunes.resolve.CrossPlatformResolver;
import tune_bot.guildtunes.resolve.LavaplayerSearchResolver;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;

@Configuration
public class MusicConfig {

    @Bean(destroyMethod = "shutdown")
    public AudioPlayerManager audioPlayerManager() {
        AudioPlayerManager manager = new DefaultAudioPlayerManager();
        AudioSourceManagers.registerRemoteSources(manager);
        return manager;
    }

    @Bean
    public LavaplayerSearchResolver youtubeResolver(AudioPlayerManager manager, ErrorReporter errorReporter) {
        return new LavaplayerSearchResolver(manager, Platform.YOUTUBE, "ytsearch:", errorReporter);
    }

    @Bean
    public LavaplayerSearchResolver soundcloudResolver(AudioPlayerManager manager, ErrorReporter errorReporter) {
        return new LavaplayerSearchResolver(manager, Platform.SOUNDCLOUD, "scsearch:", errorReporter);
    }

    // Spotify tracks are played from their YouTube equivalent
    @Bean
    public CrossPlatformResolver spotifyResolver(@Qualifier("youtubeResolver") LavaplayerSearchResolver youtubeResolver) {
        return new CrossPlatformResolver(Platform.SPOTIFY, youtubeResolver);
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService prebufferExecutor(@Value("${music.prebuffer.threads:2}") int threads) {
        return Executors.newFixedThreadPool(threads, daemonThreads("prebuffer-"));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService musicEventExecutor() {
        return Executors.newCachedThreadPool(daemonThreads("music-events-"));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService commandExecutor() {
        return Executors.newCachedThreadPool(daemonThreads("commands-"));
    }

    static ThreadFactory daemonThreads(String prefix) {
        CustomizableThreadFactory factory = new CustomizableThreadFactory(prefix);
        factory.setDaemon(true);
        return factory;
    }
}
