package tune_bot.guildtunes.config;

import jakarta.annotation.PostConstruct;
import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.JDABuilder;
import net.dv8tion.jda.api.OnlineStatus;
import net.dv8tion.jda.api.entities.Activity;
import net.dv8tion.jda.api.requests.GatewayIntent;
import net.dv8tion.jda.api.utils.cache.CacheFlag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tune_bot.guildtunes.error.ConfigurationException;
import tune_bot.guildtunes.music.CommandListener;

@Configuration
public class BotConfig {

    private static final Logger log = LoggerFactory.getLogger(BotConfig.class);

    // ENV DISCORD_TOKEN > properties discord.token
    @Value("${DISCORD_TOKEN:${discord.token:}}")
    private String token;

    @Value("${discord.activity:music}")
    private String activity;

    @Bean(destroyMethod = "shutdown")
    public JDA jda(CommandListener listener, CommandRegistrar registrar) throws InterruptedException {
        if (token == null || token.isBlank()) {
            throw new ConfigurationException("Discord token is empty. Set DISCORD_TOKEN or discord.token.");
        }

        JDABuilder builder = JDABuilder.createDefault(
                token,
                GatewayIntent.GUILD_VOICE_STATES,
                GatewayIntent.GUILD_MESSAGES
        );

        // intents we don't request would only produce warnings
        builder.disableCache(CacheFlag.EMOJI, CacheFlag.STICKER, CacheFlag.SCHEDULED_EVENTS);

        builder.setStatus(OnlineStatus.ONLINE);
        builder.setActivity(Activity.listening(activity));
        builder.addEventListeners(listener, registrar);

        JDA jda = builder.build();
        jda.awaitReady();
        log.info("JDA ready as {}", jda.getSelfUser().getName());
        return jda;
    }

    @PostConstruct
    void logHint() {
        if (token == null || token.isBlank()) {
            log.warn("DISCORD_TOKEN / discord.token not set");
        }
    }
}
