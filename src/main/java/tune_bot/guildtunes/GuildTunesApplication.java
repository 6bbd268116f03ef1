package tune_bot.guildtunes;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GuildTunesApplication {

    public static void main(String[] args) {
        SpringApplication.run(GuildTunesApplication.class, args);
    }
}
