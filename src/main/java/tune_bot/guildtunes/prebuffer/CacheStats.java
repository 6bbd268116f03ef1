package tune_bot.guildtunes.prebuffer;

/** Entry counts of the prebuffer cache, for logging and status output. */
public record CacheStats(int size, int resolved, int pending) {
}
