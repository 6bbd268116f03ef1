package tune_bot.guildtunes.prebuffer;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * One cached resolution. Pending while its future is running, resolved once an address is
 * known. Failed resolutions never stay in the cache.
 */
final class PrebufferEntry {

    private final String key;
    private volatile CompletableFuture<String> future;
    private volatile String resolvedAddress;

    PrebufferEntry(String key) {
        this.key = key;
    }

    String key() {
        return key;
    }

    CompletableFuture<String> future() {
        return future;
    }

    void attach(CompletableFuture<String> future) {
        this.future = future;
    }

    void markResolved(String address) {
        this.resolvedAddress = address;
    }

    boolean isResolved() {
        return resolvedAddress != null;
    }

    boolean isPending() {
        return resolvedAddress == null;
    }

    Optional<String> resolvedAddress() {
        return Optional.ofNullable(resolvedAddress);
    }
}
