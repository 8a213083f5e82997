package com.acme.finops.pluginhost.process;

import com.acme.finops.pluginhost.manifest.PluginKey;

import java.time.Instant;
import java.util.Objects;

/**
 * One lifecycle transition, published on the supervisor's state-change queue.
 *
 * @param exitCode process exit code for exits, {@code -1} otherwise
 */
public record PluginStateChange(PluginKey key,
                                long handleId,
                                PluginState from,
                                PluginState to,
                                String reason,
                                int exitCode,
                                Instant at) {
    public PluginStateChange {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        reason = reason == null ? "" : reason;
        at = at == null ? Instant.now() : at;
    }
}
