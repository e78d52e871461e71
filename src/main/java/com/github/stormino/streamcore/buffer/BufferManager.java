package com.github.stormino.streamcore.buffer;

import com.github.stormino.streamcore.broadcast.Subscription;
import com.github.stormino.streamcore.broadcast.UpdateStream;
import com.github.stormino.streamcore.model.BufferConfiguration;
import com.github.stormino.streamcore.model.MemoryState;
import com.github.stormino.streamcore.model.NetworkQuality;

import java.util.function.Consumer;

/**
 * Owns the authoritative buffer configuration and recomputes it whenever
 * memory or network conditions change.
 */
public interface BufferManager extends BufferSizeProvider {

    void updateMemoryState(MemoryState state);

    void updateNetworkQuality(NetworkQuality quality);

    /**
     * Receive every configuration change from now on.
     */
    Subscription subscribe(Consumer<? super BufferConfiguration> listener);

    /**
     * Lazy sequence of configuration changes from now on. Each call opens an
     * independent stream.
     */
    UpdateStream<BufferConfiguration> configurationStream();
}
