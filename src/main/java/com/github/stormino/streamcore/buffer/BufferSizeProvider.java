package com.github.stormino.streamcore.buffer;

import com.github.stormino.streamcore.model.BufferConfiguration;

/**
 * Read-only view of the current buffering decision.
 */
public interface BufferSizeProvider {

    BufferConfiguration getCurrentConfiguration();
}
