package com.github.stormino.streamcore.cleanup;

import java.io.IOException;

/**
 * A cache that can be emptied and sized.
 */
public interface ClearableCache {

    /**
     * Remove every cached item.
     *
     * @return number of items removed
     * @throws IOException if backing storage could not be cleared
     */
    int clearAll() throws IOException;

    /**
     * @return estimated size in bytes, 0 if unknown
     */
    long estimateSize();
}
