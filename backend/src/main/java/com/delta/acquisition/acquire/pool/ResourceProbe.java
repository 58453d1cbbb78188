package com.delta.acquisition.acquire.pool;

import java.time.Duration;

public interface ResourceProbe {
    /**
     * @return true if the item is usable again
     */
    boolean probe(PoolItemView item, Duration timeout);
}
