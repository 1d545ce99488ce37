package com.rpcgateway.store;

import java.util.List;
import java.util.Optional;

/**
 * Durable mapping from epoch number to the block range it spans.
 */
public interface EpochBlockMapStore {

    /** Saves the mappings of the given epochs; no-op for an empty list. */
    void pushn(List<EpochData> epochs);

    /** Highest epoch stored, empty when the store is empty. */
    Optional<Long> maxEpoch();

    Optional<BlockRange> blockRange(long epoch);

    Optional<String> pivotHash(long epoch);
}
