package com.rpcgateway.store;

import java.util.List;

/**
 * Blocks of one epoch in execution order. The last block is the pivot block.
 */
public record EpochData(long number, List<BlockInfo> blocks) {

    public EpochData {
        blocks = blocks == null ? List.of() : List.copyOf(blocks);
    }

    public BlockInfo pivotBlock() {
        if (blocks.isEmpty()) {
            throw new IllegalArgumentException("Epoch " + number + " has no blocks");
        }
        return blocks.get(blocks.size() - 1);
    }
}
