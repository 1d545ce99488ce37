package com.rpcgateway.store;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Epoch to block range mapping, persisted in epoch_block_map.
 * pivotHash is kept for parent hash checking when the next epoch is synced.
 */
@Document(collection = "epoch_block_map")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class EpochBlockMap {

    @Id
    private String id;
    @Indexed(unique = true)
    @EqualsAndHashCode.Include
    private long epoch;
    private long bnMin;
    private long bnMax;
    private String pivotHash;

    static EpochBlockMap of(EpochData data) {
        if (data.blocks().isEmpty()) {
            throw new IllegalArgumentException("Epoch " + data.number() + " has no blocks");
        }
        BlockInfo pivot = data.pivotBlock();
        EpochBlockMap map = new EpochBlockMap();
        map.setEpoch(data.number());
        map.setBnMin(data.blocks().get(0).blockNumber());
        map.setBnMax(pivot.blockNumber());
        map.setPivotHash(pivot.hash());
        return map;
    }
}
