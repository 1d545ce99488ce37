package com.rpcgateway.store;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * EpochBlockMapStore on MongoTemplate. Inserts go out in batches of {@link #BATCH_SIZE}
 * inside one transaction, so a failed batch leaves none of the epochs behind.
 * Mongo transactions need a replica set.
 */
@Slf4j
@RequiredArgsConstructor
public class MongoEpochBlockMapStore implements EpochBlockMapStore {

    static final int BATCH_SIZE = 1000;

    private final MongoTemplate mongoTemplate;
    private final TransactionTemplate transactionTemplate;

    public void ensureIndexes() {
        mongoTemplate.indexOps(EpochBlockMap.class)
                .ensureIndex(new Index().on("epoch", Sort.Direction.ASC).unique());
    }

    @Override
    public void pushn(List<EpochData> epochs) {
        if (epochs == null || epochs.isEmpty()) {
            return;
        }
        List<EpochBlockMap> mappings = new ArrayList<>(epochs.size());
        for (EpochData data : epochs) {
            mappings.add(EpochBlockMap.of(data));
        }
        transactionTemplate.executeWithoutResult(status -> {
            for (int from = 0; from < mappings.size(); from += BATCH_SIZE) {
                List<EpochBlockMap> batch = mappings.subList(from, Math.min(from + BATCH_SIZE, mappings.size()));
                mongoTemplate.insert(batch, EpochBlockMap.class);
            }
        });
        log.debug("Saved epoch to block mappings for epochs {}..{}",
                epochs.get(0).number(), epochs.get(epochs.size() - 1).number());
    }

    @Override
    public Optional<Long> maxEpoch() {
        Query query = new Query().with(Sort.by(Sort.Direction.DESC, "epoch")).limit(1);
        return Optional.ofNullable(mongoTemplate.findOne(query, EpochBlockMap.class))
                .map(EpochBlockMap::getEpoch);
    }

    @Override
    public Optional<BlockRange> blockRange(long epoch) {
        return findByEpoch(epoch).map(m -> new BlockRange(m.getBnMin(), m.getBnMax()));
    }

    @Override
    public Optional<String> pivotHash(long epoch) {
        return findByEpoch(epoch).map(EpochBlockMap::getPivotHash);
    }

    private Optional<EpochBlockMap> findByEpoch(long epoch) {
        return Optional.ofNullable(mongoTemplate.findOne(new Query(where("epoch").is(epoch)), EpochBlockMap.class));
    }
}
