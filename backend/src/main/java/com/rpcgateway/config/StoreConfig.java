package com.rpcgateway.config;

import com.rpcgateway.store.EpochBlockMapStore;
import com.rpcgateway.store.MongoEpochBlockMapStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.MongoDatabaseFactory;
import org.springframework.data.mongodb.MongoTransactionManager;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Registers the MongoDB epoch to block map store when rpcgateway.store.mongo.enabled=true.
 * Batch writes run in a Mongo transaction, so the database must be a replica set.
 */
@Configuration
@ConditionalOnProperty(prefix = "rpcgateway.store.mongo", name = "enabled", havingValue = "true")
public class StoreConfig {

    @Bean
    public MongoTransactionManager mongoTransactionManager(MongoDatabaseFactory databaseFactory) {
        return new MongoTransactionManager(databaseFactory);
    }

    @Bean
    public EpochBlockMapStore epochBlockMapStore(MongoTemplate mongoTemplate,
                                                 MongoTransactionManager mongoTransactionManager) {
        MongoEpochBlockMapStore store =
                new MongoEpochBlockMapStore(mongoTemplate, new TransactionTemplate(mongoTransactionManager));
        store.ensureIndexes();
        return store;
    }
}
