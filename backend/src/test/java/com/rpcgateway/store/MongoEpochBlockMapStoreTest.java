package com.rpcgateway.store;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.SimpleTransactionStatus;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MongoEpochBlockMapStoreTest {

    @Mock
    private MongoTemplate mongoTemplate;
    @Mock
    private PlatformTransactionManager transactionManager;
    @Captor
    private ArgumentCaptor<Collection<EpochBlockMap>> batches;
    @Captor
    private ArgumentCaptor<Query> queries;

    private MongoEpochBlockMapStore store() {
        return new MongoEpochBlockMapStore(mongoTemplate, new TransactionTemplate(transactionManager));
    }

    private static List<EpochData> epochs(long from, long to) {
        List<EpochData> epochs = new ArrayList<>();
        for (long e = from; e <= to; e++) {
            epochs.add(new EpochData(e, List.of(new BlockInfo(e * 2, "0xa" + e), new BlockInfo(e * 2 + 1, "0xb" + e))));
        }
        return epochs;
    }

    @Test
    @DisplayName("pushn inserts in batches of 1000")
    void pushnBatches() {
        SimpleTransactionStatus status = new SimpleTransactionStatus();
        when(transactionManager.getTransaction(any())).thenReturn(status);

        store().pushn(epochs(1, 1500));

        verify(mongoTemplate, times(2)).insert(batches.capture(), eq(EpochBlockMap.class));
        assertThat(batches.getAllValues()).extracting(Collection::size).containsExactly(1000, 500);
        EpochBlockMap first = batches.getAllValues().get(0).iterator().next();
        assertThat(first.getEpoch()).isEqualTo(1);
        assertThat(first.getBnMin()).isEqualTo(2);
        assertThat(first.getBnMax()).isEqualTo(3);
        assertThat(first.getPivotHash()).isEqualTo("0xb1");
        verify(transactionManager).commit(status);
    }

    @Test
    @DisplayName("a failing batch rolls back the batches before it")
    void failedBatchRollsBack() {
        SimpleTransactionStatus status = new SimpleTransactionStatus();
        when(transactionManager.getTransaction(any())).thenReturn(status);
        when(mongoTemplate.insert(anyCollection(), eq(EpochBlockMap.class)))
                .thenAnswer(invocation -> invocation.getArgument(0))
                .thenThrow(new DuplicateKeyException("E11000 duplicate key error, epoch: 1200"));

        assertThatThrownBy(() -> store().pushn(epochs(1, 1500)))
                .isInstanceOf(DuplicateKeyException.class);

        verify(mongoTemplate, times(2)).insert(anyCollection(), eq(EpochBlockMap.class));
        verify(transactionManager).rollback(status);
        verify(transactionManager, never()).commit(any());
    }

    @Test
    void pushnOfNothingIsANoop() {
        store().pushn(List.of());
        verifyNoInteractions(mongoTemplate, transactionManager);
    }

    @Test
    void epochWithoutBlocksIsRejected() {
        MongoEpochBlockMapStore store = store();

        assertThatThrownBy(() -> store.pushn(List.of(new EpochData(5, List.of()))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Epoch 5");
        verifyNoInteractions(mongoTemplate, transactionManager);
    }

    @Test
    void lookups() {
        EpochBlockMap stored = new EpochBlockMap();
        stored.setEpoch(42);
        stored.setBnMin(100);
        stored.setBnMax(104);
        stored.setPivotHash("0xpivot");
        when(mongoTemplate.findOne(any(Query.class), eq(EpochBlockMap.class))).thenReturn(stored);
        MongoEpochBlockMapStore store = store();

        assertThat(store.maxEpoch()).contains(42L);
        assertThat(store.blockRange(42)).contains(new BlockRange(100, 104));
        assertThat(store.pivotHash(42)).contains("0xpivot");

        verify(mongoTemplate, times(3)).findOne(queries.capture(), eq(EpochBlockMap.class));
        Query max = queries.getAllValues().get(0);
        assertThat(max.getSortObject()).containsEntry("epoch", -1);
        assertThat(max.getLimit()).isEqualTo(1);
        assertThat(queries.getAllValues().get(1).getQueryObject()).containsEntry("epoch", 42L);
    }

    @Test
    void emptyStore() {
        when(mongoTemplate.findOne(any(Query.class), eq(EpochBlockMap.class))).thenReturn(null);
        MongoEpochBlockMapStore store = store();

        assertThat(store.maxEpoch()).isEmpty();
        assertThat(store.blockRange(1)).isEmpty();
        assertThat(store.pivotHash(1)).isEmpty();
    }
}
