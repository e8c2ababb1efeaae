package com.cdcbridge.registry;

import com.cdcbridge.error.SchemaResolutionException;
import com.cdcbridge.testutil.InMemorySchemaRegistry;
import com.cdcbridge.testutil.TestTables;
import org.apache.avro.Schema;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CachingSchemaResolverTest {

    private final InMemorySchemaRegistry registry = new InMemorySchemaRegistry();
    private final CachingSchemaResolver resolver = new CachingSchemaResolver(registry);

    @Test
    void fetchesEachIdOnlyOnce() {
        // given
        int id = registry.register(TestTables.ACCOUNT_SCHEMA);

        // when
        Schema first = resolver.resolve(id);
        Schema second = resolver.resolve(id);

        // then
        assertThat(first).isEqualTo(TestTables.ACCOUNT_SCHEMA);
        assertThat(second).isSameAs(first);
        assertThat(registry.fetchCount()).isEqualTo(1);
        assertThat(resolver.cachedCount()).isEqualTo(1);
    }

    @Test
    void unknownIdIsNotCached() {
        assertThatThrownBy(() -> resolver.resolve(404))
                .isInstanceOf(SchemaResolutionException.class);
        assertThatThrownBy(() -> resolver.resolve(404))
                .isInstanceOf(SchemaResolutionException.class);

        assertThat(resolver.cachedCount()).isZero();
        assertThat(registry.fetchCount()).isEqualTo(2);
    }

    @Test
    void concurrentLookupsAgreeOnOneInstance() throws Exception {
        int id = registry.register(TestTables.ACCOUNT_SCHEMA);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Schema>> lookups = new ArrayList<>();
            for (int i = 0; i < 64; i++) {
                lookups.add(() -> resolver.resolve(id));
            }
            List<Schema> results = new ArrayList<>();
            for (Future<Schema> future : pool.invokeAll(lookups)) {
                results.add(future.get());
            }

            Schema cached = resolver.resolve(id);
            assertThat(results).allSatisfy(schema -> assertThat(schema).isSameAs(cached));
            assertThat(resolver.cachedCount()).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void closeReleasesTheClient() {
        resolver.close();

        assertThat(registry.isClosed()).isTrue();
        assertThat(resolver.cachedCount()).isZero();
    }
}
