package org.estateranker.engine.cache;

import org.estateranker.engine.TestFixtures;
import org.estateranker.engine.config.ConfigurationException;
import org.estateranker.engine.domain.model.ScoringConfig;
import org.estateranker.engine.domain.service.ScoringEngine;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;

class ScoringConfigCacheImplTest {

    @Test
    void startsWithEmptyCatalogUntilRefreshed() {
        ScoringConfigCacheImpl cache = new ScoringConfigCacheImpl(TestFixtures::bundledConfig);

        assertThat(cache.isInitialized()).isFalse();
        assertThat(cache.getConfig().getCatalog().size()).isZero();

        assertThat(cache.refresh()).isTrue();
        assertThat(cache.isInitialized()).isTrue();
        assertThat(cache.getConfig()).isSameAs(TestFixtures.bundledConfig());
    }

    @Test
    void failedRefreshKeepsPreviousEngine() {
        Deque<Supplier<ScoringConfig>> attempts = new ArrayDeque<>();
        attempts.add(TestFixtures::bundledConfig);
        attempts.add(() -> {
            throw new ConfigurationException("Malformed scoring configuration: boom");
        });
        attempts.add(() -> null);
        ScoringConfigCacheImpl cache = new ScoringConfigCacheImpl(() -> attempts.poll().get());

        assertThat(cache.refresh()).isTrue();
        ScoringEngine loaded = cache.getEngine();

        assertThat(cache.refresh()).isFalse();
        assertThat(cache.getEngine()).isSameAs(loaded);

        assertThat(cache.refresh()).isFalse();
        assertThat(cache.getEngine()).isSameAs(loaded);
        assertThat(cache.isInitialized()).isTrue();
    }

    @Test
    void refreshSwapsConfigAssessorAndScorerTogether() {
        ScoringConfig relaxed = TestFixtures.bundledConfig().toBuilder().legacyRailKey("bus_station").build();
        Deque<ScoringConfig> configs = new ArrayDeque<>();
        configs.add(TestFixtures.bundledConfig());
        configs.add(relaxed);
        ScoringConfigCacheImpl cache = new ScoringConfigCacheImpl(configs::poll);

        cache.refresh();
        ScoringEngine first = cache.getEngine();
        cache.refresh();
        ScoringEngine second = cache.getEngine();

        assertThat(second).isNotSameAs(first);
        assertThat(second.getConfig()).isSameAs(relaxed);
        assertThat(second.getAssessor()).isNotSameAs(first.getAssessor());
        assertThat(second.getScoringService()).isNotSameAs(first.getScoringService());
    }
}
