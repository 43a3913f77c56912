package com.rankplatform.ranking.config;

import com.rankplatform.common.ranking.DefaultRankingAggregator;
import com.rankplatform.common.ranking.RankingAggregator;
import com.rankplatform.ranking.service.RankingService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(classes = {RankingConfig.class, RankingService.class})
class RankingConfigTest {

    @Autowired
    private RankingAggregator rankingAggregator;

    @Autowired
    private RankingProperties rankingProperties;

    @Autowired
    private RankingService rankingService;

    @Test
    @DisplayName("defaults come from application.yml")
    void defaultsFromApplicationYml() {
        assertEquals(10000, rankingProperties.parallelThreshold());
        assertEquals(2048, rankingProperties.chunkSize());
    }

    @Test
    @DisplayName("aggregator bean is the default implementation")
    void aggregatorBean() {
        assertInstanceOf(DefaultRankingAggregator.class, rankingAggregator);
        assertNotNull(rankingService);
    }

    @Test
    @DisplayName("invalid tuning rejected")
    void invalidProperties() {
        assertThrows(IllegalStateException.class, () -> new RankingProperties(0, 10));
        assertThrows(IllegalStateException.class, () -> new RankingProperties(10, 0));
    }
}
