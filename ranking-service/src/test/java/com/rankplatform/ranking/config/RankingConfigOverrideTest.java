package com.rankplatform.ranking.config;

import com.rankplatform.common.model.Competitor;
import com.rankplatform.ranking.service.RankingService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.TestPropertySource;
import reactor.test.StepVerifier;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(classes = {RankingConfig.class, RankingService.class})
@TestPropertySource(properties = {
    "ranking.parallel.threshold=2",
    "ranking.parallel.chunk-size=1"
})
class RankingConfigOverrideTest {

    @Autowired
    private RankingProperties rankingProperties;

    @Autowired
    private RankingService rankingService;

    @Test
    @DisplayName("property overrides reach the service")
    void overridesApplied() {
        assertEquals(2, rankingProperties.parallelThreshold());
        assertEquals(1, rankingProperties.chunkSize());

        StepVerifier.create(rankingService.rankInParallel(List.of(
                Competitor.of(3000, 30, "Kareem"),
                Competitor.of(3000, 30, "Lebron"),
                Competitor.of(3100, 33, "Wilt"))))
            .assertNext(result -> {
                assertEquals("Wilt", result.champion().name());
                assertFalse(result.isContested());
            })
            .verifyComplete();
    }
}
