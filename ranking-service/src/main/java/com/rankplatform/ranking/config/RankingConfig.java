package com.rankplatform.ranking.config;

import com.rankplatform.common.ranking.DefaultRankingAggregator;
import com.rankplatform.common.ranking.RankingAggregator;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RankingConfig {

    @Value("${ranking.parallel.threshold:10000}")
    private int parallelThreshold;

    @Value("${ranking.parallel.chunk-size:2048}")
    private int chunkSize;

    @Bean
    public RankingAggregator rankingAggregator() {
        return new DefaultRankingAggregator();
    }

    @Bean
    public RankingProperties rankingProperties() {
        return new RankingProperties(parallelThreshold, chunkSize);
    }
}
