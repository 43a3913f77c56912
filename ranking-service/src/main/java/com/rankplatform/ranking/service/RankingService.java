package com.rankplatform.ranking.service;

import com.rankplatform.common.model.Competitor;
import com.rankplatform.common.ranking.RankingAggregator;
import com.rankplatform.common.ranking.RankingResult;
import com.rankplatform.ranking.config.RankingProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;

/**
 * Entry point for ranking a snapshot of competitors.
 *
 * <p>All three paths produce the same {@link RankingResult} for the same input order:
 * {@link #rankInParallel} splits the input into consecutive chunks and merges the
 * partial results back in chunk order.
 */
@Service
public class RankingService {

    private static final Logger log = LoggerFactory.getLogger(RankingService.class);

    private final RankingAggregator aggregator;
    private final RankingProperties properties;

    public RankingService(RankingAggregator aggregator, RankingProperties properties) {
        this.aggregator = aggregator;
        this.properties = properties;
    }

    public RankingResult rank(List<Competitor> competitors) {
        log.debug("Ranking competitors. count={}", competitors == null ? 0 : competitors.size());
        RankingResult result = aggregator.aggregate(competitors);
        logOutcome(result);
        return result;
    }

    /** Folds a competitor stream; an empty stream yields {@link RankingResult#empty()}. */
    public Mono<RankingResult> rankReactive(Flux<Competitor> competitors) {
        return competitors
            .reduce(RankingResult.empty(), aggregator::accumulate)
            .doOnSuccess(this::logOutcome);
    }

    /**
     * Ranks on Reactor's parallel scheduler once the input reaches the configured threshold.
     * The input is copied when this method is called, so later changes to the caller's list
     * do not reach the returned {@link Mono}.
     */
    public Mono<RankingResult> rankInParallel(List<Competitor> competitors) {
        if (competitors == null) {
            return Mono.fromCallable(() -> rank(null));
        }
        List<Competitor> snapshot = new ArrayList<>(competitors);
        if (snapshot.size() < properties.parallelThreshold()) {
            return Mono.fromCallable(() -> rank(snapshot));
        }

        List<List<Competitor>> chunks = partition(snapshot, properties.chunkSize());
        log.info("Ranking in parallel. count={} chunks={} chunkSize={}",
            snapshot.size(), chunks.size(), properties.chunkSize());

        return Flux.fromIterable(chunks)
            .flatMapSequential(chunk -> Mono.fromCallable(() -> aggregator.aggregate(chunk))
                .subscribeOn(Schedulers.parallel()))
            .reduce(RankingResult.empty(), aggregator::merge)
            .doOnSuccess(this::logOutcome);
    }

    static List<List<Competitor>> partition(List<Competitor> competitors, int chunkSize) {
        List<List<Competitor>> chunks = new ArrayList<>();
        for (int from = 0; from < competitors.size(); from += chunkSize) {
            chunks.add(competitors.subList(from, Math.min(from + chunkSize, competitors.size())));
        }
        return chunks;
    }

    private void logOutcome(RankingResult result) {
        if (result == null || !result.hasChampion()) {
            log.info("No competitors ranked; returning placeholder result");
            return;
        }
        Competitor champion = result.champion();
        log.info("Champion resolved. name={} rating={} age={} ties={} competitors={}",
            champion.name(), champion.rating(), champion.age(),
            result.possibleChampions().size(), result.competitorCount());
    }
}
