package com.tradesignal.signal.service;

import com.tradesignal.common.engine.SignalEngine;
import com.tradesignal.common.model.IndicatorSnapshot;
import com.tradesignal.common.model.MarketStatus;
import com.tradesignal.common.model.SignalResult;
import com.tradesignal.common.outlook.MarketOutlook;
import com.tradesignal.common.outlook.OutlookCalculator;
import com.tradesignal.signal.card.SignalCard;
import com.tradesignal.signal.controller.SignalRequest;
import com.tradesignal.signal.exception.SignalException;
import com.tradesignal.signal.mapping.SnapshotMapper;
import com.tradesignal.signal.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Runs the signal engine for incoming requests.
 *
 * <p>Symbols in a batch, and cards for one symbol, share no state and are evaluated in
 * parallel on {@code boundedElastic}. A failure for one symbol or card is logged and
 * replaced by the neutral fallback so the rest of the dashboard still renders.
 */
@Service
public class SignalDispatchService {

    private static final Logger log = LoggerFactory.getLogger(SignalDispatchService.class);

    static final String UNKNOWN_SYMBOL = "?";

    private final SignalEngine engine;
    private final SnapshotMapper mapper;
    private final List<SignalCard> cards;
    private final Clock clock;

    @Autowired
    public SignalDispatchService(SignalEngine engine, SnapshotMapper mapper, List<SignalCard> cards) {
        this(engine, mapper, cards, Clock.systemUTC());
    }

    SignalDispatchService(SignalEngine engine, SnapshotMapper mapper, List<SignalCard> cards, Clock clock) {
        this.engine = engine;
        this.mapper = mapper;
        this.cards = cards;
        this.clock = clock;
    }

    public Mono<SymbolSignal> evaluate(SignalRequest request) {
        return Mono.deferContextual(ctx -> {
            String traceId = TraceContextUtil.getTraceId(ctx);
            IndicatorSnapshot snapshot = toSnapshot(request);
            MarketStatus status = MarketStatus.from(request.marketStatus());
            SignalResult result = engine.evaluate(snapshot, status);
            TraceContextUtil.withMdc(traceId, () ->
                log.info("Evaluated symbol={} status={} action={} confidence={} score={} prediction={}",
                    request.symbol(), status, result.action(), result.confidence(),
                    result.totalScore(), result.prediction().direction()));
            return Mono.just(new SymbolSignal(request.symbol(), result, false, Instant.now(clock)));
        });
    }

    public Mono<List<SymbolSignal>> evaluateBatch(List<SignalRequest> requests) {
        return Mono.deferContextual(ctx -> {
            String traceId = TraceContextUtil.getTraceId(ctx);
            TraceContextUtil.withMdc(traceId, () ->
                log.info("Dispatching {} symbols in parallel", requests.size()));
            // Flux.fromIterable rejects null elements; carry each slot as an Optional
            return Flux.fromStream(requests.stream().map(Optional::ofNullable))
                .flatMapSequential(slot -> slot
                    .map(request -> evaluate(request)
                        .subscribeOn(Schedulers.boundedElastic())
                        .onErrorResume(e -> {
                            TraceContextUtil.withMdc(traceId, () ->
                                log.error("Evaluation failed for symbol={}", request.symbol(), e));
                            return Mono.just(fallback(request));
                        }))
                    .orElseGet(() -> {
                        TraceContextUtil.withMdc(traceId, () ->
                            log.warn("Null entry in batch, returning neutral fallback"));
                        return Mono.just(fallback(null));
                    }))
                .collectList();
        });
    }

    public Mono<List<CardSignal>> evaluateCards(SignalRequest request) {
        return evaluateCardResults(request)
            .map(results -> results.stream()
                .map(r -> CardSignal.of(r.card(), r.result()))
                .toList());
    }

    /** Runs every card and combines their signals into one {@link MarketOutlook}. */
    public Mono<SymbolOutlook> evaluateOutlook(SignalRequest request) {
        return evaluateCardResults(request)
            .flatMap(results -> Mono.deferContextual(ctx -> {
                MarketOutlook outlook = OutlookCalculator.combine(
                    results.stream().map(CardResult::result).toList());
                TraceContextUtil.withMdc(TraceContextUtil.getTraceId(ctx), () ->
                    log.info("Outlook symbol={} action={} buy={}% sell={}% confidence={}",
                        request.symbol(), outlook.action(), outlook.buyPercent(),
                        outlook.sellPercent(), outlook.confidence()));
                List<CardSignal> cardSignals = results.stream()
                    .map(r -> CardSignal.of(r.card(), r.result()))
                    .toList();
                return Mono.just(new SymbolOutlook(request.symbol(), cardSignals, outlook));
            }));
    }

    private Mono<List<CardResult>> evaluateCardResults(SignalRequest request) {
        return Mono.deferContextual(ctx -> {
            String traceId = TraceContextUtil.getTraceId(ctx);
            IndicatorSnapshot snapshot = toSnapshot(request);
            MarketStatus status = MarketStatus.from(request.marketStatus());
            TraceContextUtil.withMdc(traceId, () ->
                log.info("Dispatching {} cards for symbol={}", cards.size(), request.symbol()));
            return Flux.fromIterable(cards)
                .flatMapSequential(card -> Mono.fromCallable(() ->
                        new CardResult(card.cardName(), engine.evaluate(card.project(snapshot), status)))
                    .subscribeOn(Schedulers.boundedElastic())
                    .onErrorResume(e -> {
                        TraceContextUtil.withMdc(traceId, () ->
                            log.error("Card={} failed for symbol={}", card.cardName(), request.symbol(), e));
                        return Mono.just(new CardResult(card.cardName(),
                            engine.evaluate(IndicatorSnapshot.neutral(), status)));
                    }))
                .collectList();
        });
    }

    private IndicatorSnapshot toSnapshot(SignalRequest request) {
        if (request == null || request.symbol() == null || request.symbol().isBlank()) {
            throw new SignalException(UNKNOWN_SYMBOL, "symbol is required");
        }
        if (request.indicators() == null) {
            throw new SignalException(request.symbol(), "indicators payload is missing");
        }
        return mapper.toSnapshot(request.indicators());
    }

    private SymbolSignal fallback(SignalRequest request) {
        String symbol = request != null && request.symbol() != null ? request.symbol() : UNKNOWN_SYMBOL;
        MarketStatus status = MarketStatus.from(request != null ? request.marketStatus() : null);
        SignalResult neutral = engine.evaluate(IndicatorSnapshot.neutral(), status);
        return new SymbolSignal(symbol, neutral, true, Instant.now(clock));
    }

    private record CardResult(String card, SignalResult result) {}
}
