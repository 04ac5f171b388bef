package com.tradesignal.signal.controller;

import com.tradesignal.signal.service.CardSignal;
import com.tradesignal.signal.service.SignalDispatchService;
import com.tradesignal.signal.service.SymbolOutlook;
import com.tradesignal.signal.service.SymbolSignal;
import com.tradesignal.signal.trace.TraceContextUtil;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/v1/signals")
public class SignalController {

    private final SignalDispatchService dispatchService;

    public SignalController(SignalDispatchService dispatchService) {
        this.dispatchService = dispatchService;
    }

    @PostMapping("/evaluate")
    public Mono<ResponseEntity<SymbolSignal>> evaluate(
            @RequestBody SignalRequest request,
            @RequestHeader(value = TraceContextUtil.TRACE_ID_HEADER, required = false) String traceId) {
        return TraceContextUtil.withTraceId(dispatchService.evaluate(request), TraceContextUtil.resolve(traceId))
            .map(ResponseEntity::ok);
    }

    @PostMapping("/batch")
    public Mono<ResponseEntity<List<SymbolSignal>>> batch(
            @RequestBody List<SignalRequest> requests,
            @RequestHeader(value = TraceContextUtil.TRACE_ID_HEADER, required = false) String traceId) {
        return TraceContextUtil.withTraceId(dispatchService.evaluateBatch(requests), TraceContextUtil.resolve(traceId))
            .map(ResponseEntity::ok);
    }

    @PostMapping("/cards")
    public Mono<ResponseEntity<List<CardSignal>>> cards(
            @RequestBody SignalRequest request,
            @RequestHeader(value = TraceContextUtil.TRACE_ID_HEADER, required = false) String traceId) {
        return TraceContextUtil.withTraceId(dispatchService.evaluateCards(request), TraceContextUtil.resolve(traceId))
            .map(ResponseEntity::ok);
    }

    @PostMapping("/outlook")
    public Mono<ResponseEntity<SymbolOutlook>> outlook(
            @RequestBody SignalRequest request,
            @RequestHeader(value = TraceContextUtil.TRACE_ID_HEADER, required = false) String traceId) {
        return TraceContextUtil.withTraceId(dispatchService.evaluateOutlook(request), TraceContextUtil.resolve(traceId))
            .map(ResponseEntity::ok);
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
