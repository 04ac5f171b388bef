package com.tradesignal.common.engine;

import com.tradesignal.common.model.IndicatorSnapshot;
import com.tradesignal.common.model.MarketStatus;
import com.tradesignal.common.model.SignalResult;

/**
 * Contract for turning one indicator snapshot into a complete trade signal.
 *
 * <p>Implementations must be:
 * <ul>
 *   <li><b>Stateless</b> — no mutable state; safe to call concurrently for many symbols</li>
 *   <li><b>Pure</b>      — no logging, no clock, no randomness, no I/O</li>
 *   <li><b>Total</b>     — always return a well-formed {@link SignalResult}, never throw for
 *                          partial or malformed-but-structurally-valid input</li>
 * </ul>
 *
 * <p>Current implementation: {@link TradeZoneSignalEngine}. Register a different one as the
 * {@code SignalEngine} bean in {@code SignalEngineConfig} to swap it without touching the cards.
 */
public interface SignalEngine {

    /**
     * @param snapshot     latest indicators for one symbol; may contain NaN or nulls
     * @param marketStatus current session state; {@code null} is treated as not live
     * @return a fresh {@link SignalResult} — never {@code null}
     */
    SignalResult evaluate(IndicatorSnapshot snapshot, MarketStatus marketStatus);
}
