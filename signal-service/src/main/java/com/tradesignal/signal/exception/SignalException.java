package com.tradesignal.signal.exception;

/**
 * Request-level failure for one symbol: missing symbol, missing indicator payload.
 * Scoring itself never throws; this only guards the edges of the service.
 */
public class SignalException extends RuntimeException {
    private final String symbol;

    public SignalException(String symbol, String message) {
        super("[" + symbol + "] " + message);
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
