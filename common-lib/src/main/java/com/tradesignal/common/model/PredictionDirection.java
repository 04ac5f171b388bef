package com.tradesignal.common.model;

public enum PredictionDirection {
    UP,
    DOWN,
    FLAT;

    public static PredictionDirection of(TrendDirection trend) {
        return switch (trend) {
            case UP -> UP;
            case DOWN -> DOWN;
            case NEUTRAL -> FLAT;
        };
    }
}
