package com.ritbot.hft.strategy.model;

public enum ArbitrageStage {
    IDLE,
    EVALUATE,
    RISK_CHECK,
    EXECUTE_LEGS,
    HEDGE_CURRENCY
}
