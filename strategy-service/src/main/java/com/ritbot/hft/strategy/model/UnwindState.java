package com.ritbot.hft.strategy.model;

public enum UnwindState {
    NORMAL,
    UNWINDING
}
