package com.ritbot.hft.rit.api;

/**
 * Signed holding for one ticker. Currency tickers report cash balances here.
 */
public record SecurityPosition(String ticker, double position) {
}
