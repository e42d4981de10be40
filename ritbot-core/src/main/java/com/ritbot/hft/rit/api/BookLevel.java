package com.ritbot.hft.rit.api;

public record BookLevel(double price, long quantity) {
}
