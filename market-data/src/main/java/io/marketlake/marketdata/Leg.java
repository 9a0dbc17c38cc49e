package io.marketlake.marketdata;

/**
 * Which series of a trading day a sub-request fetches. Option requests fetch both legs; stock and earnings
 * requests fetch a single series.
 */
public enum Leg {
    CONTRACTS,
    UNDERLYING,
    SINGLE
}
