package io.barhistory.core;

public enum HistoryFlag {
    /** Keep a trailing window that the available data does not fully cover. */
    ALLOW_INCOMPLETE_PRICE_BARS,
    DISABLE_SPLIT_ADJUST,
    DISABLE_VALUE_ADJUST
}
