package com.mediasync.contracts;

public final class Topics {
    private Topics() {}

    public static final String SERIES_CHANGED = "mediasync.series-changed.v1";
}
