package com.mediasync.common.refresh.queue;

public record DrainResult(Status status, int batches, int items, int discarded) {

    public enum Status {
        NO_QUEUE,
        BUSY,
        DRAINED
    }

    public static DrainResult noQueue() {
        return new DrainResult(Status.NO_QUEUE, 0, 0, 0);
    }

    public static DrainResult busy() {
        return new DrainResult(Status.BUSY, 0, 0, 0);
    }

    public static DrainResult drained(int batches, int items, int discarded) {
        return new DrainResult(Status.DRAINED, batches, items, discarded);
    }
}
