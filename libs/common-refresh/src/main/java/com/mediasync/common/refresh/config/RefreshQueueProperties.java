package com.mediasync.common.refresh.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "common.refresh")
public class RefreshQueueProperties {
    // records untouched for this long are dropped with their pending items
    @NotNull
    private Duration idleTtl = Duration.ofDays(1);
    @Positive
    private long maximumSize = 10000;

    private boolean backgroundSweep = true;
    private boolean recordStats = true;

    public Duration getIdleTtl() {
        return idleTtl;
    }

    public void setIdleTtl(Duration idleTtl) {
        this.idleTtl = idleTtl;
    }

    public long getMaximumSize() {
        return maximumSize;
    }

    public void setMaximumSize(long maximumSize) {
        this.maximumSize = maximumSize;
    }

    public boolean isBackgroundSweep() {
        return backgroundSweep;
    }

    public void setBackgroundSweep(boolean backgroundSweep) {
        this.backgroundSweep = backgroundSweep;
    }

    public boolean isRecordStats() {
        return recordStats;
    }

    public void setRecordStats(boolean recordStats) {
        this.recordStats = recordStats;
    }

    @AssertTrue(message = "idle-ttl must be positive")
    public boolean isIdleTtlPositive() {
        return idleTtl == null || (!idleTtl.isZero() && !idleTtl.isNegative());
    }
}
