package com.dealplatform.common.exception;

import com.dealplatform.common.model.MarketSnapshotKey;

/**
 * Aggregation failed and no snapshot, not even a stale one, exists for the segment.
 */
public class MarketDataUnavailableException extends NegotiationException {

    private final MarketSnapshotKey key;

    public MarketDataUnavailableException(MarketSnapshotKey key, Throwable cause) {
        super(ErrorCode.MARKET_DATA_UNAVAILABLE, "No market data available for segment=" + key, cause);
        this.key = key;
    }

    public MarketSnapshotKey getKey() {
        return key;
    }
}
