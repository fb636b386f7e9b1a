package com.signalfusion.fusion.adapter;

import com.signalfusion.common.model.Channel;

import java.util.Locale;

/**
 * What to fetch: one channel, scoped either to a ticker or to a free-text query
 * (general market news). Exactly one of {@code ticker} and {@code query} is set.
 */
public record ItemQuery(Channel channel, String ticker, String query) {

    public ItemQuery {
        if (channel == null) {
            throw new IllegalArgumentException("channel is required");
        }
        boolean hasTicker = ticker != null && !ticker.isBlank();
        boolean hasQuery = query != null && !query.isBlank();
        if (hasTicker == hasQuery) {
            throw new IllegalArgumentException("exactly one of ticker or query must be set");
        }
        ticker = hasTicker ? ticker.trim().toUpperCase(Locale.ROOT) : null;
        query = hasQuery ? query.trim() : null;
    }

    public static ItemQuery forTicker(Channel channel, String ticker) {
        return new ItemQuery(channel, ticker, null);
    }

    public static ItemQuery generalMarket(Channel channel, String query) {
        return new ItemQuery(channel, null, query);
    }

    public boolean isTickerScoped() {
        return ticker != null;
    }

    /** Ticker or query, for log lines. */
    public String scope() {
        return isTickerScoped() ? ticker : query;
    }
}
