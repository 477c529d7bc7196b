package com.prediction.market.trading.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root of every failure the trading engine reports to its callers.
 *
 * Each subclass carries a stable error code and the structured context (market
 * id, requested size, current balance or holding) a caller needs to render an
 * actionable message.
 */
public abstract class TradeException extends RuntimeException {

    private final String errorCode;
    private final Map<String, Object> context;

    protected TradeException(String errorCode, String message, Map<String, Object> context) {
        this(errorCode, message, context, null);
    }

    protected TradeException(String errorCode, String message, Map<String, Object> context, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.context = Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public String getErrorCode() {
        return errorCode;
    }

    public Map<String, Object> getContext() {
        return context;
    }

    /**
     * Whether retrying the same request later may succeed.
     */
    public boolean isRetryable() {
        return false;
    }

    static Map<String, Object> context(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) {
                map.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
            }
        }
        return map;
    }
}
