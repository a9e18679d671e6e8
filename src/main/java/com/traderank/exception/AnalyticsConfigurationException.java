package com.traderank.exception;

import java.util.Map;

/** Thrown at startup when the trading period table cannot be used as configured. */
public class AnalyticsConfigurationException extends BaseException {

    public AnalyticsConfigurationException(String message, Map<String, Object> details) {
        super(ErrorCode.CONFIGURATION_ERROR, message, details);
    }
}
