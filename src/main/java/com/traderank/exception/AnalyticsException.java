package com.traderank.exception;

public class AnalyticsException extends BaseException {

    public AnalyticsException(String message, Throwable cause) {
        super(ErrorCode.ANALYTICS_FAILURE, message, cause);
    }
}
