package com.traderank.exception;

import java.util.Map;

/**
 * Thrown when a trade record violates an input precondition (non-positive quantity,
 * negative price or commission, missing field). The analysis run is aborted before any
 * P&L is computed.
 */
public class TradeValidationException extends BaseException {

    public TradeValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public TradeValidationException(String message, Map<String, Object> details) {
        super(ErrorCode.VALIDATION_ERROR, message, details);
    }
}
