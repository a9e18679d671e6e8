package com.traderank.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", "Trade record failed a precondition check"),
    CONFIGURATION_ERROR("CONFIGURATION_ERROR", "Analytics configuration is invalid"),
    ANALYTICS_FAILURE("ANALYTICS_FAILURE", "Analysis run could not be completed");

    private final String code;
    private final String description;
}
