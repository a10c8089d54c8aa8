package com.dealplatform.common.agent;

public enum RecommendedAction {
    ACCEPT,
    ADJUST,
    HOLD_FIRM,
    CLOSE
}
