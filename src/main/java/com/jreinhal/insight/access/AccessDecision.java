package com.jreinhal.insight.access;

public enum AccessDecision {
    ALLOWED,
    DENIED;

    public boolean isAllowed() {
        return this == ALLOWED;
    }
}
