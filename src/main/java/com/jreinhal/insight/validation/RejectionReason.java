package com.jreinhal.insight.validation;

public enum RejectionReason {
    UNSUPPORTED_TOOL("unsupported_tool"),
    ACCESS_DENIED("access_denied"),
    INVALID_ARGUMENTS("invalid_arguments"),
    AMBIGUOUS_INTENT("ambiguous_intent"),
    INTERPRETER_UNAVAILABLE("interpreter_unavailable");

    private final String code;

    private RejectionReason(String code) {
        this.code = code;
    }

    public String code() {
        return this.code;
    }
}
