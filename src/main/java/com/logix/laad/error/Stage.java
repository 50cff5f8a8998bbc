package com.logix.laad.error;

/** Pipeline stage in which a compilation error was raised. */
public enum Stage {
    PARSE,
    BUILD,
    INFER,
    DESUGAR,
    REACHABILITY,
    EMIT
}
