package com.strata.aggregate.testing;

/** Modes an {@link AggregateCheck} chain can arm. Flags accumulate for the life of a chain. */
public enum CheckFlag {
    DEBUG,
    THROWS,
    HAS,
    FIRST,
    LAST,
    ONE,
    EXACTLY,
    EXCLUDES
}
