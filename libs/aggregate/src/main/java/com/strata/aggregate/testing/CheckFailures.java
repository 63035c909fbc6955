package com.strata.aggregate.testing;

import org.opentest4j.AssertionFailedError;

/**
 * Builds the assertion errors raised by {@link AggregateCheck}. The errors carry expected and
 * actual values, so IDEs and test reports can show a diff.
 */
final class CheckFailures {

    private CheckFailures() {
        // utility class
    }

    static AssertionFailedError failure(String message) {
        return new AssertionFailedError(message);
    }

    static AssertionFailedError failure(String message, Object actual, Object expected) {
        String detail = message
                + "\n\n  Expected: " + expected
                + "\n  Received: " + actual
                + "\n";
        return new AssertionFailedError(detail, expected, actual);
    }
}
