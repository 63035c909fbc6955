package com.strata.eventmodel.id;

/**
 * Source of globally unique, sortable identifiers for aggregates created without an explicit id.
 */
@FunctionalInterface
public interface IdProvider {

    /**
     * Returns the next identifier. Identifiers handed out later sort after earlier ones.
     */
    String next();
}
