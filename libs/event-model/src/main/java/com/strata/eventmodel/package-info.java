/**
 * Event contracts shared by the Strata aggregate engine and its test toolkit.
 *
 * <ul>
 *   <li>{@link com.strata.eventmodel.Event}: identity-by-name event contract
 *   <li>{@link com.strata.eventmodel.EventNode}: event plus storage metadata, an alternate replay input
 *   <li>{@link com.strata.eventmodel.EventHydrator}: rebuilds events from stored name and JSON payload
 *   <li>{@link com.strata.eventmodel.id.FlakeIdGenerator}: sortable ids for new aggregates
 * </ul>
 */
package com.strata.eventmodel;
