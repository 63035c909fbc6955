package com.strata.eventmodel;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Overrides the type identity of an event class. Read both for instances
 * ({@link Event#eventName()}) and for the class itself ({@link Events#nameOf(Class)}), so handlers
 * and assertions keyed by class see the same name:
 *
 * <pre>
 * &#64;EventName("AccountOpened")
 * public record Opened(String id) implements Event {}
 * </pre>
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface EventName {

    String value();
}
