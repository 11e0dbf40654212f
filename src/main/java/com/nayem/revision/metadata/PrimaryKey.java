package com.nayem.revision.metadata;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a field as part of the entity's primary key.
 * <p>
 * For composite keys, {@link #order()} fixes the position of the field in the
 * key; fields with the same order keep their declaration order.
 * </p>
 *
 * <pre>
 * public class OrderLine {
 *     &#64;PrimaryKey(order = 0)
 *     private long orderId;
 *
 *     &#64;PrimaryKey(order = 1)
 *     private int lineNo;
 * }
 * </pre>
 */
@Target(ElementType.FIELD)
@Retention(RetentionPolicy.RUNTIME)
public @interface PrimaryKey {

    int order() default 0;
}
