// SPDX-License-Identifier: MIT OR Apache-2.0
package io.dharitri.sdk.core;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a type or method as internal API not intended for public use.
 *
 * <p>Elements annotated with {@code @InternalApi} are implementation details
 * that may change or be removed without notice between versions. They are
 * public only because Java visibility rules require it for cross-package
 * access within the SDK.
 *
 * @since 0.1.0
 */
@Documented
@Retention(RetentionPolicy.CLASS)
@Target({ElementType.TYPE, ElementType.METHOD, ElementType.CONSTRUCTOR, ElementType.FIELD})
public @interface InternalApi {
}
