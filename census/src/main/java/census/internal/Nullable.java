/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package census.internal;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;

/**
 * Marks a parameter, field or return value that may be null. This avoids a dependency on one of
 * the many jsr305 jars.
 */
@Documented
@Retention(RetentionPolicy.SOURCE)
public @interface Nullable {
}
