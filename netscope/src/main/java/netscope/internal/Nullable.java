/*
 * Copyright 2013-2024 The OpenZipkin Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License
 * is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied. See the License for the specific language governing permissions and limitations under
 * the License.
 */
package netscope.internal;

import java.lang.annotation.RetentionPolicy;

/**
 * Marks a field, parameter or return value that may be {@code null}. This avoids a dependency on
 * one of the many jsr305 jars.
 */
@java.lang.annotation.Documented
@java.lang.annotation.Retention(RetentionPolicy.SOURCE)
public @interface Nullable {
}
