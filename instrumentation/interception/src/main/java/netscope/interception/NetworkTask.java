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
package netscope.interception;

import netscope.internal.Nullable;

/**
 * The transport's handle for one request in flight. Each lifecycle callback of {@link
 * TaskInterceptor} identifies the request by this handle.
 *
 * <p>Implementations must keep {@link Object#equals(Object)} and {@link Object#hashCode()} stable
 * for the whole life of the task. Identity equality, the default, satisfies this. If the transport
 * recycles handle objects, wrap it with a correlation token created when the task starts.
 */
public interface NetworkTask {
  /** The request as created by the application, or null if the transport doesn't know it. */
  @Nullable HttpRequest originalRequest();

  /** The response, once received. */
  @Nullable HttpResponse response();
}
