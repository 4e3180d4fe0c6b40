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

/** How a task ended: with a response, an error, or both. */
public final class ResourceCompletion {
  public static ResourceCompletion create(@Nullable HttpResponse response,
    @Nullable Throwable error) {
    return new ResourceCompletion(response, error);
  }

  @Nullable final HttpResponse response;
  @Nullable final Throwable error;

  ResourceCompletion(@Nullable HttpResponse response, @Nullable Throwable error) {
    this.response = response;
    this.error = error;
  }

  @Nullable public HttpResponse response() {
    return response;
  }

  @Nullable public Throwable error() {
    return error;
  }

  /** Returns the response status code or zero if there was no response. */
  public int statusCode() {
    return response != null ? response.statusCode() : 0;
  }

  @Override public String toString() {
    return "ResourceCompletion{response=" + response + ", error=" + error + "}";
  }
}
