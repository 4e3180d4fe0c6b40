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

/** Uses identity equality, like transport task handles usually do. */
final class FakeNetworkTask implements NetworkTask {
  final HttpRequest originalRequest;
  volatile HttpResponse response;

  FakeNetworkTask(HttpRequest originalRequest) {
    this.originalRequest = originalRequest;
  }

  FakeNetworkTask respond(HttpResponse response) {
    this.response = response;
    return this;
  }

  @Override public HttpRequest originalRequest() {
    return originalRequest;
  }

  @Override public HttpResponse response() {
    return response;
  }

  @Override public String toString() {
    return "FakeNetworkTask{" + (originalRequest != null ? originalRequest.url() : null) + "}";
  }
}
