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

/**
 * Sends resource events to where they are aggregated, usually an asynchronous batching writer.
 * This is called on the interceptor thread, so must not block.
 */
public interface ResourceEventReporter {
  ResourceEventReporter NOOP = new ResourceEventReporter() {
    @Override public void report(ResourceEvent event) {
    }

    @Override public String toString() {
      return "NoopResourceEventReporter{}";
    }
  };

  void report(ResourceEvent event);
}
