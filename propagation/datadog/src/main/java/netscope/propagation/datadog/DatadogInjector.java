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
package netscope.propagation.datadog;

import brave.propagation.Propagation.Setter;
import brave.propagation.TraceContext;
import brave.propagation.TraceContext.Injector;

import static netscope.propagation.datadog.DatadogPropagation.PARENT_ID;
import static netscope.propagation.datadog.DatadogPropagation.TRACE_ID;

final class DatadogInjector<R> implements Injector<R> {
  final Setter<R, String> setter;

  DatadogInjector(Setter<R, String> setter) {
    this.setter = setter;
  }

  /** The span ID of the context is the parent of whatever the receiver starts. */
  @Override public void inject(TraceContext context, R request) {
    setter.put(request, TRACE_ID, DatadogPropagation.traceIdString(context));
    setter.put(request, PARENT_ID, DatadogPropagation.spanIdString(context));
  }

  @Override public String toString() {
    return "DatadogInjector{setter=" + setter + "}";
  }
}
