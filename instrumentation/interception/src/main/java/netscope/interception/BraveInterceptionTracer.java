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

import brave.Span;
import brave.Tracing;
import brave.propagation.Propagation;
import brave.propagation.TraceContext;
import brave.propagation.TraceContextOrSamplingFlags;
import netscope.internal.Nullable;
import netscope.propagation.datadog.DatadogPropagation;

final class BraveInterceptionTracer extends InterceptionTracer {
  final Tracing tracing;
  final TraceContext.Injector<HttpRequest.Builder> injector;
  final TraceContext.Extractor<HttpRequest> extractor;

  BraveInterceptionTracer(Tracing tracing) {
    this.tracing = tracing;
    Propagation<String> propagation = DatadogPropagation.newFactory().get();
    this.injector = propagation.injector(HttpRequest.SETTER);
    this.extractor = propagation.extractor(HttpRequest.GETTER);
  }

  @Override @Nullable public TraceContext newSpanContext() {
    // The span is recorded later, from the interception, so only its context is kept here.
    Span span = tracing.tracer().nextSpan();
    TraceContext context = span.context();
    span.abandon();
    return context;
  }

  @Override public void inject(TraceContext context, HttpRequest.Builder request) {
    if (context == null) throw new NullPointerException("context == null");
    if (request == null) throw new NullPointerException("request == null");
    injector.inject(context, request);
  }

  @Override @Nullable public TraceContext extract(HttpRequest request) {
    if (request == null) throw new NullPointerException("request == null");
    TraceContextOrSamplingFlags extracted = extractor.extract(request);
    TraceContext context = extracted.context();
    if (context == null) return null;
    if (context.sampled() != null) return context;
    // make a decision now, so the span recorded on completion is sampled consistently
    boolean sampled = tracing.sampler().isSampled(context.traceId());
    return context.toBuilder().sampled(sampled).build();
  }

  @Override public String toString() {
    return "BraveInterceptionTracer{" + tracing + "}";
  }
}
