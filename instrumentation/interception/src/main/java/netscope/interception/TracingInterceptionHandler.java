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
import brave.Tracer;
import brave.Tracing;
import brave.propagation.TraceContext;
import java.net.URI;
import netscope.internal.Nullable;

/**
 * Records a client span for each completed first-party interception.
 *
 * <p>When trace headers were sent, the span reuses their context, so the server side of the trace
 * joins it. Otherwise a new span is created. Timestamps come from the fetch phase of the metrics.
 */
public final class TracingInterceptionHandler extends InterceptionHandler {
  public static TracingInterceptionHandler create(Tracing tracing) {
    if (tracing == null) throw new NullPointerException("tracing == null");
    return new TracingInterceptionHandler(tracing.tracer());
  }

  final Tracer tracer;

  TracingInterceptionHandler(Tracer tracer) {
    this.tracer = tracer;
  }

  @Override public void interceptionCompleted(TaskInterception interception) {
    if (!interception.isFirstParty()) return;
    ResourceMetrics metrics = interception.metrics();
    ResourceCompletion completion = interception.completion();
    if (metrics == null || completion == null) return;

    TraceContext context = interception.spanContext();
    Span span = context != null ? tracer.toSpan(context) : tracer.nextSpan();
    if (span.isNoop()) return;

    HttpRequest request = interception.request();
    span.kind(Span.Kind.CLIENT).name(request.method());
    span.tag("http.method", request.method());
    String path = path(request.url());
    if (path != null) span.tag("http.path", path);
    span.tag("http.url", request.url());

    int statusCode = completion.statusCode();
    if (statusCode != 0) span.tag("http.status_code", String.valueOf(statusCode));
    Throwable error = completion.error();
    if (error != null) {
      span.error(error);
    } else if (statusCode >= 400) {
      span.tag("error", String.valueOf(statusCode));
    }

    span.start(metrics.fetch().startMicros());
    span.finish(metrics.fetch().endMicros());
  }

  @Nullable static String path(String url) {
    URI uri = UrlClassifier.parse(url);
    if (uri == null) return null;
    String path = uri.getRawPath();
    return path == null || path.isEmpty() ? null : path;
  }

  @Override public String toString() {
    return "TracingInterceptionHandler{" + tracer + "}";
  }
}
