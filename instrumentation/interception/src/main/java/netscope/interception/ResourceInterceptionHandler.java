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

import brave.Clock;
import brave.propagation.TraceContext;

import static netscope.propagation.datadog.DatadogPropagation.spanIdString;
import static netscope.propagation.datadog.DatadogPropagation.traceIdString;

/**
 * Reports a {@link ResourceEvent} when each interception starts, and another when it stops or
 * fails. Both events share the interception id as their resource key.
 */
public final class ResourceInterceptionHandler extends InterceptionHandler {
  static final Clock SYSTEM_CLOCK = new Clock() {
    @Override public long currentTimeMicroseconds() {
      return System.currentTimeMillis() * 1000;
    }

    @Override public String toString() {
      return "SystemClock{}";
    }
  };

  public static ResourceInterceptionHandler create(ResourceEventReporter reporter) {
    return create(reporter, SYSTEM_CLOCK);
  }

  /** @param clock timestamps {@link ResourceEvent.Type#STARTED} events */
  public static ResourceInterceptionHandler create(ResourceEventReporter reporter, Clock clock) {
    if (reporter == null) throw new NullPointerException("reporter == null");
    if (clock == null) throw new NullPointerException("clock == null");
    return new ResourceInterceptionHandler(reporter, clock);
  }

  final ResourceEventReporter reporter;
  final Clock clock;

  ResourceInterceptionHandler(ResourceEventReporter reporter, Clock clock) {
    this.reporter = reporter;
    this.clock = clock;
  }

  @Override public void interceptionStarted(TaskInterception interception) {
    HttpRequest request = interception.request();
    reporter.report(ResourceEvent.newBuilder(ResourceEvent.Type.STARTED, interception.id())
      .url(request.url())
      .method(request.method())
      .timestampMicros(clock.currentTimeMicroseconds())
      .build());
  }

  @Override public void interceptionCompleted(TaskInterception interception) {
    ResourceCompletion completion = interception.completion();
    ResourceMetrics metrics = interception.metrics();
    if (completion == null || metrics == null) return;

    HttpRequest request = interception.request();
    HttpResponse response = completion.response();
    Throwable error = completion.error();
    ResourceEvent.Builder event = ResourceEvent.newBuilder(
      error != null ? ResourceEvent.Type.FAILED : ResourceEvent.Type.STOPPED, interception.id())
      .url(request.url())
      .method(request.method())
      .kind(ResourceKind.of(request.method(), response != null ? response.contentType() : null))
      .statusCode(completion.statusCode())
      .size(metrics.responseSize())
      .metrics(metrics)
      .timestampMicros(metrics.fetch().endMicros());

    TraceContext context = interception.spanContext();
    if (context != null) event.traceIds(traceIdString(context), spanIdString(context));
    if (error != null) event.error(error.getClass().getName(), errorMessage(error));
    reporter.report(event.build());
  }

  static String errorMessage(Throwable error) {
    String message = error.getMessage();
    return message != null ? message : error.getClass().getSimpleName();
  }

  @Override public String toString() {
    return "ResourceInterceptionHandler{" + reporter + "}";
  }
}
