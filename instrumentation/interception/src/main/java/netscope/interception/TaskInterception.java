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

import brave.propagation.TraceContext;
import java.util.UUID;
import netscope.internal.Nullable;

/**
 * What is known so far about one intercepted task. Handlers receive this when the interception
 * starts and again, complete, when it ends.
 *
 * <p>This type is immutable. {@link TaskInterceptor} replaces the record it keeps for a task each
 * time a lifecycle callback adds information, so a handler never sees a record change underneath
 * it.
 */
public final class TaskInterception {
  static TaskInterception create(HttpRequest request, boolean firstParty) {
    if (request == null) throw new NullPointerException("request == null");
    return new TaskInterception(UUID.randomUUID().toString(), request, firstParty, null, null, null);
  }

  final String id;
  final HttpRequest request;
  final boolean firstParty;
  @Nullable final TraceContext spanContext;
  @Nullable final ResourceMetrics metrics;
  @Nullable final ResourceCompletion completion;

  TaskInterception(String id, HttpRequest request, boolean firstParty,
    @Nullable TraceContext spanContext, @Nullable ResourceMetrics metrics,
    @Nullable ResourceCompletion completion) {
    this.id = id;
    this.request = request;
    this.firstParty = firstParty;
    this.spanContext = spanContext;
    this.metrics = metrics;
    this.completion = completion;
  }

  /** Random identifier, unique to this interception. */
  public String id() {
    return id;
  }

  /** The request as sent, including any trace headers added by {@link TaskInterceptor#modify}. */
  public HttpRequest request() {
    return request;
  }

  public boolean isFirstParty() {
    return firstParty;
  }

  /** The span context propagated in the request headers, or null if none was. */
  @Nullable public TraceContext spanContext() {
    return spanContext;
  }

  @Nullable public ResourceMetrics metrics() {
    return metrics;
  }

  @Nullable public ResourceCompletion completion() {
    return completion;
  }

  /** True once both metrics and completion were recorded, regardless of which came first. */
  public boolean isDone() {
    return metrics != null && completion != null;
  }

  /** The span context can be assigned once. Later calls return this instance unchanged. */
  TaskInterception withSpanContext(@Nullable TraceContext spanContext) {
    if (spanContext == null || this.spanContext != null) return this;
    return new TaskInterception(id, request, firstParty, spanContext, metrics, completion);
  }

  TaskInterception withMetrics(ResourceMetrics metrics) {
    if (metrics == null) throw new NullPointerException("metrics == null");
    return new TaskInterception(id, request, firstParty, spanContext, metrics, completion);
  }

  TaskInterception withCompletion(ResourceCompletion completion) {
    if (completion == null) throw new NullPointerException("completion == null");
    return new TaskInterception(id, request, firstParty, spanContext, metrics, completion);
  }

  @Override public String toString() {
    return "TaskInterception{id=" + id
      + ", url=" + request.url()
      + ", firstParty=" + firstParty
      + ", spanContext=" + spanContext
      + ", metrics=" + (metrics != null)
      + ", completion=" + completion
      + "}";
  }
}
