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

import brave.Tracing;
import brave.propagation.TraceContext;
import netscope.internal.Nullable;

/**
 * Creates span contexts for outgoing requests and moves them in and out of request headers.
 *
 * <p>Implementations must be thread-safe, as {@link TaskInterceptor#modify} calls them from any
 * thread. When no tracer is registered, use {@link #NOOP}: trace injection and extraction are
 * then skipped.
 */
public abstract class InterceptionTracer {
  /** Never creates, injects or extracts a span context. */
  public static final InterceptionTracer NOOP = new InterceptionTracer() {
    @Override @Nullable public TraceContext newSpanContext() {
      return null;
    }

    @Override public void inject(TraceContext context, HttpRequest.Builder request) {
    }

    @Override @Nullable public TraceContext extract(HttpRequest request) {
      return null;
    }

    @Override public String toString() {
      return "NoopInterceptionTracer{}";
    }
  };

  /** Uses the tracer of the input and the {@code x-datadog-*} headers. */
  public static InterceptionTracer create(Tracing tracing) {
    if (tracing == null) throw new NullPointerException("tracing == null");
    return new BraveInterceptionTracer(tracing);
  }

  /**
   * Returns a context for a new client span, a child of any span in scope, or null if tracing is
   * unavailable.
   */
  @Nullable public abstract TraceContext newSpanContext();

  /** Writes the propagation fields of the context into the request headers. */
  public abstract void inject(TraceContext context, HttpRequest.Builder request);

  /** Returns the span context in the request headers, or null if there is none or it is invalid. */
  @Nullable public abstract TraceContext extract(HttpRequest request);
}
