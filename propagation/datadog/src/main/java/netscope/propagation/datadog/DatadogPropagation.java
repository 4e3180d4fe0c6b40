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

import brave.propagation.Propagation;
import brave.propagation.TraceContext;
import brave.propagation.TraceContext.Extractor;
import brave.propagation.TraceContext.Injector;
import java.util.Collections;
import java.util.List;

import static java.util.Arrays.asList;

/**
 * Propagates trace identifiers in the {@code x-datadog-*} header format understood by Datadog
 * instrumented backends.
 *
 * <p>Identifiers are unsigned decimal strings. Only the lower 64 bits of the trace ID travel, so
 * this format never requires 128-bit trace IDs.
 *
 * <p>Ex. the headers injected for trace ID 1 and span ID 2:
 * <pre>{@code
 * x-datadog-trace-id: 1
 * x-datadog-parent-id: 2
 * }</pre>
 *
 * <p>The injector writes exactly the two headers above. The extractor also reads the optional
 * {@value #SAMPLING_PRIORITY} header.
 */
public final class DatadogPropagation extends Propagation.Factory
  implements Propagation<String> {
  // Using lowercase field names as http is case-insensitive, but http/2 transport downcases
  public static final String TRACE_ID = "x-datadog-trace-id";
  public static final String PARENT_ID = "x-datadog-parent-id";
  public static final String SAMPLING_PRIORITY = "x-datadog-sampling-priority";
  /** Marks which subsystem originated a trace. Not written by this propagation. */
  public static final String ORIGIN = "x-datadog-origin";
  /** Value of {@link #ORIGIN} when requests are also tracked as resources. */
  public static final String RUM_ORIGIN = "rum";

  static final DatadogPropagation INSTANCE = new DatadogPropagation();

  /**
   * Returns the factory to pass to {@link brave.Tracing.Builder#propagationFactory}. Calling
   * {@link #get()} on it returns the propagation itself.
   */
  public static Propagation.Factory newFactory() {
    return INSTANCE;
  }

  final List<String> keys = Collections.unmodifiableList(asList(TRACE_ID, PARENT_ID));

  DatadogPropagation() {
  }

  /** Returns the header names written on inject: the trace ID and parent ID. */
  @Override public List<String> keys() {
    return keys;
  }

  @Override public Propagation<String> get() {
    return this;
  }

  @Override public <R> Injector<R> injector(Setter<R, String> setter) {
    if (setter == null) throw new NullPointerException("setter == null");
    return new DatadogInjector<>(setter);
  }

  @Override public <R> Extractor<R> extractor(Getter<R, String> getter) {
    if (getter == null) throw new NullPointerException("getter == null");
    return new DatadogExtractor<>(getter);
  }

  /**
   * Returns the trace ID as it appears in the {@value #TRACE_ID} header. Use this to correlate
   * other telemetry with the trace.
   */
  public static String traceIdString(TraceContext context) {
    if (context == null) throw new NullPointerException("context == null");
    return Long.toUnsignedString(context.traceId());
  }

  /** Returns the span ID as it appears in the {@value #PARENT_ID} header. */
  public static String spanIdString(TraceContext context) {
    if (context == null) throw new NullPointerException("context == null");
    return Long.toUnsignedString(context.spanId());
  }

  @Override public String toString() {
    return "DatadogPropagation{}";
  }
}
