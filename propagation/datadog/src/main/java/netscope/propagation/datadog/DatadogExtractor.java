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

import brave.propagation.Propagation.Getter;
import brave.propagation.TraceContext;
import brave.propagation.TraceContext.Extractor;
import brave.propagation.TraceContextOrSamplingFlags;
import netscope.internal.Nullable;
import netscope.internal.Platform;

import static brave.propagation.TraceContextOrSamplingFlags.NOT_SAMPLED;
import static brave.propagation.TraceContextOrSamplingFlags.SAMPLED;
import static netscope.propagation.datadog.DatadogPropagation.PARENT_ID;
import static netscope.propagation.datadog.DatadogPropagation.SAMPLING_PRIORITY;
import static netscope.propagation.datadog.DatadogPropagation.TRACE_ID;
import static netscope.propagation.datadog.DecimalCodec.lenientDecimalToUnsignedLong;

final class DatadogExtractor<R> implements Extractor<R> {
  final Getter<R, String> getter;

  DatadogExtractor(Getter<R, String> getter) {
    this.getter = getter;
  }

  /**
   * Malformed identifiers are logged and treated as absent: a bad header must never fail the
   * request that carries it.
   */
  @Override public TraceContextOrSamplingFlags extract(R request) {
    if (request == null) throw new NullPointerException("request == null");
    Boolean sampled = parseSamplingPriority(getter.get(request, SAMPLING_PRIORITY));

    String traceIdString = getter.get(request, TRACE_ID);
    String spanIdString = getter.get(request, PARENT_ID);
    if (traceIdString == null || spanIdString == null) {
      if (sampled == null) return TraceContextOrSamplingFlags.EMPTY;
      return sampled ? SAMPLED : NOT_SAMPLED;
    }

    long traceId = lenientDecimalToUnsignedLong(traceIdString);
    long spanId = lenientDecimalToUnsignedLong(spanIdString);
    if (traceId == 0L || spanId == 0L) {
      Platform.get().log("Invalid input: expected unsigned decimal ids, but was {0}",
        TRACE_ID + "=" + traceIdString + ", " + PARENT_ID + "=" + spanIdString, null);
      return TraceContextOrSamplingFlags.EMPTY;
    }

    TraceContext context = TraceContext.newBuilder()
      .traceId(traceId)
      .spanId(spanId)
      .sampled(sampled)
      .build();
    return TraceContextOrSamplingFlags.create(context);
  }

  /**
   * Priorities above zero keep the trace, zero and below drop it. Anything else leaves the
   * decision to the receiver.
   */
  @Nullable static Boolean parseSamplingPriority(@Nullable String priority) {
    if (priority == null) return null;
    switch (priority.trim()) {
      case "1": // auto keep
      case "2": // user keep
        return true;
      case "0": // auto reject
      case "-1": // user reject
        return false;
      default:
        Platform.get().log("Invalid input: unknown sampling priority {0}", priority, null);
        return null;
    }
  }

  @Override public String toString() {
    return "DatadogExtractor{getter=" + getter + "}";
  }
}
