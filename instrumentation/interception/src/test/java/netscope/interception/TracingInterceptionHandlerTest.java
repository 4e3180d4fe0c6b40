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
import brave.handler.MutableSpan;
import brave.propagation.TraceContext;
import brave.test.TestSpanHandler;
import java.io.IOException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static brave.Span.Kind.CLIENT;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class TracingInterceptionHandlerTest {
  TestSpanHandler spans = new TestSpanHandler();
  Tracing tracing = Tracing.newBuilder().addSpanHandler(spans).build();
  TracingInterceptionHandler handler = TracingInterceptionHandler.create(tracing);

  TraceContext context = TraceContext.newBuilder().traceId(1L).spanId(2L).sampled(true).build();
  HttpRequest request = HttpRequest.newBuilder("https://api.example.com/users/1?expand=true")
    .build();
  ResourceMetrics metrics = ResourceMetrics.newBuilder(1_000_000L, 1_250_000L).build();

  @AfterEach void close() {
    tracing.close();
  }

  @Test void completed_recordsClientSpanInPropagatedContext() {
    handler.interceptionCompleted(done(TaskInterception.create(request, true)
      .withSpanContext(context), HttpResponse.create(200), null));

    assertThat(spans).hasSize(1);
    MutableSpan span = spans.get(0);
    assertThat(span.traceId()).isEqualTo(context.traceIdString());
    assertThat(span.id()).isEqualTo(context.spanIdString());
    assertThat(span.kind()).isEqualTo(CLIENT);
    assertThat(span.name()).isEqualTo("GET");
    assertThat(span.startTimestamp()).isEqualTo(1_000_000L);
    assertThat(span.finishTimestamp()).isEqualTo(1_250_000L);
    assertThat(span.tags()).containsOnly(
      entry("http.method", "GET"),
      entry("http.path", "/users/1"),
      entry("http.url", "https://api.example.com/users/1?expand=true"),
      entry("http.status_code", "200")
    );
    assertThat(span.error()).isNull();
  }

  @Test void completed_newSpanWithoutPropagatedContext() {
    handler.interceptionCompleted(
      done(TaskInterception.create(request, true), HttpResponse.create(200), null));

    assertThat(spans).hasSize(1);
    assertThat(spans.get(0).traceId()).isNotEqualTo(context.traceIdString());
    assertThat(spans.get(0).parentId()).isNull();
  }

  @Test void completed_errorStatus() {
    handler.interceptionCompleted(done(TaskInterception.create(request, true)
      .withSpanContext(context), HttpResponse.create(503), null));

    assertThat(spans.get(0).tags())
      .containsEntry("http.status_code", "503")
      .containsEntry("error", "503");
  }

  @Test void completed_failure() {
    IOException error = new IOException("timeout");

    handler.interceptionCompleted(
      done(TaskInterception.create(request, true).withSpanContext(context), null, error));

    MutableSpan span = spans.get(0);
    assertThat(span.error()).isSameAs(error);
    assertThat(span.tags()).doesNotContainKey("http.status_code");
  }

  @Test void completed_thirdParty_noSpan() {
    handler.interceptionCompleted(
      done(TaskInterception.create(request, false), HttpResponse.create(200), null));

    assertThat(spans).isEmpty();
  }

  @Test void completed_notSampled_noSpan() {
    TraceContext unsampled = context.toBuilder().sampled(false).build();

    handler.interceptionCompleted(done(TaskInterception.create(request, true)
      .withSpanContext(unsampled), HttpResponse.create(200), null));

    assertThat(spans).isEmpty();
  }

  @Test void started_noSpan() {
    handler.interceptionStarted(TaskInterception.create(request, true).withSpanContext(context));

    assertThat(spans).isEmpty();
  }

  TaskInterception done(TaskInterception interception, HttpResponse response, Throwable error) {
    return interception.withMetrics(metrics)
      .withCompletion(ResourceCompletion.create(response, error));
  }
}
