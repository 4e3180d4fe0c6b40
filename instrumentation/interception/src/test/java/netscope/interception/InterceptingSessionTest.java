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
import java.util.Collections;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class InterceptingSessionTest {
  @Mock InterceptionTracer tracer;
  RecordingInterceptionHandler handler = new RecordingInterceptionHandler();
  TaskInterceptor interceptor;
  InterceptingSession session;

  HttpRequest payments = HttpRequest.newBuilder("https://api.payments.io/charge").build();

  @BeforeEach void init() {
    interceptor = TaskInterceptor.newBuilder(InterceptionConfiguration.newBuilder()
        .addFirstPartyHost("example.com")
        .build())
      .tracer(tracer)
      .handler(handler)
      .build();
    session = InterceptingSession.create(interceptor, Collections.singleton("Payments.IO"));
  }

  @AfterEach void close() {
    interceptor.close();
  }

  @Test void additionalFirstPartyHosts_normalized() {
    assertThat(session.additionalFirstPartyHosts()).containsExactly("payments.io");
  }

  @Test void modify_usesSessionHosts() {
    when(tracer.newSpanContext()).thenReturn(
      TraceContext.newBuilder().traceId(1L).spanId(2L).build());

    session.modify(payments);
    interceptor.modify(payments);

    // only the session considered the request first-party
    verify(tracer).newSpanContext();
  }

  @Test void lifecycle_forwarded() {
    FakeNetworkTask task = new FakeNetworkTask(payments);
    ResourceMetrics metrics = ResourceMetrics.newBuilder(10L, 20L).build();

    session.taskCreated(task);
    session.taskMetricsCollected(task, metrics);
    session.taskCompleted(task.respond(HttpResponse.create(200)), null);

    assertThat(interceptor.pendingInterceptionCount()).isZero();
    assertThat(handler.completed).hasSize(1);
    assertThat(handler.completed.get(0).isFirstParty()).isTrue();
  }

  @Test void withoutAdditionalHosts() {
    InterceptingSession plain = InterceptingSession.create(interceptor);
    FakeNetworkTask task = new FakeNetworkTask(payments);

    plain.taskCreated(task);

    assertThat(interceptor.pendingInterceptionCount()).isOne();
    assertThat(handler.started.get(0).isFirstParty()).isFalse();
  }
}
