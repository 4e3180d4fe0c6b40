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

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

class HttpRequestTest {
  HttpRequest request = HttpRequest.newBuilder("https://api.example.com/users?page=2")
    .method("post")
    .header("Content-Type", "application/json")
    .header("Accept", "*/*")
    .body("{}".getBytes(StandardCharsets.UTF_8))
    .build();

  @Test void defaults() {
    HttpRequest get = HttpRequest.newBuilder("https://example.com").build();

    assertThat(get.method()).isEqualTo("GET");
    assertThat(get.headers()).isEmpty();
    assertThat(get.body()).isEmpty();
  }

  @Test void method_upperCase() {
    assertThat(request.method()).isEqualTo("POST");
  }

  @Test void header_caseInsensitive() {
    assertThat(request.header("content-type")).isEqualTo("application/json");
    assertThat(request.header("CONTENT-TYPE")).isEqualTo("application/json");
    assertThat(request.header("x-datadog-trace-id")).isNull();
  }

  @Test void header_replacesRegardlessOfCase() {
    HttpRequest changed = request.toBuilder().header("content-type", "text/plain").build();

    assertThat(changed.headers()).containsExactly(
      entry("Content-Type", "text/plain"),
      entry("Accept", "*/*")
    );
  }

  @Test void removeHeader() {
    assertThat(request.toBuilder().removeHeader("ACCEPT").build().headers())
      .containsOnlyKeys("Content-Type");
  }

  @Test void toBuilder_doesntChangeOriginal() {
    request.toBuilder().header("x-datadog-trace-id", "1").method("PUT").build();

    assertThat(request.headers()).doesNotContainKey("x-datadog-trace-id");
    assertThat(request.method()).isEqualTo("POST");
  }

  @Test void toBuilder_equalsOriginal() {
    assertThat(request.toBuilder().build())
      .isEqualTo(request)
      .hasSameHashCodeAs(request);
  }

  @Test void equals_comparesBody() {
    HttpRequest otherBody = request.toBuilder().body(new byte[] {1}).build();

    assertThat(otherBody).isNotEqualTo(request);
  }

  @Test void body_isCopied() {
    byte[] body = {1, 2, 3};
    HttpRequest withBody = HttpRequest.newBuilder("https://example.com").body(body).build();
    body[0] = 9;
    withBody.body()[1] = 9;

    assertThat(withBody.body()).containsExactly(1, 2, 3);
  }

  @Test void headers_unmodifiable() {
    assertThatThrownBy(() -> request.headers().put("a", "b"))
      .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test void setterAndGetter() {
    HttpRequest.Builder builder = request.toBuilder();
    HttpRequest.SETTER.put(builder, "x-datadog-trace-id", "1");

    assertThat(HttpRequest.GETTER.get(builder.build(), "X-Datadog-Trace-Id")).isEqualTo("1");
  }

  @Test void nullChecks() {
    assertThatThrownBy(() -> HttpRequest.newBuilder(null))
      .isInstanceOf(NullPointerException.class)
      .hasMessage("url == null");
    assertThatThrownBy(() -> request.toBuilder().header("a", null))
      .isInstanceOf(NullPointerException.class)
      .hasMessage("value == null");
  }

  @Test void emptyMethod() {
    assertThatThrownBy(() -> request.toBuilder().method(""))
      .isInstanceOf(IllegalArgumentException.class);
  }
}
