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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import netscope.internal.Nullable;

/** The response of a completed {@link NetworkTask}. */
public final class HttpResponse {
  public static HttpResponse create(int statusCode) {
    return create(statusCode, Collections.<String, String>emptyMap());
  }

  public static HttpResponse create(int statusCode, Map<String, String> headers) {
    if (statusCode < 100 || statusCode > 999) {
      throw new IllegalArgumentException("statusCode should be a three digit number");
    }
    if (headers == null) throw new NullPointerException("headers == null");
    return new HttpResponse(statusCode, headers.isEmpty()
      ? Collections.<String, String>emptyMap()
      : Collections.unmodifiableMap(new LinkedHashMap<>(headers)));
  }

  final int statusCode;
  final Map<String, String> headers;

  HttpResponse(int statusCode, Map<String, String> headers) {
    this.statusCode = statusCode;
    this.headers = headers;
  }

  public int statusCode() {
    return statusCode;
  }

  public Map<String, String> headers() {
    return headers;
  }

  @Nullable public String header(String name) {
    if (name == null) throw new NullPointerException("name == null");
    String existing = HttpRequest.findName(headers, name);
    return existing != null ? headers.get(existing) : null;
  }

  /** Returns the media type of the {@code Content-Type} header, without parameters. */
  @Nullable public String contentType() {
    String contentType = header("Content-Type");
    if (contentType == null) return null;
    int semicolon = contentType.indexOf(';');
    if (semicolon != -1) contentType = contentType.substring(0, semicolon);
    contentType = contentType.trim();
    return contentType.isEmpty() ? null : contentType;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof HttpResponse)) return false;
    HttpResponse that = (HttpResponse) o;
    return statusCode == that.statusCode && headers.equals(that.headers);
  }

  @Override public int hashCode() {
    return (1000003 ^ statusCode) * 1000003 ^ headers.hashCode();
  }

  @Override public String toString() {
    return "HttpResponse{statusCode=" + statusCode + ", headers=" + headers + "}";
  }
}
