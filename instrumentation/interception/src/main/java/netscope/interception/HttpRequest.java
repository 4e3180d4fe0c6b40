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

import brave.propagation.Propagation;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import netscope.internal.Nullable;

/**
 * An outgoing HTTP request as seen by the transport. Instances are immutable: {@link
 * TaskInterceptor#modify(HttpRequest)} returns a copy when it adds headers.
 *
 * <p>Header names are matched case-insensitively, but keep the case they were first set with.
 */
public final class HttpRequest {
  /** Sets a header on a request being built. Used to inject trace context. */
  public static final Propagation.Setter<Builder, String> SETTER =
    new Propagation.Setter<Builder, String>() {
      @Override public void put(Builder request, String key, String value) {
        request.header(key, value);
      }

      @Override public String toString() {
        return "HttpRequest.Builder::header";
      }
    };

  /** Reads a header of a request. Used to extract trace context. */
  public static final Propagation.Getter<HttpRequest, String> GETTER =
    new Propagation.Getter<HttpRequest, String>() {
      @Override public String get(HttpRequest request, String key) {
        return request.header(key);
      }

      @Override public String toString() {
        return "HttpRequest::header";
      }
    };

  static final byte[] EMPTY_BODY = new byte[0];

  public static Builder newBuilder(String url) {
    return new Builder(url);
  }

  public static final class Builder {
    String method = "GET", url;
    final Map<String, String> headers = new LinkedHashMap<>();
    byte[] body = EMPTY_BODY;

    Builder(String url) {
      url(url);
    }

    Builder(HttpRequest source) {
      this.method = source.method;
      this.url = source.url;
      this.headers.putAll(source.headers);
      this.body = source.body;
    }

    /** Defaults to "GET". Methods are upper-cased. */
    public Builder method(String method) {
      if (method == null) throw new NullPointerException("method == null");
      if (method.isEmpty()) throw new IllegalArgumentException("method is empty");
      this.method = method.toUpperCase(Locale.ROOT);
      return this;
    }

    /** Any string is accepted, as the transport decides what a valid URL is. */
    public Builder url(String url) {
      if (url == null) throw new NullPointerException("url == null");
      this.url = url;
      return this;
    }

    /** Replaces any value of the header, regardless of the case of its name. */
    public Builder header(String name, String value) {
      if (name == null) throw new NullPointerException("name == null");
      if (value == null) throw new NullPointerException("value == null");
      String existing = findName(headers, name);
      headers.put(existing != null ? existing : name, value);
      return this;
    }

    public Builder removeHeader(String name) {
      if (name == null) throw new NullPointerException("name == null");
      String existing = findName(headers, name);
      if (existing != null) headers.remove(existing);
      return this;
    }

    public Builder body(byte[] body) {
      if (body == null) throw new NullPointerException("body == null");
      this.body = body.length == 0 ? EMPTY_BODY : body.clone();
      return this;
    }

    public HttpRequest build() {
      return new HttpRequest(this);
    }
  }

  final String method, url;
  final Map<String, String> headers;
  final byte[] body;

  HttpRequest(Builder builder) {
    this.method = builder.method;
    this.url = builder.url;
    this.headers = builder.headers.isEmpty()
      ? Collections.<String, String>emptyMap()
      : Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
    this.body = builder.body;
  }

  public String method() {
    return method;
  }

  public String url() {
    return url;
  }

  /** Returns all headers in the order they were added. */
  public Map<String, String> headers() {
    return headers;
  }

  /** Returns the value of the header, matching its name case-insensitively. */
  @Nullable public String header(String name) {
    if (name == null) throw new NullPointerException("name == null");
    String existing = findName(headers, name);
    return existing != null ? headers.get(existing) : null;
  }

  /** Returns a copy of the body, which is empty when the request has none. */
  public byte[] body() {
    return body.length == 0 ? body : body.clone();
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  @Nullable static String findName(Map<String, String> headers, String name) {
    if (headers.containsKey(name)) return name;
    for (Iterator<String> i = headers.keySet().iterator(); i.hasNext(); ) {
      String next = i.next();
      if (next.equalsIgnoreCase(name)) return next;
    }
    return null;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof HttpRequest)) return false;
    HttpRequest that = (HttpRequest) o;
    return method.equals(that.method) && url.equals(that.url) && headers.equals(that.headers)
      && Arrays.equals(body, that.body);
  }

  @Override public int hashCode() {
    int h = 1000003;
    h ^= method.hashCode();
    h *= 1000003;
    h ^= url.hashCode();
    h *= 1000003;
    h ^= headers.hashCode();
    h *= 1000003;
    h ^= Arrays.hashCode(body);
    return h;
  }

  @Override public String toString() {
    return "HttpRequest{method=" + method + ", url=" + url + ", headers=" + headers
      + ", bodyLength=" + body.length + "}";
  }
}
