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

import netscope.internal.Nullable;

/**
 * A change in the state of a resource load, correlated across events by {@link #resourceKey()}.
 */
public final class ResourceEvent {
  public enum Type {
    STARTED,
    STOPPED,
    FAILED
  }

  public static Builder newBuilder(Type type, String resourceKey) {
    return new Builder(type, resourceKey);
  }

  public static final class Builder {
    final Type type;
    final String resourceKey;
    String url = "", method = "GET";
    ResourceKind kind = ResourceKind.NATIVE;
    int statusCode;
    @Nullable Long size;
    @Nullable ResourceMetrics metrics;
    @Nullable String traceId, spanId, errorType, errorMessage;
    long timestampMicros;

    Builder(Type type, String resourceKey) {
      if (type == null) throw new NullPointerException("type == null");
      if (resourceKey == null) throw new NullPointerException("resourceKey == null");
      this.type = type;
      this.resourceKey = resourceKey;
    }

    public Builder url(String url) {
      if (url == null) throw new NullPointerException("url == null");
      this.url = url;
      return this;
    }

    public Builder method(String method) {
      if (method == null) throw new NullPointerException("method == null");
      this.method = method;
      return this;
    }

    public Builder kind(ResourceKind kind) {
      if (kind == null) throw new NullPointerException("kind == null");
      this.kind = kind;
      return this;
    }

    public Builder statusCode(int statusCode) {
      this.statusCode = statusCode;
      return this;
    }

    public Builder size(@Nullable Long size) {
      this.size = size;
      return this;
    }

    public Builder metrics(@Nullable ResourceMetrics metrics) {
      this.metrics = metrics;
      return this;
    }

    /** Both ids are unsigned decimal, as sent in trace headers. */
    public Builder traceIds(@Nullable String traceId, @Nullable String spanId) {
      this.traceId = traceId;
      this.spanId = spanId;
      return this;
    }

    public Builder error(@Nullable String errorType, @Nullable String errorMessage) {
      this.errorType = errorType;
      this.errorMessage = errorMessage;
      return this;
    }

    public Builder timestampMicros(long timestampMicros) {
      this.timestampMicros = timestampMicros;
      return this;
    }

    public ResourceEvent build() {
      return new ResourceEvent(this);
    }
  }

  final Type type;
  final String resourceKey, url, method;
  final ResourceKind kind;
  final int statusCode;
  @Nullable final Long size;
  @Nullable final ResourceMetrics metrics;
  @Nullable final String traceId, spanId, errorType, errorMessage;
  final long timestampMicros;

  ResourceEvent(Builder builder) {
    type = builder.type;
    resourceKey = builder.resourceKey;
    url = builder.url;
    method = builder.method;
    kind = builder.kind;
    statusCode = builder.statusCode;
    size = builder.size;
    metrics = builder.metrics;
    traceId = builder.traceId;
    spanId = builder.spanId;
    errorType = builder.errorType;
    errorMessage = builder.errorMessage;
    timestampMicros = builder.timestampMicros;
  }

  public Type type() {
    return type;
  }

  /** Identifies the resource. Equal to {@link TaskInterception#id()}. */
  public String resourceKey() {
    return resourceKey;
  }

  public String url() {
    return url;
  }

  public String method() {
    return method;
  }

  public ResourceKind kind() {
    return kind;
  }

  /** Zero when there was no response. */
  public int statusCode() {
    return statusCode;
  }

  /** Response size in bytes, if known. */
  @Nullable public Long size() {
    return size;
  }

  @Nullable public ResourceMetrics metrics() {
    return metrics;
  }

  @Nullable public String traceId() {
    return traceId;
  }

  @Nullable public String spanId() {
    return spanId;
  }

  @Nullable public String errorType() {
    return errorType;
  }

  @Nullable public String errorMessage() {
    return errorMessage;
  }

  /** Epoch microseconds when the event occurred. */
  public long timestampMicros() {
    return timestampMicros;
  }

  @Override public String toString() {
    StringBuilder result = new StringBuilder("ResourceEvent{type=").append(type)
      .append(", resourceKey=").append(resourceKey)
      .append(", method=").append(method)
      .append(", url=").append(url)
      .append(", kind=").append(kind);
    if (statusCode != 0) result.append(", statusCode=").append(statusCode);
    if (traceId != null) result.append(", traceId=").append(traceId);
    if (errorType != null) result.append(", errorType=").append(errorType);
    return result.append("}").toString();
  }
}
