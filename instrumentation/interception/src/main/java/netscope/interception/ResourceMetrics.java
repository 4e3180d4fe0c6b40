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
 * Timing and transfer data the transport collected for a task. Timestamps are epoch microseconds,
 * like {@link brave.Span#start(long)}.
 *
 * <p>Only the overall fetch is required. Other phases are absent when the transport didn't perform
 * them (ex. a reused connection has no DNS or connect phase) or can't measure them.
 */
public final class ResourceMetrics {
  public static Builder newBuilder(long fetchStartMicros, long fetchEndMicros) {
    return new Builder(Phase.create(fetchStartMicros, fetchEndMicros));
  }

  /** A span of time within the fetch. */
  public static final class Phase {
    public static Phase create(long startMicros, long endMicros) {
      if (startMicros <= 0L) throw new IllegalArgumentException("startMicros <= 0");
      if (endMicros < startMicros) throw new IllegalArgumentException("endMicros < startMicros");
      return new Phase(startMicros, endMicros);
    }

    final long startMicros, endMicros;

    Phase(long startMicros, long endMicros) {
      this.startMicros = startMicros;
      this.endMicros = endMicros;
    }

    public long startMicros() {
      return startMicros;
    }

    public long endMicros() {
      return endMicros;
    }

    public long durationMicros() {
      return endMicros - startMicros;
    }

    @Override public boolean equals(Object o) {
      if (o == this) return true;
      if (!(o instanceof Phase)) return false;
      Phase that = (Phase) o;
      return startMicros == that.startMicros && endMicros == that.endMicros;
    }

    @Override public int hashCode() {
      int h = 1000003;
      h ^= (int) (startMicros ^ (startMicros >>> 32));
      h *= 1000003;
      h ^= (int) (endMicros ^ (endMicros >>> 32));
      return h;
    }

    @Override public String toString() {
      return "Phase{startMicros=" + startMicros + ", endMicros=" + endMicros + "}";
    }
  }

  public static final class Builder {
    final Phase fetch;
    Phase dns, connect, ssl, firstByte, download;
    Long responseSize;

    Builder(Phase fetch) {
      this.fetch = fetch;
    }

    public Builder dns(long startMicros, long endMicros) {
      this.dns = Phase.create(startMicros, endMicros);
      return this;
    }

    public Builder connect(long startMicros, long endMicros) {
      this.connect = Phase.create(startMicros, endMicros);
      return this;
    }

    /** The TLS handshake, which happens within {@link #connect(long, long)}. */
    public Builder ssl(long startMicros, long endMicros) {
      this.ssl = Phase.create(startMicros, endMicros);
      return this;
    }

    /** From the request being sent until the first byte of the response. */
    public Builder firstByte(long startMicros, long endMicros) {
      this.firstByte = Phase.create(startMicros, endMicros);
      return this;
    }

    public Builder download(long startMicros, long endMicros) {
      this.download = Phase.create(startMicros, endMicros);
      return this;
    }

    /** Bytes of the decoded response body. */
    public Builder responseSize(long responseSize) {
      if (responseSize < 0L) throw new IllegalArgumentException("responseSize < 0");
      this.responseSize = responseSize;
      return this;
    }

    public ResourceMetrics build() {
      return new ResourceMetrics(this);
    }
  }

  final Phase fetch;
  @Nullable final Phase dns, connect, ssl, firstByte, download;
  @Nullable final Long responseSize;

  ResourceMetrics(Builder builder) {
    this.fetch = builder.fetch;
    this.dns = builder.dns;
    this.connect = builder.connect;
    this.ssl = builder.ssl;
    this.firstByte = builder.firstByte;
    this.download = builder.download;
    this.responseSize = builder.responseSize;
  }

  /** From the task starting until the response was received or the task failed. */
  public Phase fetch() {
    return fetch;
  }

  @Nullable public Phase dns() {
    return dns;
  }

  @Nullable public Phase connect() {
    return connect;
  }

  @Nullable public Phase ssl() {
    return ssl;
  }

  @Nullable public Phase firstByte() {
    return firstByte;
  }

  @Nullable public Phase download() {
    return download;
  }

  @Nullable public Long responseSize() {
    return responseSize;
  }

  @Override public String toString() {
    StringBuilder result = new StringBuilder("ResourceMetrics{fetch=").append(fetch);
    if (dns != null) result.append(", dns=").append(dns);
    if (connect != null) result.append(", connect=").append(connect);
    if (ssl != null) result.append(", ssl=").append(ssl);
    if (firstByte != null) result.append(", firstByte=").append(firstByte);
    if (download != null) result.append(", download=").append(download);
    if (responseSize != null) result.append(", responseSize=").append(responseSize);
    return result.append('}').toString();
  }
}
