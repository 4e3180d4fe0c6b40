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
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Which requests are first-party, which belong to this library, and which features act on them.
 *
 * <pre>{@code
 * InterceptionConfiguration configuration = InterceptionConfiguration.newBuilder()
 *   .addFirstPartyHost("example.com")
 *   .addInternalUrl("https://intake.netscope.io/api/v2/rum")
 *   .resourceTrackingEnabled(true)
 *   .build();
 * }</pre>
 */
public final class InterceptionConfiguration {
  public static Builder newBuilder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  public static final class Builder {
    final Set<String> firstPartyHosts = new LinkedHashSet<>();
    final Set<String> internalUrls = new LinkedHashSet<>();
    boolean tracingEnabled = true, resourceTrackingEnabled;

    Builder() {
    }

    Builder(InterceptionConfiguration source) {
      firstPartyHosts.addAll(source.firstPartyHosts);
      internalUrls.addAll(source.internalUrls);
      tracingEnabled = source.tracingEnabled;
      resourceTrackingEnabled = source.resourceTrackingEnabled;
    }

    /** Replaces any first-party hosts added so far. */
    public Builder firstPartyHosts(Set<String> hosts) {
      if (hosts == null) throw new NullPointerException("hosts == null");
      firstPartyHosts.clear();
      for (String host : hosts) addFirstPartyHost(host);
      return this;
    }

    /**
     * Requests to this host, or any of its subdomains, are first-party. Ex. "example.com" also
     * matches "api.example.com".
     *
     * @throws IllegalArgumentException if the host is blank
     */
    public Builder addFirstPartyHost(String host) {
      firstPartyHosts.add(FirstPartyHosts.normalize(host));
      return this;
    }

    /** Replaces any internal URLs added so far. */
    public Builder internalUrls(Set<String> urls) {
      if (urls == null) throw new NullPointerException("urls == null");
      internalUrls.clear();
      for (String url : urls) addInternalUrl(url);
      return this;
    }

    /**
     * Requests to the origin (scheme, host and port) of this URL are this library's own telemetry
     * and are never intercepted, whatever their path.
     *
     * @throws IllegalArgumentException if the URL has no scheme or host
     */
    public Builder addInternalUrl(String url) {
      InternalUrls.Endpoint.parse(url); // validate
      internalUrls.add(url.trim());
      return this;
    }

    /** When true, the default, first-party requests receive trace headers. */
    public Builder tracingEnabled(boolean tracingEnabled) {
      this.tracingEnabled = tracingEnabled;
      return this;
    }

    /**
     * When true, resource events are collected for requests. If tracing is also enabled, trace
     * headers identify resource tracking as their origin. Defaults to false.
     */
    public Builder resourceTrackingEnabled(boolean resourceTrackingEnabled) {
      this.resourceTrackingEnabled = resourceTrackingEnabled;
      return this;
    }

    public InterceptionConfiguration build() {
      return new InterceptionConfiguration(this);
    }
  }

  final Set<String> firstPartyHosts, internalUrls;
  final boolean tracingEnabled, resourceTrackingEnabled;

  InterceptionConfiguration(Builder builder) {
    firstPartyHosts = Collections.unmodifiableSet(new LinkedHashSet<>(builder.firstPartyHosts));
    internalUrls = Collections.unmodifiableSet(new LinkedHashSet<>(builder.internalUrls));
    tracingEnabled = builder.tracingEnabled;
    resourceTrackingEnabled = builder.resourceTrackingEnabled;
  }

  /** Lowercase hosts whose requests, and those of their subdomains, are first-party. */
  public Set<String> firstPartyHosts() {
    return firstPartyHosts;
  }

  public Set<String> internalUrls() {
    return internalUrls;
  }

  public boolean tracingEnabled() {
    return tracingEnabled;
  }

  public boolean resourceTrackingEnabled() {
    return resourceTrackingEnabled;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof InterceptionConfiguration)) return false;
    InterceptionConfiguration that = (InterceptionConfiguration) o;
    return firstPartyHosts.equals(that.firstPartyHosts)
      && internalUrls.equals(that.internalUrls)
      && tracingEnabled == that.tracingEnabled
      && resourceTrackingEnabled == that.resourceTrackingEnabled;
  }

  @Override public int hashCode() {
    int h = 1000003;
    h ^= firstPartyHosts.hashCode();
    h *= 1000003;
    h ^= internalUrls.hashCode();
    h *= 1000003;
    h ^= tracingEnabled ? 1231 : 1237;
    h *= 1000003;
    h ^= resourceTrackingEnabled ? 1231 : 1237;
    return h;
  }

  @Override public String toString() {
    return "InterceptionConfiguration{firstPartyHosts=" + firstPartyHosts
      + ", internalUrls=" + internalUrls
      + ", tracingEnabled=" + tracingEnabled
      + ", resourceTrackingEnabled=" + resourceTrackingEnabled
      + "}";
  }
}
