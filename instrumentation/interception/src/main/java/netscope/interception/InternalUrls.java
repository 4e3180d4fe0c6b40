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

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Matches request URLs against the telemetry endpoints of this library. A request is internal when
 * it has the same origin (scheme, host and port) as an endpoint, regardless of its path.
 */
final class InternalUrls {
  static InternalUrls create(Set<String> urls) {
    List<Endpoint> endpoints = new ArrayList<>();
    for (String url : urls) endpoints.add(Endpoint.parse(url));
    return new InternalUrls(Collections.unmodifiableList(endpoints));
  }

  final List<Endpoint> endpoints;

  InternalUrls(List<Endpoint> endpoints) {
    this.endpoints = endpoints;
  }

  boolean contains(URI uri) {
    if (endpoints.isEmpty()) return false;
    String scheme = uri.getScheme(), host = uri.getHost();
    if (scheme == null || host == null) return false;
    scheme = scheme.toLowerCase(Locale.ROOT);
    host = host.toLowerCase(Locale.ROOT);
    int port = effectivePort(scheme, uri.getPort());
    for (Endpoint endpoint : endpoints) {
      if (endpoint.matches(scheme, host, port)) return true;
    }
    return false;
  }

  static int effectivePort(String scheme, int port) {
    if (port != -1) return port;
    if ("https".equals(scheme)) return 443;
    if ("http".equals(scheme)) return 80;
    return -1;
  }

  static final class Endpoint {
    /** @throws IllegalArgumentException if the URL has no scheme or host */
    static Endpoint parse(String url) {
      if (url == null) throw new NullPointerException("url == null");
      URI uri = UrlClassifier.parse(url.trim());
      if (uri == null || uri.getScheme() == null || uri.getHost() == null) {
        throw new IllegalArgumentException("invalid internal url: " + url);
      }
      String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
      return new Endpoint(scheme, uri.getHost().toLowerCase(Locale.ROOT),
        effectivePort(scheme, uri.getPort()));
    }

    final String scheme, host;
    final int port;

    Endpoint(String scheme, String host, int port) {
      this.scheme = scheme;
      this.host = host;
      this.port = port;
    }

    boolean matches(String scheme, String host, int port) {
      return this.scheme.equals(scheme) && this.host.equals(host) && this.port == port;
    }

    @Override public String toString() {
      return scheme + "://" + host + ":" + port;
    }
  }

  @Override public String toString() {
    return endpoints.toString();
  }
}
