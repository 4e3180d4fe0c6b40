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
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Set;
import netscope.internal.Nullable;
import netscope.internal.Platform;

/**
 * Decides whether a request URL belongs to the application's own backend, to the telemetry intake
 * of this library, or to anyone else.
 *
 * <p>Classification never throws: a URL that doesn't parse, or has no host, is third-party. That
 * means it is tracked, but never receives trace headers.
 */
public final class UrlClassifier {
  public enum Classification {
    /** Telemetry intake of this library. Never tracked or modified. */
    INTERNAL,
    /** Tracked and eligible for trace headers. */
    FIRST_PARTY,
    /** Tracked, but never receives trace headers. */
    THIRD_PARTY
  }

  public static UrlClassifier create(InterceptionConfiguration configuration) {
    if (configuration == null) throw new NullPointerException("configuration == null");
    return new UrlClassifier(FirstPartyHosts.create(configuration.firstPartyHosts()),
      InternalUrls.create(configuration.internalUrls()));
  }

  final FirstPartyHosts firstPartyHosts;
  final InternalUrls internalUrls;

  UrlClassifier(FirstPartyHosts firstPartyHosts, InternalUrls internalUrls) {
    this.firstPartyHosts = firstPartyHosts;
    this.internalUrls = internalUrls;
  }

  /** Internal takes precedence over first-party, so our own traffic is never reported. */
  public Classification classify(@Nullable String url, @Nullable TransportSession session) {
    if (isInternal(url)) return Classification.INTERNAL;
    if (isFirstParty(url, session)) return Classification.FIRST_PARTY;
    return Classification.THIRD_PARTY;
  }

  /** True if the URL has the origin (scheme, host and port) of a configured internal URL. */
  public boolean isInternal(@Nullable String url) {
    URI uri = parse(url);
    return uri != null && internalUrls.contains(uri);
  }

  /** True if the host of the URL is, or is a subdomain of, a configured first-party host. */
  public boolean isFirstParty(@Nullable String url) {
    return isFirstParty(url, null);
  }

  /**
   * Like {@link #isFirstParty(String)}, except the {@linkplain
   * TransportSession#additionalFirstPartyHosts() session hosts} also count.
   */
  public boolean isFirstParty(@Nullable String url, @Nullable TransportSession session) {
    String host = host(url);
    if (host == null) return false;
    if (firstPartyHosts.matches(host)) return true;
    if (session == null) return false;
    Set<String> sessionHosts;
    try {
      sessionHosts = session.additionalFirstPartyHosts();
    } catch (RuntimeException e) {
      Platform.get().log("error reading first-party hosts of {0}", session, e);
      return false;
    }
    return sessionHosts != null && FirstPartyHosts.matches(sessionHosts, host);
  }

  /** Returns the lowercase host of the URL, or null if unparseable or hostless. */
  @Nullable static String host(@Nullable String url) {
    URI uri = parse(url);
    if (uri == null) return null;
    String host = uri.getHost();
    if (host == null || host.isEmpty()) return null;
    return host.toLowerCase(Locale.ROOT);
  }

  @Nullable static URI parse(@Nullable String url) {
    if (url == null || url.isEmpty()) return null;
    try {
      return new URI(url);
    } catch (URISyntaxException e) {
      return null; // classified as third-party
    }
  }

  @Override public String toString() {
    return "UrlClassifier{firstPartyHosts=" + firstPartyHosts
      + ", internalUrls=" + internalUrls + "}";
  }
}
