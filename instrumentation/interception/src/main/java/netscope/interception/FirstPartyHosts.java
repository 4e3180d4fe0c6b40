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

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

import static java.util.Collections.unmodifiableSet;

/** Matches hosts against a set of hosts, including their subdomains. */
final class FirstPartyHosts {
  static FirstPartyHosts create(Set<String> hosts) {
    Set<String> normalized = new LinkedHashSet<>();
    for (String host : hosts) normalized.add(normalize(host));
    return new FirstPartyHosts(unmodifiableSet(normalized));
  }

  static String normalize(String host) {
    if (host == null) throw new NullPointerException("host == null");
    String result = host.trim().toLowerCase(Locale.ROOT);
    if (result.isEmpty()) throw new IllegalArgumentException("host is empty");
    return result;
  }

  final Set<String> hosts;

  FirstPartyHosts(Set<String> hosts) {
    this.hosts = hosts;
  }

  /** @param host lowercase host of a request */
  boolean matches(String host) {
    return matches(hosts, host);
  }

  /**
   * Returns true if the host equals one of the candidates or ends with "." followed by one. Ex.
   * "api.example.com" matches "example.com", but "myexample.com" does not.
   */
  static boolean matches(Set<String> candidates, String host) {
    for (String candidate : candidates) {
      if (candidate == null || candidate.isEmpty()) continue;
      int hostLength = host.length(), candidateLength = candidate.length();
      if (hostLength == candidateLength) {
        if (host.equalsIgnoreCase(candidate)) return true;
      } else if (hostLength > candidateLength
        && host.charAt(hostLength - candidateLength - 1) == '.'
        && host.regionMatches(true, hostLength - candidateLength, candidate, 0, candidateLength)) {
        return true;
      }
    }
    return false;
  }

  @Override public String toString() {
    return hosts.toString();
  }
}
