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
import netscope.internal.Nullable;

/**
 * Binds a transport session to a {@link TaskInterceptor}, so that the session's own first-party
 * hosts apply to its requests in addition to the configured ones.
 *
 * <p>Transports with one client per backend create one of these per client:
 * <pre>{@code
 * InterceptingSession payments = InterceptingSession.create(interceptor, Set.of("payments.example"));
 * HttpRequest sent = payments.modify(request);
 * payments.taskCreated(task);
 * }</pre>
 */
public final class InterceptingSession implements TransportSession {
  public static InterceptingSession create(TaskInterceptor interceptor) {
    return create(interceptor, Collections.<String>emptySet());
  }

  /**
   * @param additionalFirstPartyHosts hosts whose requests, and those of their subdomains, are
   * first-party when sent through this session
   */
  public static InterceptingSession create(TaskInterceptor interceptor,
    Set<String> additionalFirstPartyHosts) {
    if (interceptor == null) throw new NullPointerException("interceptor == null");
    if (additionalFirstPartyHosts == null) {
      throw new NullPointerException("additionalFirstPartyHosts == null");
    }
    Set<String> hosts = new LinkedHashSet<>();
    for (String host : additionalFirstPartyHosts) hosts.add(FirstPartyHosts.normalize(host));
    return new InterceptingSession(interceptor, Collections.unmodifiableSet(hosts));
  }

  final TaskInterceptor interceptor;
  final Set<String> additionalFirstPartyHosts;

  InterceptingSession(TaskInterceptor interceptor, Set<String> additionalFirstPartyHosts) {
    this.interceptor = interceptor;
    this.additionalFirstPartyHosts = additionalFirstPartyHosts;
  }

  @Override public Set<String> additionalFirstPartyHosts() {
    return additionalFirstPartyHosts;
  }

  public HttpRequest modify(HttpRequest request) {
    return interceptor.modify(request, this);
  }

  public void taskCreated(NetworkTask task) {
    interceptor.taskCreated(task, this);
  }

  public void taskMetricsCollected(NetworkTask task, ResourceMetrics metrics) {
    interceptor.taskMetricsCollected(task, metrics);
  }

  public void taskCompleted(NetworkTask task, @Nullable Throwable error) {
    interceptor.taskCompleted(task, error);
  }

  @Override public String toString() {
    return "InterceptingSession{additionalFirstPartyHosts=" + additionalFirstPartyHosts + "}";
  }
}
