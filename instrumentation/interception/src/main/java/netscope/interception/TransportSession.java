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

import java.util.Set;

/**
 * A transport session which trusts more hosts than the ones configured globally. A request is
 * first-party if either {@link InterceptionConfiguration#firstPartyHosts()} or the session says so.
 *
 * @see InterceptingSession
 */
public interface TransportSession {
  /** Hosts, including their subdomains, considered first-party for requests of this session. */
  Set<String> additionalFirstPartyHosts();
}
