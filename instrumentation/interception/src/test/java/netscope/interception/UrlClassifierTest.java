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
import org.junit.jupiter.api.Test;

import static java.util.Arrays.asList;
import static netscope.interception.UrlClassifier.Classification.FIRST_PARTY;
import static netscope.interception.UrlClassifier.Classification.INTERNAL;
import static netscope.interception.UrlClassifier.Classification.THIRD_PARTY;
import static org.assertj.core.api.Assertions.assertThat;

class UrlClassifierTest {
  UrlClassifier classifier = UrlClassifier.create(InterceptionConfiguration.newBuilder()
    .addFirstPartyHost("first-party.com")
    .addFirstPartyHost("Example.ORG")
    .addFirstPartyHost("intake.netscope.io")
    .addInternalUrl("https://intake.netscope.io/api/v2/rum")
    .addInternalUrl("http://logs.netscope.io")
    .build());

  @Test void firstParty_exactHost() {
    assertThat(classifier.isFirstParty("https://first-party.com/x")).isTrue();
    assertThat(classifier.isFirstParty("http://example.org")).isTrue();
  }

  @Test void firstParty_subdomain() {
    assertThat(classifier.isFirstParty("https://api.first-party.com/x?y=z")).isTrue();
    assertThat(classifier.isFirstParty("https://a.b.example.org:8443/")).isTrue();
  }

  @Test void firstParty_ignoresCase() {
    assertThat(classifier.isFirstParty("https://API.First-Party.COM/x")).isTrue();
  }

  @Test void firstParty_notSuffixOfAnotherDomain() {
    assertThat(classifier.isFirstParty("https://notfirst-party.com/x")).isFalse();
    assertThat(classifier.isFirstParty("https://first-party.com.evil.io/x")).isFalse();
  }

  @Test void firstParty_sessionHostsAreCombined() {
    TransportSession session = () -> Collections.singleton("custom.io");

    assertThat(classifier.isFirstParty("https://api.custom.io/x", session)).isTrue();
    assertThat(classifier.isFirstParty("https://first-party.com/x", session)).isTrue();
    assertThat(classifier.isFirstParty("https://api.custom.io/x")).isFalse();
  }

  @Test void firstParty_sessionWithoutHosts() {
    assertThat(classifier.isFirstParty("https://api.custom.io/x", Collections::emptySet)).isFalse();
    assertThat(classifier.isFirstParty("https://api.custom.io/x", () -> null)).isFalse();
  }

  @Test void firstParty_sessionFailure_notFirstParty() {
    TransportSession broken = () -> {
      throw new IllegalStateException("session invalidated");
    };

    assertThat(classifier.isFirstParty("https://api.custom.io/x", broken)).isFalse();
    assertThat(classifier.classify("https://first-party.com/x", broken)).isEqualTo(FIRST_PARTY);
  }

  @Test void internal_matchesOriginRegardlessOfPath() {
    assertThat(classifier.isInternal("https://intake.netscope.io/api/v2/rum")).isTrue();
    assertThat(classifier.isInternal("https://intake.netscope.io/api/v2/rum?ddsource=java"))
      .isTrue();
    assertThat(classifier.isInternal("https://intake.netscope.io/api/v2/logs")).isTrue();
    assertThat(classifier.isInternal("https://intake.netscope.io:443")).isTrue();
  }

  @Test void internal_defaultPortIsEffectivePort() {
    assertThat(classifier.isInternal("http://logs.netscope.io/v1/input")).isTrue();
    assertThat(classifier.isInternal("http://logs.netscope.io:80/v1/input")).isTrue();
  }

  @Test void internal_requiresSameOrigin() {
    assertThat(classifier.isInternal("https://logs.netscope.io/v1/input")).isFalse();
    assertThat(classifier.isInternal("http://logs.netscope.io:8080/v1/input")).isFalse();
    assertThat(classifier.isInternal("http://api.logs.netscope.io/v1/input")).isFalse();
  }

  @Test void classify_internalWinsOverFirstParty() {
    assertThat(classifier.classify("https://intake.netscope.io/api/v2/rum", null))
      .isEqualTo(INTERNAL);
    assertThat(classifier.classify("https://intake.netscope.io/api/v2/logs", null))
      .isEqualTo(INTERNAL);
    assertThat(classifier.classify("https://api.intake.netscope.io/health", null))
      .isEqualTo(FIRST_PARTY);
    assertThat(classifier.classify("https://third-party.com/x", null))
      .isEqualTo(THIRD_PARTY);
  }

  @Test void classify_invalidUrlsAreThirdParty() {
    Set<String> invalid = new LinkedHashSet<>(asList(
      "", "not a url", "first-party.com/x", "mailto:someone@first-party.com", "https://", "::"
    ));

    for (String url : invalid) {
      assertThat(classifier.classify(url, null)).as(url).isEqualTo(THIRD_PARTY);
    }
    assertThat(classifier.classify(null, null)).isEqualTo(THIRD_PARTY);
  }

  @Test void noHostsConfigured() {
    UrlClassifier empty = UrlClassifier.create(InterceptionConfiguration.newBuilder().build());

    assertThat(empty.classify("https://first-party.com/x", null)).isEqualTo(THIRD_PARTY);
    assertThat(empty.isInternal("https://intake.netscope.io/api/v2/rum")).isFalse();
  }
}
