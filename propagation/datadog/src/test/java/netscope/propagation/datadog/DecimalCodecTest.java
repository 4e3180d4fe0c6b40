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
package netscope.propagation.datadog;

import org.junit.jupiter.api.Test;

import static netscope.propagation.datadog.DecimalCodec.lenientDecimalToUnsignedLong;
import static org.assertj.core.api.Assertions.assertThat;

class DecimalCodecTest {
  @Test void parsesDecimal() {
    assertThat(lenientDecimalToUnsignedLong("1")).isEqualTo(1L);
    assertThat(lenientDecimalToUnsignedLong("1234567890123456789"))
      .isEqualTo(1234567890123456789L);
  }

  @Test void parsesMaxUnsigned() {
    assertThat(lenientDecimalToUnsignedLong("18446744073709551615")).isEqualTo(-1L);
  }

  @Test void overflowIsZero() {
    assertThat(lenientDecimalToUnsignedLong("18446744073709551616")).isZero();
    assertThat(lenientDecimalToUnsignedLong("99999999999999999999")).isZero();
  }

  @Test void invalidIsZero() {
    assertThat(lenientDecimalToUnsignedLong("")).isZero();
    assertThat(lenientDecimalToUnsignedLong("-1")).isZero();
    assertThat(lenientDecimalToUnsignedLong("12a")).isZero();
    assertThat(lenientDecimalToUnsignedLong("123456789012345678901")).isZero();
  }
}
