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

final class DecimalCodec {
  static final long MAX_UNSIGNED_DIV_10 = Long.divideUnsigned(-1L, 10L);
  static final int MAX_UNSIGNED_LAST_DIGIT = (int) Long.remainderUnsigned(-1L, 10L);

  /**
   * Parses a 1 to 20 character unsigned decimal string with no sign into an unsigned long, or
   * returns zero on invalid input, including values that overflow 64 bits.
   */
  static long lenientDecimalToUnsignedLong(CharSequence decimal) {
    int length = decimal.length();
    if (length < 1 || length > 20) return 0L;

    long result = 0L;
    for (int i = 0; i < length; i++) {
      char c = decimal.charAt(i);
      if (c < '0' || c > '9') return 0L;
      int digit = c - '0';
      int compared = Long.compareUnsigned(result, MAX_UNSIGNED_DIV_10);
      if (compared > 0 || (compared == 0 && digit > MAX_UNSIGNED_LAST_DIGIT)) return 0L;
      result = result * 10 + digit;
    }
    return result;
  }

  DecimalCodec() {
  }
}
