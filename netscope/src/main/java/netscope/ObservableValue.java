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
package netscope;

import netscope.internal.Nullable;

/**
 * A source of a current value that notifies when that value changes. Providers of session context,
 * such as network reachability or the signed-in user, implement this so that consumers can read the
 * value synchronously and also follow its updates.
 *
 * @param <T> the value type
 * @see ValuePublisher
 */
public interface ObservableValue<T> {
  /** Returns the most recently set value. */
  @Nullable T currentValue();

  /**
   * Registers an observer of subsequent changes. There is no way to unsubscribe: observers are
   * expected to live as long as this value.
   */
  void subscribe(ValueObserver<? super T> observer);
}
