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
 * Receives changes of an {@link ObservableValue}.
 *
 * <p>This is invoked on a thread that changed the value, not necessarily the one that made this
 * change, and never while a lock of the publisher is held. Implementations must not block: hand
 * the work to your own executor instead.
 *
 * @param <T> the observed value type
 */
public interface ValueObserver<T> {
  void onValueChanged(@Nullable T oldValue, @Nullable T newValue);
}
