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

import java.util.Arrays;
import java.util.List;
import netscope.internal.Platform;

/** Notifies each handler in order. A handler that throws doesn't prevent the next from running. */
final class CompositeInterceptionHandler extends InterceptionHandler {
  static InterceptionHandler create(List<InterceptionHandler> handlers) {
    if (handlers.isEmpty()) return InterceptionHandler.NOOP;
    if (handlers.size() == 1) return handlers.get(0);
    return new CompositeInterceptionHandler(handlers.toArray(new InterceptionHandler[0]));
  }

  // Array ensures no iterators are created at runtime
  final InterceptionHandler[] handlers;

  CompositeInterceptionHandler(InterceptionHandler[] handlers) {
    this.handlers = handlers;
  }

  @Override public void interceptionStarted(TaskInterception interception) {
    for (InterceptionHandler handler : handlers) {
      try {
        handler.interceptionStarted(interception);
      } catch (RuntimeException e) {
        Platform.get().log("error handling start of {0}", interception, e);
      }
    }
  }

  @Override public void interceptionCompleted(TaskInterception interception) {
    for (InterceptionHandler handler : handlers) {
      try {
        handler.interceptionCompleted(interception);
      } catch (RuntimeException e) {
        Platform.get().log("error handling completion of {0}", interception, e);
      }
    }
  }

  @Override public int hashCode() {
    return Arrays.hashCode(handlers);
  }

  @Override public boolean equals(Object obj) {
    if (!(obj instanceof CompositeInterceptionHandler)) return false;
    return Arrays.equals(((CompositeInterceptionHandler) obj).handlers, handlers);
  }

  @Override public String toString() {
    return Arrays.toString(handlers);
  }
}
