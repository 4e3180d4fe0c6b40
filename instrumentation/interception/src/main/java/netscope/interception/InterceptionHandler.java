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

/**
 * Receives the start and end of each interception tracked by {@link TaskInterceptor}.
 *
 * <p>Callbacks run on the interceptor's single background thread, in the order the lifecycle
 * events were received for a task. Do work quickly: slow handlers delay every other task. An
 * exception thrown here is logged and does not affect other interceptions.
 */
public abstract class InterceptionHandler {
  /** Use to avoid collecting anything. */
  public static final InterceptionHandler NOOP = new InterceptionHandler() {
    @Override public String toString() {
      return "NoopInterceptionHandler{}";
    }
  };

  /** Called once, when {@link TaskInterceptor#taskCreated} was processed for a task. */
  public void interceptionStarted(TaskInterception interception) {
  }

  /**
   * Called once, when both metrics and completion were recorded. The input is {@linkplain
   * TaskInterception#isDone() done}.
   */
  public void interceptionCompleted(TaskInterception interception) {
  }
}
