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

import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import netscope.internal.Nullable;
import netscope.internal.Platform;

/**
 * Thread-safe holder of a single value, which notifies observers after each change.
 *
 * <p>The value is replaced atomically and readers never wait on observers. Observers are invoked
 * after the new value is visible, outside of any lock. Changes are queued in the order they were
 * applied and delivered in that order: when several threads set the value at once, whichever
 * thread is already notifying delivers the others' changes too, so {@link #set(Object)} may
 * return before observers saw its change. An observer that throws is logged and does not prevent
 * others from being notified.
 *
 * <pre>{@code
 * ValuePublisher<TrackingConsent> consent = new ValuePublisher<>(TrackingConsent.PENDING);
 * consent.subscribe((oldValue, newValue) -> executor.execute(() -> apply(newValue)));
 * consent.set(TrackingConsent.GRANTED);
 * }</pre>
 *
 * @param <T> the published value type
 */
public final class ValuePublisher<T> implements ObservableValue<T> {
  final Object lock = new Object();
  final List<ValueObserver<? super T>> observers = new CopyOnWriteArrayList<>();
  final Queue<Change<T>> changes = new ConcurrentLinkedQueue<>();
  final AtomicBoolean notifying = new AtomicBoolean();
  @Nullable T value; // guarded by lock

  public ValuePublisher(@Nullable T initialValue) {
    this.value = initialValue;
  }

  @Override @Nullable public T currentValue() {
    synchronized (lock) {
      return value;
    }
  }

  /** Replaces the current value, then notifies all observers with the old and new values. */
  public void set(@Nullable T newValue) {
    synchronized (lock) {
      // queued under the lock so that delivery order matches the order values were replaced
      changes.add(new Change<T>(value, newValue));
      value = newValue;
    }
    drain();
  }

  @Override public void subscribe(ValueObserver<? super T> observer) {
    if (observer == null) throw new NullPointerException("observer == null");
    observers.add(observer);
  }

  /** Delivers queued changes unless another thread is already doing so. */
  void drain() {
    while (!changes.isEmpty() && notifying.compareAndSet(false, true)) {
      try {
        Change<T> change;
        while ((change = changes.poll()) != null) deliver(change);
      } finally {
        notifying.set(false);
      }
    }
  }

  void deliver(Change<T> change) {
    for (ValueObserver<? super T> observer : observers) {
      try {
        observer.onValueChanged(change.oldValue, change.newValue);
      } catch (RuntimeException e) {
        Platform.get().log("error notifying observer {0}", observer, e);
      }
    }
  }

  static final class Change<T> {
    @Nullable final T oldValue, newValue;

    Change(@Nullable T oldValue, @Nullable T newValue) {
      this.oldValue = oldValue;
      this.newValue = newValue;
    }
  }

  @Override public String toString() {
    return "ValuePublisher{" + currentValue() + "}";
  }
}
