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
package netscope.context;

import java.io.Closeable;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;
import netscope.ObservableValue;
import netscope.ValueObserver;
import netscope.internal.Nullable;
import netscope.internal.Platform;

/**
 * Keeps a {@link ContextSnapshot} current as its inputs change, so that any thread can read it
 * synchronously. This is typically used to attach session context to artifacts produced out of
 * band, such as crash reports.
 *
 * <p>Each input is an {@link ObservableValue}. On change, a narrow update of only that field is
 * queued on a single serial executor. {@link #currentSnapshot()} reads on the same executor, so a
 * read is ordered after every update queued before it.
 *
 * <p>Every update fires {@link #onSnapshotChange(Consumer)} with the whole snapshot. Other fields
 * of that snapshot may not yet reflect changes that are still queued.
 */
public final class ContextSnapshotStore implements Closeable {

  /**
   * Creates a store whose initial snapshot is built from the current value of each input.
   * Missing consent defaults to {@link TrackingConsent#PENDING} and a missing user to {@link
   * UserInfo#EMPTY}.
   */
  public static ContextSnapshotStore create(
    ObservableValue<TrackingConsent> trackingConsent,
    ObservableValue<UserInfo> userInfo,
    ObservableValue<NetworkConnectionInfo> networkConnectionInfo,
    ObservableValue<CarrierInfo> carrierInfo,
    ObservableValue<ViewEvent> lastViewEvent) {
    if (trackingConsent == null) throw new NullPointerException("trackingConsent == null");
    if (userInfo == null) throw new NullPointerException("userInfo == null");
    if (networkConnectionInfo == null) {
      throw new NullPointerException("networkConnectionInfo == null");
    }
    if (carrierInfo == null) throw new NullPointerException("carrierInfo == null");
    if (lastViewEvent == null) throw new NullPointerException("lastViewEvent == null");

    ContextSnapshotStore result = new ContextSnapshotStore(read(
      trackingConsent, userInfo, networkConnectionInfo, carrierInfo, lastViewEvent));
    result.subscribe(trackingConsent, userInfo, networkConnectionInfo, carrierInfo, lastViewEvent);
    return result;
  }

  static ContextSnapshot read(
    ObservableValue<TrackingConsent> trackingConsent,
    ObservableValue<UserInfo> userInfo,
    ObservableValue<NetworkConnectionInfo> networkConnectionInfo,
    ObservableValue<CarrierInfo> carrierInfo,
    ObservableValue<ViewEvent> lastViewEvent) {
    TrackingConsent consent = trackingConsent.currentValue();
    UserInfo user = userInfo.currentValue();
    return ContextSnapshot.create(
      consent != null ? consent : TrackingConsent.PENDING,
      user != null ? user : UserInfo.EMPTY,
      networkConnectionInfo.currentValue(),
      carrierInfo.currentValue(),
      lastViewEvent.currentValue()
    );
  }

  final ExecutorService executor;
  // Written only on the executor. Volatile so the fallback read in currentSnapshot is safe.
  volatile ContextSnapshot snapshot;
  @Nullable volatile Thread serialThread;
  @Nullable volatile Consumer<ContextSnapshot> onSnapshotChange;

  ContextSnapshotStore(ContextSnapshot initial) {
    this.snapshot = initial;
    this.executor = Platform.get().newSerialExecutor("netscope-context-snapshot");
  }

  /**
   * Returns the snapshot after all updates queued before this call were applied.
   *
   * <p>If the store is closed, or the calling thread is interrupted while waiting, this returns
   * the last applied snapshot instead.
   */
  public ContextSnapshot currentSnapshot() {
    // reading from an update callback must not wait on itself
    if (Thread.currentThread() == serialThread) return snapshot;
    try {
      return executor.submit(new Callable<ContextSnapshot>() {
        @Override public ContextSnapshot call() {
          return snapshot;
        }
      }).get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return snapshot;
    } catch (ExecutionException | RejectedExecutionException e) {
      Platform.get().log("unable to read the context snapshot; returning the last one", e);
      return snapshot;
    }
  }

  /**
   * Sets a callback invoked with the whole snapshot after each field update. It runs on the
   * store's executor, so it should not block.
   */
  public void onSnapshotChange(@Nullable Consumer<ContextSnapshot> onSnapshotChange) {
    this.onSnapshotChange = onSnapshotChange;
  }

  /** Stops applying updates. Reads return the last applied snapshot. */
  @Override public void close() {
    executor.shutdown();
  }

  /**
   * Subscribes to every source, then re-reads them all on the executor. A change made after the
   * initial read, but before its subscription, is picked up by the re-read.
   */
  void subscribe(
    final ObservableValue<TrackingConsent> trackingConsent,
    final ObservableValue<UserInfo> userInfo,
    final ObservableValue<NetworkConnectionInfo> networkConnectionInfo,
    final ObservableValue<CarrierInfo> carrierInfo,
    final ObservableValue<ViewEvent> lastViewEvent) {
    trackingConsent.subscribe(new FieldUpdater<TrackingConsent>("trackingConsent", false) {
      @Override ContextSnapshot update(ContextSnapshot snapshot, TrackingConsent value) {
        return snapshot.withTrackingConsent(value);
      }
    });
    userInfo.subscribe(new FieldUpdater<UserInfo>("userInfo", false) {
      @Override ContextSnapshot update(ContextSnapshot snapshot, UserInfo value) {
        return snapshot.withUserInfo(value);
      }
    });
    networkConnectionInfo.subscribe(
      new FieldUpdater<NetworkConnectionInfo>("networkConnectionInfo", true) {
        @Override ContextSnapshot update(ContextSnapshot snapshot, NetworkConnectionInfo value) {
          return snapshot.withNetworkConnectionInfo(value);
        }
      });
    carrierInfo.subscribe(new FieldUpdater<CarrierInfo>("carrierInfo", true) {
      @Override ContextSnapshot update(ContextSnapshot snapshot, CarrierInfo value) {
        return snapshot.withCarrierInfo(value);
      }
    });
    lastViewEvent.subscribe(new FieldUpdater<ViewEvent>("lastViewEvent", true) {
      @Override ContextSnapshot update(ContextSnapshot snapshot, ViewEvent value) {
        return snapshot.withLastViewEvent(value);
      }
    });

    try {
      executor.execute(new Runnable() {
        @Override public void run() {
          serialThread = Thread.currentThread();
          snapshot = read(
            trackingConsent, userInfo, networkConnectionInfo, carrierInfo, lastViewEvent);
        }
      });
    } catch (RejectedExecutionException e) {
      Platform.get().log("unable to re-read the context sources", e);
    }
  }

  void apply(ContextSnapshot next) {
    snapshot = next;
    Consumer<ContextSnapshot> callback = onSnapshotChange;
    if (callback == null) return;
    try {
      callback.accept(next);
    } catch (RuntimeException e) {
      Platform.get().log("error notifying snapshot change", e);
    }
  }

  /** Queues an update of one field whenever its source changes. */
  abstract class FieldUpdater<V> implements ValueObserver<V> {
    final String field;
    final boolean nullable;

    FieldUpdater(String field, boolean nullable) {
      this.field = field;
      this.nullable = nullable;
    }

    abstract ContextSnapshot update(ContextSnapshot snapshot, V value);

    @Override public void onValueChanged(@Nullable V oldValue, @Nullable final V newValue) {
      if (newValue == null && !nullable) {
        Platform.get().log("ignoring null {0}", field, null);
        return;
      }
      try {
        executor.execute(new Runnable() {
          @Override public void run() {
            serialThread = Thread.currentThread();
            apply(update(snapshot, newValue));
          }
        });
      } catch (RejectedExecutionException e) {
        Platform.get().log("dropping update of {0} as the store is closed", field, e);
      }
    }

    @Override public String toString() {
      return "FieldUpdater{" + field + "}";
    }
  }
}
