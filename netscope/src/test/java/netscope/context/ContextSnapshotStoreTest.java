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

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import netscope.ObservableValue;
import netscope.ValueObserver;
import netscope.ValuePublisher;
import netscope.context.NetworkConnectionInfo.Reachability;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class ContextSnapshotStoreTest {
  NetworkConnectionInfo wifi = NetworkConnectionInfo.newBuilder(Reachability.YES)
    .addAvailableInterface(NetworkConnectionInfo.Interface.WIFI)
    .supportsIPv4(true)
    .build();
  NetworkConnectionInfo offline = NetworkConnectionInfo.newBuilder(Reachability.NO).build();
  CarrierInfo carrier = CarrierInfo.create("Carrier", "US", true,
    CarrierInfo.RadioAccessTechnology.LTE);
  UserInfo alice = UserInfo.create("1", "Alice", "alice@example.com");
  ViewEvent homeView = ViewEvent.create("view-1", "Home", "app://home", 1000L);

  ValuePublisher<TrackingConsent> consent = new ValuePublisher<>(TrackingConsent.PENDING);
  ValuePublisher<UserInfo> userInfo = new ValuePublisher<>(UserInfo.EMPTY);
  ValuePublisher<NetworkConnectionInfo> network = new ValuePublisher<>(wifi);
  ValuePublisher<CarrierInfo> carrierInfo = new ValuePublisher<>(null);
  ValuePublisher<ViewEvent> viewEvent = new ValuePublisher<>(null);

  ContextSnapshotStore store =
    ContextSnapshotStore.create(consent, userInfo, network, carrierInfo, viewEvent);

  @AfterEach void close() {
    store.close();
  }

  @Test void initialSnapshot_pullsCurrentValues() {
    assertThat(store.currentSnapshot()).isEqualTo(
      ContextSnapshot.create(TrackingConsent.PENDING, UserInfo.EMPTY, wifi, null, null));
  }

  @Test void initialSnapshot_defaultsMissingConsentAndUser() {
    try (ContextSnapshotStore defaulted = ContextSnapshotStore.create(
      new ValuePublisher<>(null), new ValuePublisher<>(null), network, carrierInfo, viewEvent)) {
      assertThat(defaulted.currentSnapshot().trackingConsent())
        .isEqualTo(TrackingConsent.PENDING);
      assertThat(defaulted.currentSnapshot().userInfo())
        .isSameAs(UserInfo.EMPTY);
    }
  }

  @Test void changeBeforeSubscription_isNotLost() {
    store.close();
    ValuePublisher<UserInfo> users = new ValuePublisher<>(UserInfo.EMPTY);
    // changes the value after the store read it, but before the store is subscribed
    ObservableValue<UserInfo> racingUsers = new ObservableValue<UserInfo>() {
      @Override public UserInfo currentValue() {
        return users.currentValue();
      }

      @Override public void subscribe(ValueObserver<? super UserInfo> observer) {
        users.set(alice);
        users.subscribe(observer);
      }
    };

    store = ContextSnapshotStore.create(consent, racingUsers, network, carrierInfo, viewEvent);

    assertThat(store.currentSnapshot().userInfo()).isEqualTo(alice);
  }

  @Test void currentSnapshot_reflectsEachFieldUpdate() {
    consent.set(TrackingConsent.GRANTED);
    userInfo.set(alice);
    network.set(offline);
    carrierInfo.set(carrier);
    viewEvent.set(homeView);

    assertThat(store.currentSnapshot()).isEqualTo(
      ContextSnapshot.create(TrackingConsent.GRANTED, alice, offline, carrier, homeView));
  }

  @Test void optionalFields_canBeCleared() {
    carrierInfo.set(carrier);
    carrierInfo.set(null);
    network.set(null);

    ContextSnapshot snapshot = store.currentSnapshot();
    assertThat(snapshot.carrierInfo()).isNull();
    assertThat(snapshot.networkConnectionInfo()).isNull();
  }

  @Test void requiredFields_ignoreNull() {
    consent.set(TrackingConsent.NOT_GRANTED);
    consent.set(null);
    userInfo.set(null);

    ContextSnapshot snapshot = store.currentSnapshot();
    assertThat(snapshot.trackingConsent()).isEqualTo(TrackingConsent.NOT_GRANTED);
    assertThat(snapshot.userInfo()).isEqualTo(UserInfo.EMPTY);
  }

  @Test void onSnapshotChange_receivesWholeSnapshot() {
    List<ContextSnapshot> changes = new CopyOnWriteArrayList<>();
    store.onSnapshotChange(changes::add);

    consent.set(TrackingConsent.GRANTED);
    userInfo.set(alice);

    await().atMost(1, SECONDS).until(() -> changes.size() == 2);
    assertThat(changes.get(0)).isEqualTo(
      ContextSnapshot.create(TrackingConsent.GRANTED, UserInfo.EMPTY, wifi, null, null));
    assertThat(changes.get(1)).isEqualTo(
      ContextSnapshot.create(TrackingConsent.GRANTED, alice, wifi, null, null));
  }

  @Test void onSnapshotChange_canReadCurrentSnapshot() {
    List<ContextSnapshot> reads = new CopyOnWriteArrayList<>();
    store.onSnapshotChange(snapshot -> reads.add(store.currentSnapshot()));

    consent.set(TrackingConsent.GRANTED);

    await().atMost(1, SECONDS).until(() -> reads.size() == 1);
    assertThat(reads.get(0).trackingConsent()).isEqualTo(TrackingConsent.GRANTED);
  }

  @Test void onSnapshotChange_exceptionDoesntStopUpdates() {
    store.onSnapshotChange(snapshot -> {
      throw new IllegalStateException("boom");
    });

    consent.set(TrackingConsent.GRANTED);
    userInfo.set(alice);

    assertThat(store.currentSnapshot().userInfo()).isEqualTo(alice);
  }

  @Test void close_readsReturnLastSnapshot() {
    consent.set(TrackingConsent.GRANTED);
    ContextSnapshot beforeClose = store.currentSnapshot();
    store.close();

    consent.set(TrackingConsent.NOT_GRANTED);

    assertThat(store.currentSnapshot()).isEqualTo(beforeClose);
  }

  /** Every snapshot read must equal one that was actually published at some point. */
  @Test void concurrentReadsAndUpdates_neverObserveUnpublishedSnapshot() throws Exception {
    Set<ContextSnapshot> published = ConcurrentHashMap.newKeySet();
    published.add(store.currentSnapshot());
    store.onSnapshotChange(published::add);

    List<Runnable> updates = new ArrayList<>();
    updates.add(() -> consent.set(TrackingConsent.GRANTED));
    updates.add(() -> userInfo.set(alice));
    updates.add(() -> network.set(offline));
    updates.add(() -> carrierInfo.set(carrier));
    updates.add(() -> viewEvent.set(homeView));

    List<ContextSnapshot> reads = new CopyOnWriteArrayList<>();
    ExecutorService pool = Executors.newFixedThreadPool(8);
    CountDownLatch start = new CountDownLatch(1);
    for (Runnable update : updates) {
      pool.execute(() -> {
        awaitQuietly(start);
        update.run();
      });
    }
    for (int i = 0; i < 50; i++) {
      pool.execute(() -> {
        awaitQuietly(start);
        reads.add(store.currentSnapshot());
      });
    }
    start.countDown();
    pool.shutdown();
    assertThat(pool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

    assertThat(reads).hasSize(50);
    assertThat(published).containsAll(reads);
    assertThat(store.currentSnapshot()).isEqualTo(
      ContextSnapshot.create(TrackingConsent.GRANTED, alice, offline, carrier, homeView));
  }

  static void awaitQuietly(CountDownLatch latch) {
    try {
      latch.await();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
