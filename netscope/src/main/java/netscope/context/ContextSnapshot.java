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

import netscope.internal.Nullable;

/**
 * Immutable view of the session context at some point in time.
 *
 * <p>Each field holds the most recent value seen for it. Fields are updated independently, so two
 * fields are not guaranteed to describe the same instant.
 */
public final class ContextSnapshot {
  public static ContextSnapshot create(TrackingConsent trackingConsent, UserInfo userInfo,
    @Nullable NetworkConnectionInfo networkConnectionInfo, @Nullable CarrierInfo carrierInfo,
    @Nullable ViewEvent lastViewEvent) {
    if (trackingConsent == null) throw new NullPointerException("trackingConsent == null");
    if (userInfo == null) throw new NullPointerException("userInfo == null");
    return new ContextSnapshot(trackingConsent, userInfo, networkConnectionInfo, carrierInfo,
      lastViewEvent);
  }

  final TrackingConsent trackingConsent;
  final UserInfo userInfo;
  @Nullable final NetworkConnectionInfo networkConnectionInfo;
  @Nullable final CarrierInfo carrierInfo;
  @Nullable final ViewEvent lastViewEvent;

  ContextSnapshot(TrackingConsent trackingConsent, UserInfo userInfo,
    @Nullable NetworkConnectionInfo networkConnectionInfo, @Nullable CarrierInfo carrierInfo,
    @Nullable ViewEvent lastViewEvent) {
    this.trackingConsent = trackingConsent;
    this.userInfo = userInfo;
    this.networkConnectionInfo = networkConnectionInfo;
    this.carrierInfo = carrierInfo;
    this.lastViewEvent = lastViewEvent;
  }

  public TrackingConsent trackingConsent() {
    return trackingConsent;
  }

  public UserInfo userInfo() {
    return userInfo;
  }

  @Nullable public NetworkConnectionInfo networkConnectionInfo() {
    return networkConnectionInfo;
  }

  @Nullable public CarrierInfo carrierInfo() {
    return carrierInfo;
  }

  @Nullable public ViewEvent lastViewEvent() {
    return lastViewEvent;
  }

  public ContextSnapshot withTrackingConsent(TrackingConsent trackingConsent) {
    if (trackingConsent == null) throw new NullPointerException("trackingConsent == null");
    if (trackingConsent == this.trackingConsent) return this;
    return new ContextSnapshot(trackingConsent, userInfo, networkConnectionInfo, carrierInfo,
      lastViewEvent);
  }

  public ContextSnapshot withUserInfo(UserInfo userInfo) {
    if (userInfo == null) throw new NullPointerException("userInfo == null");
    return new ContextSnapshot(trackingConsent, userInfo, networkConnectionInfo, carrierInfo,
      lastViewEvent);
  }

  public ContextSnapshot withNetworkConnectionInfo(
    @Nullable NetworkConnectionInfo networkConnectionInfo) {
    return new ContextSnapshot(trackingConsent, userInfo, networkConnectionInfo, carrierInfo,
      lastViewEvent);
  }

  public ContextSnapshot withCarrierInfo(@Nullable CarrierInfo carrierInfo) {
    return new ContextSnapshot(trackingConsent, userInfo, networkConnectionInfo, carrierInfo,
      lastViewEvent);
  }

  public ContextSnapshot withLastViewEvent(@Nullable ViewEvent lastViewEvent) {
    return new ContextSnapshot(trackingConsent, userInfo, networkConnectionInfo, carrierInfo,
      lastViewEvent);
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof ContextSnapshot)) return false;
    ContextSnapshot that = (ContextSnapshot) o;
    return trackingConsent == that.trackingConsent
      && userInfo.equals(that.userInfo)
      && UserInfo.equal(networkConnectionInfo, that.networkConnectionInfo)
      && UserInfo.equal(carrierInfo, that.carrierInfo)
      && UserInfo.equal(lastViewEvent, that.lastViewEvent);
  }

  @Override public int hashCode() {
    int h = 1000003;
    h ^= trackingConsent.hashCode();
    h *= 1000003;
    h ^= userInfo.hashCode();
    h *= 1000003;
    h ^= networkConnectionInfo == null ? 0 : networkConnectionInfo.hashCode();
    h *= 1000003;
    h ^= carrierInfo == null ? 0 : carrierInfo.hashCode();
    h *= 1000003;
    h ^= lastViewEvent == null ? 0 : lastViewEvent.hashCode();
    return h;
  }

  @Override public String toString() {
    return "ContextSnapshot{trackingConsent=" + trackingConsent
      + ", userInfo=" + userInfo
      + ", networkConnectionInfo=" + networkConnectionInfo
      + ", carrierInfo=" + carrierInfo
      + ", lastViewEvent=" + lastViewEvent + "}";
  }
}
