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

/** Mobile carrier the device is registered with. */
public final class CarrierInfo {
  public enum RadioAccessTechnology {
    GPRS,
    EDGE,
    WCDMA,
    HSDPA,
    HSUPA,
    CDMA1X,
    CDMA_EVDO_REV0,
    CDMA_EVDO_REVA,
    CDMA_EVDO_REVB,
    EHRPD,
    LTE,
    NR,
    UNKNOWN
  }

  public static CarrierInfo create(@Nullable String carrierName,
    @Nullable String carrierIsoCountryCode, boolean carrierAllowsVoip,
    RadioAccessTechnology radioAccessTechnology) {
    if (radioAccessTechnology == null) {
      throw new NullPointerException("radioAccessTechnology == null");
    }
    return new CarrierInfo(carrierName, carrierIsoCountryCode, carrierAllowsVoip,
      radioAccessTechnology);
  }

  @Nullable final String carrierName, carrierIsoCountryCode;
  final boolean carrierAllowsVoip;
  final RadioAccessTechnology radioAccessTechnology;

  CarrierInfo(@Nullable String carrierName, @Nullable String carrierIsoCountryCode,
    boolean carrierAllowsVoip, RadioAccessTechnology radioAccessTechnology) {
    this.carrierName = carrierName;
    this.carrierIsoCountryCode = carrierIsoCountryCode;
    this.carrierAllowsVoip = carrierAllowsVoip;
    this.radioAccessTechnology = radioAccessTechnology;
  }

  @Nullable public String carrierName() {
    return carrierName;
  }

  @Nullable public String carrierIsoCountryCode() {
    return carrierIsoCountryCode;
  }

  public boolean carrierAllowsVoip() {
    return carrierAllowsVoip;
  }

  public RadioAccessTechnology radioAccessTechnology() {
    return radioAccessTechnology;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof CarrierInfo)) return false;
    CarrierInfo that = (CarrierInfo) o;
    return UserInfo.equal(carrierName, that.carrierName)
      && UserInfo.equal(carrierIsoCountryCode, that.carrierIsoCountryCode)
      && carrierAllowsVoip == that.carrierAllowsVoip
      && radioAccessTechnology == that.radioAccessTechnology;
  }

  @Override public int hashCode() {
    int h = 1000003;
    h ^= carrierName == null ? 0 : carrierName.hashCode();
    h *= 1000003;
    h ^= carrierIsoCountryCode == null ? 0 : carrierIsoCountryCode.hashCode();
    h *= 1000003;
    h ^= carrierAllowsVoip ? 1231 : 1237;
    h *= 1000003;
    h ^= radioAccessTechnology.hashCode();
    return h;
  }

  @Override public String toString() {
    return "CarrierInfo{carrierName=" + carrierName
      + ", carrierIsoCountryCode=" + carrierIsoCountryCode
      + ", carrierAllowsVoip=" + carrierAllowsVoip
      + ", radioAccessTechnology=" + radioAccessTechnology + "}";
  }
}
