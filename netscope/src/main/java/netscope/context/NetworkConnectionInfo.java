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

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import netscope.internal.Nullable;

/** Describes the network connection of the device when the snapshot was taken. */
public final class NetworkConnectionInfo {
  public enum Reachability {
    YES,
    MAYBE,
    NO
  }

  public enum Interface {
    WIFI,
    WIRED_ETHERNET,
    CELLULAR,
    LOOPBACK,
    OTHER
  }

  public static Builder newBuilder(Reachability reachability) {
    return new Builder(reachability);
  }

  public static final class Builder {
    final Reachability reachability;
    final Set<Interface> availableInterfaces = EnumSet.noneOf(Interface.class);
    @Nullable Boolean supportsIPv4, supportsIPv6, isExpensive, isConstrained;

    Builder(Reachability reachability) {
      if (reachability == null) throw new NullPointerException("reachability == null");
      this.reachability = reachability;
    }

    public Builder addAvailableInterface(Interface availableInterface) {
      if (availableInterface == null) {
        throw new NullPointerException("availableInterface == null");
      }
      availableInterfaces.add(availableInterface);
      return this;
    }

    public Builder supportsIPv4(@Nullable Boolean supportsIPv4) {
      this.supportsIPv4 = supportsIPv4;
      return this;
    }

    public Builder supportsIPv6(@Nullable Boolean supportsIPv6) {
      this.supportsIPv6 = supportsIPv6;
      return this;
    }

    public Builder isExpensive(@Nullable Boolean isExpensive) {
      this.isExpensive = isExpensive;
      return this;
    }

    public Builder isConstrained(@Nullable Boolean isConstrained) {
      this.isConstrained = isConstrained;
      return this;
    }

    public NetworkConnectionInfo build() {
      return new NetworkConnectionInfo(this);
    }
  }

  final Reachability reachability;
  final Set<Interface> availableInterfaces;
  @Nullable final Boolean supportsIPv4, supportsIPv6, isExpensive, isConstrained;

  NetworkConnectionInfo(Builder builder) {
    this.reachability = builder.reachability;
    this.availableInterfaces = builder.availableInterfaces.isEmpty()
      ? Collections.<Interface>emptySet()
      : Collections.unmodifiableSet(EnumSet.copyOf(builder.availableInterfaces));
    this.supportsIPv4 = builder.supportsIPv4;
    this.supportsIPv6 = builder.supportsIPv6;
    this.isExpensive = builder.isExpensive;
    this.isConstrained = builder.isConstrained;
  }

  public Reachability reachability() {
    return reachability;
  }

  public Set<Interface> availableInterfaces() {
    return availableInterfaces;
  }

  /** Null when the platform can't tell. */
  @Nullable public Boolean supportsIPv4() {
    return supportsIPv4;
  }

  @Nullable public Boolean supportsIPv6() {
    return supportsIPv6;
  }

  @Nullable public Boolean isExpensive() {
    return isExpensive;
  }

  @Nullable public Boolean isConstrained() {
    return isConstrained;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof NetworkConnectionInfo)) return false;
    NetworkConnectionInfo that = (NetworkConnectionInfo) o;
    return reachability == that.reachability
      && availableInterfaces.equals(that.availableInterfaces)
      && UserInfo.equal(supportsIPv4, that.supportsIPv4)
      && UserInfo.equal(supportsIPv6, that.supportsIPv6)
      && UserInfo.equal(isExpensive, that.isExpensive)
      && UserInfo.equal(isConstrained, that.isConstrained);
  }

  @Override public int hashCode() {
    int h = 1000003;
    h ^= reachability.hashCode();
    h *= 1000003;
    h ^= availableInterfaces.hashCode();
    h *= 1000003;
    h ^= supportsIPv4 == null ? 0 : supportsIPv4.hashCode();
    h *= 1000003;
    h ^= supportsIPv6 == null ? 0 : supportsIPv6.hashCode();
    h *= 1000003;
    h ^= isExpensive == null ? 0 : isExpensive.hashCode();
    h *= 1000003;
    h ^= isConstrained == null ? 0 : isConstrained.hashCode();
    return h;
  }

  @Override public String toString() {
    return "NetworkConnectionInfo{reachability=" + reachability
      + ", availableInterfaces=" + availableInterfaces
      + ", supportsIPv4=" + supportsIPv4
      + ", supportsIPv6=" + supportsIPv6
      + ", isExpensive=" + isExpensive
      + ", isConstrained=" + isConstrained + "}";
  }
}
