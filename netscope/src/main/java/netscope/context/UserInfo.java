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
import java.util.LinkedHashMap;
import java.util.Map;
import netscope.internal.Nullable;

/** Identifies the user of the application, as set by the application. All fields are optional. */
public final class UserInfo {
  public static final UserInfo EMPTY = new UserInfo(null, null, null, Collections.emptyMap());

  public static UserInfo create(@Nullable String id, @Nullable String name, @Nullable String email) {
    return create(id, name, email, Collections.emptyMap());
  }

  public static UserInfo create(@Nullable String id, @Nullable String name, @Nullable String email,
    Map<String, ?> extraInfo) {
    if (extraInfo == null) throw new NullPointerException("extraInfo == null");
    Map<String, Object> copy = new LinkedHashMap<>(extraInfo);
    return new UserInfo(id, name, email, Collections.unmodifiableMap(copy));
  }

  @Nullable final String id, name, email;
  final Map<String, Object> extraInfo;

  UserInfo(@Nullable String id, @Nullable String name, @Nullable String email,
    Map<String, Object> extraInfo) {
    this.id = id;
    this.name = name;
    this.email = email;
    this.extraInfo = extraInfo;
  }

  @Nullable public String id() {
    return id;
  }

  @Nullable public String name() {
    return name;
  }

  @Nullable public String email() {
    return email;
  }

  /** Custom attributes of the user. Never null. */
  public Map<String, Object> extraInfo() {
    return extraInfo;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof UserInfo)) return false;
    UserInfo that = (UserInfo) o;
    return equal(id, that.id) && equal(name, that.name) && equal(email, that.email)
      && extraInfo.equals(that.extraInfo);
  }

  @Override public int hashCode() {
    int h = 1000003;
    h ^= id == null ? 0 : id.hashCode();
    h *= 1000003;
    h ^= name == null ? 0 : name.hashCode();
    h *= 1000003;
    h ^= email == null ? 0 : email.hashCode();
    h *= 1000003;
    h ^= extraInfo.hashCode();
    return h;
  }

  @Override public String toString() {
    return "UserInfo{id=" + id + ", name=" + name + ", email=" + email
      + ", extraInfo=" + extraInfo + "}";
  }

  static boolean equal(@Nullable Object a, @Nullable Object b) {
    return a == null ? b == null : a.equals(b);
  }
}
