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

/**
 * The last view event the resource tracking pipeline produced. Attached to out-of-band artifacts,
 * such as crash reports, so they can be associated with what the user was looking at.
 */
public final class ViewEvent {
  public static ViewEvent create(String viewId, @Nullable String name, String url,
    long timestampMicros) {
    return create(viewId, name, url, timestampMicros, Collections.emptyMap());
  }

  public static ViewEvent create(String viewId, @Nullable String name, String url,
    long timestampMicros, Map<String, ?> attributes) {
    if (viewId == null) throw new NullPointerException("viewId == null");
    if (url == null) throw new NullPointerException("url == null");
    if (attributes == null) throw new NullPointerException("attributes == null");
    Map<String, Object> copy = new LinkedHashMap<>(attributes);
    return new ViewEvent(viewId, name, url, timestampMicros, Collections.unmodifiableMap(copy));
  }

  final String viewId, url;
  @Nullable final String name;
  final long timestampMicros;
  final Map<String, Object> attributes;

  ViewEvent(String viewId, @Nullable String name, String url, long timestampMicros,
    Map<String, Object> attributes) {
    this.viewId = viewId;
    this.name = name;
    this.url = url;
    this.timestampMicros = timestampMicros;
    this.attributes = attributes;
  }

  public String viewId() {
    return viewId;
  }

  @Nullable public String name() {
    return name;
  }

  public String url() {
    return url;
  }

  /** Epoch microseconds of the event. */
  public long timestampMicros() {
    return timestampMicros;
  }

  public Map<String, Object> attributes() {
    return attributes;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof ViewEvent)) return false;
    ViewEvent that = (ViewEvent) o;
    return viewId.equals(that.viewId) && UserInfo.equal(name, that.name)
      && url.equals(that.url) && timestampMicros == that.timestampMicros
      && attributes.equals(that.attributes);
  }

  @Override public int hashCode() {
    int h = 1000003;
    h ^= viewId.hashCode();
    h *= 1000003;
    h ^= name == null ? 0 : name.hashCode();
    h *= 1000003;
    h ^= url.hashCode();
    h *= 1000003;
    h ^= (int) (timestampMicros ^ (timestampMicros >>> 32));
    h *= 1000003;
    h ^= attributes.hashCode();
    return h;
  }

  @Override public String toString() {
    return "ViewEvent{viewId=" + viewId + ", name=" + name + ", url=" + url
      + ", timestampMicros=" + timestampMicros + ", attributes=" + attributes + "}";
  }
}
