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

import java.util.Locale;
import netscope.internal.Nullable;

/** What a resource is used for, as far as can be told from the request and response. */
public enum ResourceKind {
  XHR,
  IMAGE,
  MEDIA,
  FONT,
  CSS,
  JS,
  NATIVE;

  /**
   * Requests that carry data to the server are {@link #XHR}. Otherwise the kind is derived from
   * the response content type, defaulting to {@link #NATIVE}.
   *
   * @param contentType the response content type, without parameters, or null if unknown
   */
  public static ResourceKind of(String method, @Nullable String contentType) {
    if (method == null) throw new NullPointerException("method == null");
    switch (method.toUpperCase(Locale.ROOT)) {
      case "POST":
      case "PUT":
      case "DELETE":
        return XHR;
      default:
        break;
    }
    if (contentType == null) return NATIVE;
    String mimeType = contentType.trim().toLowerCase(Locale.ROOT);
    int slash = mimeType.indexOf('/');
    if (slash == -1) return NATIVE;
    String type = mimeType.substring(0, slash), subtype = mimeType.substring(slash + 1);
    if (type.equals("image")) return IMAGE;
    if (type.equals("video") || type.equals("audio")) return MEDIA;
    if (type.equals("font") || subtype.startsWith("font-") || subtype.startsWith("x-font-")) {
      return FONT;
    }
    if (mimeType.equals("text/css")) return CSS;
    if (subtype.equals("javascript") || subtype.equals("x-javascript")) return JS;
    return NATIVE;
  }
}
