// =================================================================================================
// Copyright 2011 Twitter, Inc.
// -------------------------------------------------------------------------------------------------
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this work except in compliance with the License.
// You may obtain a copy of the License in the LICENSE file, or at:
//
//  http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
// =================================================================================================

package com.twitter.muxpool.net;

import java.net.InetSocketAddress;
import java.net.URI;
import java.util.Locale;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;

/**
 * The {@code host:port} pair a pooled connection is dialed to.  Two requests share a connection
 * exactly when their authorities are equal.
 */
public final class Authority {

  private static final ImmutableMap<String, Integer> DEFAULT_PORTS = ImmutableMap.of(
      "https", 443,
      "wss", 443,
      "http", 80,
      "ws", 80);

  private final String host;
  private final int port;

  private Authority(String host, int port) {
    this.host = host;
    this.port = port;
  }

  /**
   * Creates an authority for the given host and port.
   *
   * @param host a non-empty host name or address literal, stored lower cased
   * @param port a port in the range [1, 65535]
   * @return the authority
   */
  public static Authority of(String host, int port) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(host), "A host is required");
    Preconditions.checkArgument(port > 0 && port <= 0xFFFF, "Invalid port: %s", port);
    // Host names are case-insensitive; one key per host.
    return new Authority(host.toLowerCase(Locale.ENGLISH), port);
  }

  /**
   * Extracts the authority of a request target.  When the URI has no explicit port the default
   * port of its scheme is used.
   *
   * @param target an absolute URI with a host
   * @return the authority the target should be dialed at
   * @throws IllegalArgumentException if the URI has no host, or neither an explicit port nor a
   *     scheme with a known default port
   */
  public static Authority fromUri(URI target) {
    Preconditions.checkNotNull(target);
    String host = target.getHost();
    Preconditions.checkArgument(!Strings.isNullOrEmpty(host), "No host in %s", target);

    int port = target.getPort();
    if (port == -1) {
      String scheme = Strings.nullToEmpty(target.getScheme()).toLowerCase(Locale.ENGLISH);
      Integer defaultPort = DEFAULT_PORTS.get(scheme);
      Preconditions.checkArgument(defaultPort != null,
          "No port in %s and no default port for scheme '%s'", target, scheme);
      port = defaultPort;
    }
    return of(host, port);
  }

  public String getHost() {
    return host;
  }

  public int getPort() {
    return port;
  }

  /**
   * Resolves this authority into a socket address.  A host that fails to resolve yields an
   * unresolved address, which sockets reject with an {@link java.net.UnknownHostException}.
   */
  public InetSocketAddress toSocketAddress() {
    return new InetSocketAddress(host, port);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Authority)) {
      return false;
    }
    Authority other = (Authority) obj;
    return port == other.port && host.equals(other.host);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(host, port);
  }

  @Override
  public String toString() {
    return host + ":" + port;
  }
}
