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

import java.io.IOException;

import javax.annotation.Nullable;

/**
 * Indicates an HTTP proxy refused or failed to set up a {@code CONNECT} tunnel.
 */
public class ProxyTunnelException extends IOException {
  @Nullable private final String statusLine;

  /**
   * Creates an exception for a proxy that answered the {@code CONNECT} with a non-200 status.
   *
   * @param proxy the proxy that refused the tunnel
   * @param statusLine the status line the proxy replied with
   */
  public ProxyTunnelException(ProxyTarget proxy, String statusLine) {
    super("Proxy " + proxy + " refused tunnel: " + statusLine);
    this.statusLine = statusLine;
  }

  /**
   * Creates an exception for a proxy connection that failed before a status line was read.
   */
  public ProxyTunnelException(String message, @Nullable Throwable cause) {
    super(message, cause);
    this.statusLine = null;
  }

  /**
   * Returns the status line the proxy answered with, or {@code null} if none was read.
   */
  @Nullable
  public String getStatusLine() {
    return statusLine;
  }
}
