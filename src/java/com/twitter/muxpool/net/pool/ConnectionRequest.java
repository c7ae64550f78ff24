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

package com.twitter.muxpool.net.pool;

import java.net.URI;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

import com.twitter.muxpool.net.Authority;
import com.twitter.muxpool.quantity.Amount;
import com.twitter.muxpool.quantity.Time;

/**
 * Describes what a caller needs a connection for: the request target and how long it is willing
 * to wait for a socket to connect.
 */
public final class ConnectionRequest {

  /**
   * A connect timeout that waits indefinitely.
   */
  public static final Amount<Long, Time> NO_TIMEOUT = Amount.of(0L, Time.MILLISECONDS);

  private final URI target;
  private final Authority authority;
  private final Amount<Long, Time> connectTimeout;

  private ConnectionRequest(URI target, Amount<Long, Time> connectTimeout) {
    this.target = target;
    this.authority = Authority.fromUri(target);
    this.connectTimeout = connectTimeout;
  }

  /**
   * Creates a request for {@code target} without a connect timeout.
   */
  public static ConnectionRequest of(URI target) {
    return builder(target).build();
  }

  public static Builder builder(URI target) {
    return new Builder(target);
  }

  public URI getTarget() {
    return target;
  }

  /**
   * Returns the authority connections for this request are pooled under.
   */
  public Authority getAuthority() {
    return authority;
  }

  /**
   * Returns the connect timeout; a non-positive amount means no timeout.
   */
  public Amount<Long, Time> getConnectTimeout() {
    return connectTimeout;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("target", target)
        .add("connectTimeout", connectTimeout)
        .toString();
  }

  public static class Builder {
    private final URI target;
    private Amount<Long, Time> connectTimeout = NO_TIMEOUT;

    Builder(URI target) {
      this.target = Preconditions.checkNotNull(target);
    }

    /**
     * Sets how long to wait for the socket to the target, or to its proxy, to connect.
     *
     * @param connectTimeout the bound; non-positive waits indefinitely
     * @return A reference to the builder.
     */
    public Builder withConnectTimeout(Amount<Long, Time> connectTimeout) {
      this.connectTimeout = Preconditions.checkNotNull(connectTimeout);
      return this;
    }

    public ConnectionRequest build() {
      return new ConnectionRequest(target, connectTimeout);
    }
  }
}
