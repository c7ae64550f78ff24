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

import com.google.common.base.Preconditions;

import com.twitter.muxpool.quantity.Amount;
import com.twitter.muxpool.quantity.Time;

/**
 * Converts timeout amounts to the {@code int} millisecond form {@link java.net.Socket} expects.
 */
public final class SocketTimeouts {

  private SocketTimeouts() {
    // Utility.
  }

  /**
   * Returns the timeout in milliseconds, where {@code 0} means wait indefinitely.  Non-positive
   * amounts map to {@code 0}; amounts beyond {@code Integer.MAX_VALUE} ms are clamped.
   *
   * @param timeout the timeout amount
   * @return a timeout suitable for {@code Socket.connect} and {@code Socket.setSoTimeout}
   */
  public static int toMillis(Amount<Long, Time> timeout) {
    Preconditions.checkNotNull(timeout);
    long timeoutMs = timeout.as(Time.MILLISECONDS);
    if (timeoutMs <= 0) {
      return 0;
    }
    return (int) Math.min(timeoutMs, Integer.MAX_VALUE);
  }
}
