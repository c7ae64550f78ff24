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

package com.twitter.muxpool.util.testing;

import java.util.concurrent.TimeUnit;

import com.google.common.base.Preconditions;

import com.twitter.muxpool.quantity.Amount;
import com.twitter.muxpool.quantity.Time;
import com.twitter.muxpool.util.Clock;

/**
 * A clock for use in testing whose time only moves when told to.
 */
public class FakeClock implements Clock {
  // Tests may need to use the clock from multiple threads, ensure liveness.
  private volatile long nowNanos;

  /**
   * Advances the current time by {@code period}.
   *
   * @param period the amount of time to advance the current time by
   */
  public void advance(Amount<Long, Time> period) {
    Preconditions.checkNotNull(period);
    long newNanos = nowNanos + period.as(Time.NANOSECONDS);
    Preconditions.checkArgument(newNanos >= 0,
        "invalid period %s - would move current time to a negative value: %sns", period, newNanos);
    nowNanos = newNanos;
  }

  /**
   * Shorthand for advancing by {@code millis} milliseconds.
   */
  public void advanceMillis(long millis) {
    advance(Amount.of(millis, Time.MILLISECONDS));
  }

  @Override
  public long nowMillis() {
    return TimeUnit.NANOSECONDS.toMillis(nowNanos);
  }

  @Override
  public long nowNanos() {
    return nowNanos;
  }
}
