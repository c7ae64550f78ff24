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

package com.twitter.muxpool.util;

/**
 * An abstraction of the system clock, so idle bookkeeping can be driven by fake time in tests.
 */
public interface Clock {

  /**
   * A clock that returns the actual time reported by the system.
   */
  Clock SYSTEM_CLOCK = new Clock() {
    @Override public long nowMillis() {
      return System.currentTimeMillis();
    }

    @Override public long nowNanos() {
      return System.nanoTime();
    }

    @Override public String toString() {
      return "SYSTEM_CLOCK";
    }
  };

  /**
   * Returns the current time in milliseconds since the epoch.
   *
   * @see System#currentTimeMillis()
   */
  long nowMillis();

  /**
   * Returns the current time in nanoseconds.  Should be used only for relative timing.
   *
   * @see System#nanoTime()
   */
  long nowNanos();
}
