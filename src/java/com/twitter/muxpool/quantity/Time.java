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

package com.twitter.muxpool.quantity;

/**
 * Time units for {@link Amount}s of timeouts and delays.
 */
public enum Time implements Unit<Time> {
  NANOSECONDS(1, "ns"),
  MICROSECONDS(1000, NANOSECONDS, "us"),
  MILLISECONDS(1000, MICROSECONDS, "ms"),
  SECONDS(1000, MILLISECONDS, "secs"),
  MINUTES(60, SECONDS, "mins");

  private final double multiplier;
  private final String display;

  private Time(double multiplier, String display) {
    this.multiplier = multiplier;
    this.display = display;
  }

  private Time(double multiplier, Time base, String display) {
    this(multiplier * base.multiplier, display);
  }

  @Override
  public double multiplier() {
    return multiplier;
  }

  @Override
  public String toString() {
    return display;
  }
}
