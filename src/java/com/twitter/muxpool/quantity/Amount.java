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

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * An integral value in a unit system, used wherever this library accepts a timeout or delay so
 * callers never have to guess whether a bare {@code long} means seconds or milliseconds.
 * Instances are created via the static {@code of(...)} factories.
 *
 * @param <T> the type of number the amount value is expressed in
 * @param <U> the type of unit that this amount quantifies
 */
public abstract class Amount<T extends Number & Comparable<T>, U extends Unit<U>>
    implements Comparable<Amount<T, U>> {

  private final T value;
  private final U unit;

  private Amount(T value, U unit) {
    this.value = Preconditions.checkNotNull(value);
    this.unit = Preconditions.checkNotNull(unit);
  }

  public T getValue() {
    return value;
  }

  public U getUnit() {
    return unit;
  }

  /**
   * Converts this amount to the given unit, truncating any fractional part.
   */
  public T as(U otherUnit) {
    return unit.equals(otherUnit) ? value : scale(unit.multiplier() / otherUnit.multiplier());
  }

  protected abstract T scale(double multiplier);

  @Override
  public int hashCode() {
    return Objects.hashCode(value, unit);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Amount)) {
      return false;
    }
    Amount<?, ?> other = (Amount<?, ?>) obj;
    if (!value.getClass().isInstance(other.value) || !unit.getClass().isInstance(other.unit)) {
      return false;
    }
    @SuppressWarnings("unchecked")
    Amount<T, U> same = (Amount<T, U>) other;
    return compareTo(same) == 0;
  }

  @Override
  public int compareTo(Amount<T, U> other) {
    // Compare in the more precise unit so conversions never lose precision.
    if (other.unit.multiplier() > unit.multiplier()) {
      return value.compareTo(other.as(unit));
    } else {
      return as(other.unit).compareTo(other.value);
    }
  }

  @Override
  public String toString() {
    return value + " " + unit;
  }

  /**
   * Creates an amount that uses a {@code long} value.
   *
   * @param number the number of units the returned amount should quantify
   * @param unit the unit the returned amount is expressed in terms of
   * @param <U> the type of unit that the returned amount quantifies
   * @return an amount quantifying the given {@code number} of {@code unit}s
   */
  public static <U extends Unit<U>> Amount<Long, U> of(long number, U unit) {
    return new Amount<Long, U>(number, unit) {
      @Override protected Long scale(double multiplier) {
        return (long) (getValue() * multiplier);
      }
    };
  }

  /**
   * Creates an amount that uses an {@code int} value.
   */
  public static <U extends Unit<U>> Amount<Integer, U> of(int number, U unit) {
    return new Amount<Integer, U>(number, unit) {
      @Override protected Integer scale(double multiplier) {
        return (int) (getValue() * multiplier);
      }
    };
  }
}
