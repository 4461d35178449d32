/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.cnmaps.common.coordinate;

import java.math.BigDecimal;
import java.math.RoundingMode;

import com.google.common.base.Preconditions;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

/**
 * Rendering and fingerprinting of coordinates for callers which expose them outside the engine.
 */
public class Coordinates {

  /** Decimal places kept by {@link #format(Coordinate)}, roughly 0.1 m. */
  public static final int DEFAULT_PRECISION = 6;

  private static final HashFunction FINGERPRINT = Hashing.murmur3_32_fixed();

  private Coordinates() {}

  /**
   * Rounds both axes half-up to {@value #DEFAULT_PRECISION} decimal places.
   */
  public static <D extends Datum.Tag> Coordinate<D> format(Coordinate<D> coordinate) {
    return format(coordinate, DEFAULT_PRECISION);
  }

  /**
   * Rounds both axes half-up to the given number of decimal places.
   *
   * @param coordinate to round
   * @param precision  decimal places to keep, not negative
   * @return a coordinate of the same datum
   */
  public static <D extends Datum.Tag> Coordinate<D> format(Coordinate<D> coordinate, int precision) {
    Preconditions.checkArgument(precision >= 0, "Precision must not be negative: %s", precision);
    return Coordinate.of(coordinate.getDatum(),
                         round(coordinate.getLat(), precision),
                         round(coordinate.getLon(), precision));
  }

  /**
   * A deterministic, non-cryptographic 32 bit fingerprint of the latitude and longitude, stable across JVMs and
   * restarts. Used as a synthetic location identifier, so callers usually {@link #format} first.
   *
   * @return the unsigned 32 bit hash
   */
  public static long hash(Coordinate<?> coordinate) {
    return FINGERPRINT.newHasher()
      .putDouble(coordinate.getLat())
      .putDouble(coordinate.getLon())
      .hash()
      .padToLong();
  }

  private static double round(double value, int precision) {
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      return value;
    }
    return BigDecimal.valueOf(value).setScale(precision, RoundingMode.HALF_UP).doubleValue();
  }
}
