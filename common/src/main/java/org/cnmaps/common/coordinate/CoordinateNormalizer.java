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
import java.math.BigInteger;
import java.util.Optional;
import java.util.regex.Pattern;

import org.cnmaps.common.coordinate.Datum.Wgs84;

/**
 * Parses caller supplied latitude and longitude values into a validated {@link Coordinate}.
 * <p>
 * Both values must share the same representation: floating point numbers, integral numbers, {@link BigDecimal}s or
 * text. Text must be a plain decimal number, optionally in scientific notation, without surrounding whitespace. The
 * latitude must lie within [-90, 90] and the longitude within [-180, 180], bounds included.
 * <p>
 * Invalid input never raises an exception, it results in an empty {@link Optional}.
 * This class is threadsafe.
 */
public final class CoordinateNormalizer {

  private static final Pattern DECIMAL = Pattern.compile("[+-]?\\d+(\\.\\d+)?([eE][+-]?\\d+)?");

  private enum Kind {
    FLOATING, INTEGRAL, DECIMAL, TEXT, UNSUPPORTED
  }

  private CoordinateNormalizer() {}

  /**
   * Normalizes the raw values into a WGS-84 coordinate.
   *
   * @param lat the raw latitude
   * @param lon the raw longitude
   * @return the coordinate, or empty if either value is unusable or out of range
   */
  public static Optional<Coordinate<Wgs84>> normalize(Object lat, Object lon) {
    return normalize(Datum.WGS84, lat, lon);
  }

  /**
   * Normalizes the raw values into a coordinate of the given datum.
   *
   * @param datum the datum the caller knows the values to be in
   * @param lat   the raw latitude
   * @param lon   the raw longitude
   * @return the coordinate, or empty if either value is unusable or out of range
   */
  public static <D extends Datum.Tag> Optional<Coordinate<D>> normalize(Datum<D> datum, Object lat, Object lon) {
    Kind kind = kindOf(lat);
    if (kind == Kind.UNSUPPORTED || kind != kindOf(lon)) {
      return Optional.empty();
    }

    Double latitude = toDouble(kind, lat);
    Double longitude = toDouble(kind, lon);
    if (latitude == null || longitude == null) {
      return Optional.empty();
    }

    Coordinate<D> coordinate = Coordinate.of(datum, latitude, longitude);
    return coordinate.isInRange() ? Optional.of(coordinate) : Optional.empty();
  }

  private static Kind kindOf(Object value) {
    if (value instanceof Double || value instanceof Float) {
      return Kind.FLOATING;
    } else if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte
               || value instanceof BigInteger) {
      return Kind.INTEGRAL;
    } else if (value instanceof BigDecimal) {
      return Kind.DECIMAL;
    } else if (value instanceof CharSequence) {
      return Kind.TEXT;
    }
    return Kind.UNSUPPORTED;
  }

  private static Double toDouble(Kind kind, Object value) {
    switch (kind) {
      case TEXT:
        String text = value.toString();
        return DECIMAL.matcher(text).matches() ? Double.valueOf(text) : null;
      case DECIMAL:
      case FLOATING:
      case INTEGRAL:
        return ((Number) value).doubleValue();
      default:
        return null;
    }
  }
}
