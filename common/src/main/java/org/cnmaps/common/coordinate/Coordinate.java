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

import java.io.Serializable;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NonNull;

import org.cnmaps.common.coordinate.Datum.Bd09;
import org.cnmaps.common.coordinate.Datum.Gcj02;
import org.cnmaps.common.coordinate.Datum.Wgs84;

/**
 * An immutable latitude and longitude in decimal degrees, tagged with the datum it is expressed in.
 * Every transformation returns a new instance.
 *
 * @param <D> the datum tag
 */
@Data
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Coordinate<D extends Datum.Tag> implements Serializable {
  private static final long serialVersionUID = 7953186650326520474L;

  @NonNull
  private final Datum<D> datum;
  private final double lat;
  private final double lon;

  public static <D extends Datum.Tag> Coordinate<D> of(Datum<D> datum, double lat, double lon) {
    return new Coordinate<>(datum, lat, lon);
  }

  public static Coordinate<Wgs84> wgs84(double lat, double lon) {
    return new Coordinate<>(Datum.WGS84, lat, lon);
  }

  public static Coordinate<Gcj02> gcj02(double lat, double lon) {
    return new Coordinate<>(Datum.GCJ02, lat, lon);
  }

  public static Coordinate<Bd09> bd09(double lat, double lon) {
    return new Coordinate<>(Datum.BD09, lat, lon);
  }

  /**
   * @return a coordinate in the same datum moved by the given number of degrees
   */
  public Coordinate<D> offset(double dLat, double dLon) {
    return new Coordinate<>(datum, lat + dLat, lon + dLon);
  }

  /**
   * @return true if the latitude is within [-90, 90] and the longitude within [-180, 180], inclusive
   */
  public boolean isInRange() {
    return lat >= -90 && lat <= 90 && lon >= -180 && lon <= 180;
  }
}
