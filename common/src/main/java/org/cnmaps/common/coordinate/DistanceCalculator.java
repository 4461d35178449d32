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

import static java.lang.Math.asin;
import static java.lang.Math.cos;
import static java.lang.Math.pow;
import static java.lang.Math.sin;
import static java.lang.Math.sqrt;
import static java.lang.Math.toRadians;

/**
 * Great-circle distance on a spherical Earth using the haversine formula, which stays numerically stable for the
 * short distances of interest when comparing transformation accuracy.
 * <p>
 * Coordinates of different datums may be compared, which is how the residual of a transform against a known truth is
 * measured.
 */
public class DistanceCalculator {

  /** Mean Earth radius in metres. */
  public static final double EARTH_RADIUS = 6_371_000;

  private DistanceCalculator() {}

  /**
   * @return the distance between the two coordinates in metres
   */
  public static double distance(Coordinate<?> a, Coordinate<?> b) {
    double lat1 = toRadians(a.getLat());
    double lat2 = toRadians(b.getLat());
    double dLat = toRadians(a.getLat() - b.getLat());
    double dLon = toRadians(a.getLon() - b.getLon());

    double h = haversine(dLat) + cos(lat1) * cos(lat2) * haversine(dLon);
    return 2 * EARTH_RADIUS * asin(sqrt(h));
  }

  private static double haversine(double theta) {
    return pow(sin(theta / 2), 2);
  }
}
