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
package org.cnmaps.common.datum;

import org.cnmaps.common.coordinate.Coordinate;
import org.cnmaps.common.coordinate.Datum.Bd09;
import org.cnmaps.common.coordinate.Datum.Gcj02;
import org.cnmaps.common.coordinate.Datum.Wgs84;

import static java.lang.Math.PI;
import static java.lang.Math.abs;
import static java.lang.Math.atan2;
import static java.lang.Math.cos;
import static java.lang.Math.pow;
import static java.lang.Math.sin;
import static java.lang.Math.sqrt;

/**
 * Transforms coordinates between WGS-84, GCJ-02 and BD-09.
 * <p>
 * WGS-84 to GCJ-02 applies the empirical distortion polynomials, expressed in metres and converted to degrees on the
 * Krasovsky 1940 ellipsoid. GCJ-02 to BD-09 is a small polar perturbation plus a fixed offset. Neither has a closed
 * form inverse in the GCJ-02 case, so two flavours of reverse transform are offered:
 * <ul>
 *   <li>the plain one, a single step approximation with an error of one to two metres;</li>
 *   <li>the {@code Precise} one, which refines that approximation by fixed-point iteration bounded by the
 *   {@link IterationPolicy}.</li>
 * </ul>
 * Whenever {@code checkChina} is true and the coordinate lies outside the {@link ChinaBoundsGate}, the GCJ-02 step is
 * the identity, as real map data outside China is not obfuscated. The BD-09 step always applies.
 * <p>
 * Based on the PRCoords work by Mingye Wang (Artoria2e5).
 * This class is threadsafe.
 */
public class CoordinateTransformer {

  // Krasovsky 1940
  static final double GCJ_A = 6_378_245;
  static final double GCJ_EE = 0.00669342162296594323; // f = 1/298.3; e^2 = 2f - f^2

  // Baidu's artificial offsets
  static final double BD_DLAT = 0.0060;
  static final double BD_DLON = 0.0065;

  private final FixedPointInverter inverter;

  public CoordinateTransformer() {
    this(IterationPolicy.DEFAULT);
  }

  public CoordinateTransformer(IterationPolicy policy) {
    this.inverter = new FixedPointInverter(policy);
  }

  public Coordinate<Gcj02> wgsToGcj(Coordinate<Wgs84> wgs) {
    return wgsToGcj(wgs, true);
  }

  /**
   * @param wgs        to transform
   * @param checkChina if true, coordinates outside the China box are returned unchanged
   * @return the GCJ-02 coordinate
   */
  public Coordinate<Gcj02> wgsToGcj(Coordinate<Wgs84> wgs, boolean checkChina) {
    double lat = wgs.getLat();
    double lon = wgs.getLon();
    if (checkChina && !ChinaBoundsGate.sanityInChina(wgs)) {
      return Coordinate.gcj02(lat, lon);
    }

    double x = lon - 105;
    double y = lat - 35;

    double radLat = lat / 180 * PI;
    double magic = 1 - GCJ_EE * pow(sin(radLat), 2);

    // length of one degree along the meridian and along the parallel, in metres
    double latDegArcLength = PI / 180 * (GCJ_A * (1 - GCJ_EE)) / pow(magic, 1.5);
    double lonDegArcLength = PI / 180 * (GCJ_A * cos(radLat) / sqrt(magic));

    return Coordinate.gcj02(lat + latDistortion(x, y) / latDegArcLength,
                            lon + lonDistortion(x, y) / lonDegArcLength);
  }

  public Coordinate<Wgs84> gcjToWgs(Coordinate<Gcj02> gcj) {
    return gcjToWgs(gcj, true);
  }

  /**
   * Single step approximate inverse of {@link #wgsToGcj(Coordinate, boolean)}: the distortion found at the GCJ-02
   * position is subtracted from it.
   */
  public Coordinate<Wgs84> gcjToWgs(Coordinate<Gcj02> gcj, boolean checkChina) {
    Coordinate<Gcj02> shifted = wgsToGcj(Coordinate.wgs84(gcj.getLat(), gcj.getLon()), checkChina);
    return Coordinate.wgs84(gcj.getLat() - (shifted.getLat() - gcj.getLat()),
                            gcj.getLon() - (shifted.getLon() - gcj.getLon()));
  }

  public Coordinate<Bd09> gcjToBd(Coordinate<Gcj02> gcj) {
    double x = gcj.getLon();
    double y = gcj.getLat();

    double r = sqrt(x * x + y * y) + 0.00002 * sin(y * PI * 3000 / 180);
    double theta = atan2(y, x) + 0.000003 * cos(x * PI * 3000 / 180);

    return Coordinate.bd09(r * sin(theta) + BD_DLAT, r * cos(theta) + BD_DLON);
  }

  public Coordinate<Gcj02> bdToGcj(Coordinate<Bd09> bd) {
    double x = bd.getLon() - BD_DLON;
    double y = bd.getLat() - BD_DLAT;

    double r = sqrt(x * x + y * y) - 0.00002 * sin(y * PI * 3000 / 180);
    double theta = atan2(y, x) - 0.000003 * cos(x * PI * 3000 / 180);

    return Coordinate.gcj02(r * sin(theta), r * cos(theta));
  }

  public Coordinate<Wgs84> bdToWgs(Coordinate<Bd09> bd) {
    return bdToWgs(bd, true);
  }

  public Coordinate<Wgs84> bdToWgs(Coordinate<Bd09> bd, boolean checkChina) {
    return gcjToWgs(bdToGcj(bd), checkChina);
  }

  public Coordinate<Bd09> wgsToBd(Coordinate<Wgs84> wgs) {
    return wgsToBd(wgs, true);
  }

  public Coordinate<Bd09> wgsToBd(Coordinate<Wgs84> wgs, boolean checkChina) {
    return gcjToBd(wgsToGcj(wgs, checkChina));
  }

  public Coordinate<Wgs84> gcjToWgsPrecise(Coordinate<Gcj02> gcj) {
    return gcjToWgsPrecise(gcj, true);
  }

  public Coordinate<Wgs84> gcjToWgsPrecise(Coordinate<Gcj02> gcj, boolean checkChina) {
    return inverter.invert(wgs -> wgsToGcj(wgs, checkChina), gcjToWgs(gcj, checkChina), gcj);
  }

  public Coordinate<Gcj02> bdToGcjPrecise(Coordinate<Bd09> bd) {
    return inverter.invert(this::gcjToBd, bdToGcj(bd), bd);
  }

  public Coordinate<Wgs84> bdToWgsPrecise(Coordinate<Bd09> bd) {
    return bdToWgsPrecise(bd, true);
  }

  public Coordinate<Wgs84> bdToWgsPrecise(Coordinate<Bd09> bd, boolean checkChina) {
    return inverter.invert(wgs -> wgsToBd(wgs, checkChina), bdToWgs(bd, checkChina), bd);
  }

  /*
   * The distortion functions take (x = lon - 105, y = lat - 35) and return arc lengths in metres. The table of terms is
   * fixed by the GCJ-02 algorithm and must not be altered.
   */
  static double latDistortion(double x, double y) {
    return -100 + 2 * x + 3 * y + 0.2 * y * y + 0.1 * x * y
           + 0.2 * sqrt(abs(x))
           + (2 * sin(x * 6 * PI) + 2 * sin(x * 2 * PI)
              + 2 * sin(y * PI) + 4 * sin(y / 3 * PI)
              + 16 * sin(y / 12 * PI) + 32 * sin(y / 30 * PI)) * 20 / 3;
  }

  static double lonDistortion(double x, double y) {
    return 300 + x + 2 * y + 0.1 * x * x + 0.1 * x * y
           + 0.1 * sqrt(abs(x))
           + (2 * sin(x * 6 * PI) + 2 * sin(x * 2 * PI)
              + 2 * sin(x * PI) + 4 * sin(x / 3 * PI)
              + 15 * sin(x / 12 * PI) + 30 * sin(x / 30 * PI)) * 20 / 3;
  }
}
