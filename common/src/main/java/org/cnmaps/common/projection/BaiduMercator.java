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
package org.cnmaps.common.projection;

import org.cnmaps.common.coordinate.Coordinate;
import org.cnmaps.common.coordinate.Datum.Bd09;

import static java.lang.Math.abs;

/**
 * Baidu's own Mercator-like projection between BD-09 longitude/latitude and BD09MC metres.
 * <p>
 * This is not Web Mercator. The projection is approximated piecewise: the magnitude of the latitude (or of the
 * Mercator northing for the inverse) selects a band, and each band maps the absolute value of the input through a
 * sixth degree polynomial, evaluated in Horner form, with a linear term for the easting. Signs are restored
 * afterwards, so the projection is symmetric about the equator and the prime meridian, and (0, 0) maps exactly to
 * (0, 0).
 * <p>
 * The coefficient tables are those published with Baidu's JavaScript API and must be kept bit for bit; rounding any of
 * them breaks sub-metre round trips.
 * This class is threadsafe.
 */
public class BaiduMercator {

  /** Lower bounds of the northing bands used by the inverse, in metres. */
  private static final double[] MC_BAND = {12890594.86, 8362377.87, 5591021, 3481989.83, 1678043.12, 0};

  /** Lower bounds of the latitude bands used by the forward projection, in degrees. */
  private static final double[] LL_BAND = {75, 60, 45, 30, 15, 0};

  private static final double[][] MC2LL = {
    {1.410526172116255e-8, 0.00000898305509648872, -1.9939833816331, 200.9824383106796, -187.2403703815547,
      91.6087516669843, -23.38765649603339, 2.57121317296198, -0.03801003308653, 17337981.2},
    {-7.435856389565537e-9, 0.000008983055097726239, -0.78625201886289, 96.32687599759846, -1.85204757529826,
      -59.36935905485877, 47.40033549296737, -16.50741931063887, 2.28786674699375, 10260144.86},
    {-3.030883460898826e-8, 0.00000898305509983578, 0.30071316287616, 59.74293618442277, 7.357984074871,
      -25.38371002664745, 13.45380521110908, -3.29883767235584, 0.32710905363475, 6856817.37},
    {-1.981981304930552e-8, 0.000008983055099779535, 0.03278182852591, 40.31678527705744, 0.65659298677277,
      -4.44255534477492, 0.85341911805263, 0.12923347998204, -0.04625736007561, 4482777.06},
    {3.09191371068437e-9, 0.000008983055096812155, 0.00006995724062, 23.10934304144901, -0.00023663490511,
      -0.6321817810242, -0.00663494467273, 0.03430082397953, -0.00466043876332, 2555164.4},
    {2.890871144776878e-9, 0.000008983055095805407, -3.068298e-8, 7.47137025468032, -0.00000353937994,
      -0.02145144861037, -0.00001234426596, 0.00010322952773, -0.00000323890364, 826088.5}
  };

  private static final double[][] LL2MC = {
    {-0.0015702102444, 111320.7020616939, 1704480524535203d, -10338987376042340d, 26112667856603880d,
      -35149669176653700d, 26595700718403920d, -10725012454188240d, 1800819912950474d, 82.5},
    {0.0008277824516172526, 111320.7020463578, 647795574.6671607, -4082003173.641316, 10774905663.51142,
      -15171875531.51559, 12053065338.62167, -5124939663.577472, 913311935.9512032, 67.5},
    {0.00337398766765, 111320.7020202162, 4481351.045890365, -23393751.19931662, 79682215.47186455,
      -115964993.2797253, 97236711.15602145, -43661946.33752821, 8477230.501135234, 52.5},
    {0.00220636496208, 111320.7020209128, 51751.86112841131, 3796837.749470245, 992013.7397791013,
      -1221952.21711287, 1340652.697009075, -620943.6990984312, 144416.9293806241, 37.5},
    {-0.0003441963504368392, 111320.7020576856, 278.2353980772752, 2485758.690035394, 6070.750963243378,
      54821.18345352118, 9540.606633304236, -2710.55326746645, 1405.483844121726, 22.5},
    {-0.0003218135878613132, 111320.7020701615, 0.00369383431289, 823725.6402795718, 0.46104986909093,
      2351.343141331292, 1.58060784298199, 8.77738589078284, 0.37238884252424, 7.45}
  };

  private BaiduMercator() {}

  /**
   * Projects a BD-09 position onto BD09MC.
   *
   * @param lon BD-09 longitude
   * @param lat BD-09 latitude
   * @return the planar position in metres
   */
  public static MercatorPoint llToMc(double lon, double lat) {
    double[] point = convert(lon, lat, LL2MC[band(LL_BAND, abs(lat))]);
    return new MercatorPoint(point[0], point[1]);
  }

  public static MercatorPoint llToMc(Coordinate<Bd09> bd) {
    return llToMc(bd.getLon(), bd.getLat());
  }

  /**
   * Inverse of {@link #llToMc(double, double)}.
   *
   * @param x easting in metres
   * @param y northing in metres
   * @return the BD-09 coordinate
   */
  public static Coordinate<Bd09> mcToLl(double x, double y) {
    double[] point = convert(x, y, MC2LL[band(MC_BAND, abs(y))]);
    return Coordinate.bd09(point[1], point[0]);
  }

  public static Coordinate<Bd09> mcToLl(MercatorPoint mc) {
    return mcToLl(mc.getX(), mc.getY());
  }

  private static int band(double[] lowerBounds, double value) {
    for (int i = 0; i < lowerBounds.length; i++) {
      if (value >= lowerBounds[i]) {
        return i;
      }
    }
    // NaN only
    return lowerBounds.length - 1;
  }

  /*
   * c[0] + c[1]·|x| gives the first axis; c[2..8] are the polynomial in |y| / c[9] giving the second.
   */
  private static double[] convert(double x, double y, double[] c) {
    double first = c[0] + c[1] * abs(x);

    double s = abs(y) / c[9];
    double second = c[8];
    for (int k = 7; k >= 2; k--) {
      second = second * s + c[k];
    }

    return new double[] {signed(first, x), signed(second, y)};
  }

  private static double signed(double magnitude, double sign) {
    if (sign > 0) {
      return magnitude;
    } else if (sign < 0) {
      return -magnitude;
    }
    return 0;
  }
}
