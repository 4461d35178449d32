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
package org.cnmaps.common.tile;

import org.cnmaps.common.coordinate.Coordinate;
import org.cnmaps.common.coordinate.Datum;
import org.cnmaps.common.coordinate.Datum.Bd09;
import org.cnmaps.common.coordinate.Datum.Wgs84;
import org.cnmaps.common.datum.CoordinateTransformer;
import org.cnmaps.common.projection.BaiduMercator;
import org.cnmaps.common.projection.MercatorPoint;

import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.lang.Math.PI;
import static java.lang.Math.abs;
import static java.lang.Math.atan;
import static java.lang.Math.floor;
import static java.lang.Math.log;
import static java.lang.Math.pow;
import static java.lang.Math.sinh;
import static java.lang.Math.sqrt;
import static java.lang.Math.tan;
import static java.lang.Math.toDegrees;
import static java.lang.Math.toRadians;

/**
 * Converts between coordinates and tile addresses, and between the tile addresses of the different
 * {@link TileScheme}s.
 * <p>
 * WGS-84 and GCJ-02 maps share the standard Web Mercator grid; only the imagery differs, so converting a tile address
 * between those two datums is the identity. Baidu tiles are cut from BD09MC at a resolution of
 * 2<sup>zoom - 18</sup> metres per pixel. {@link #wgsToBd(int, long, long)} projects the tile corner into that grid
 * as it is, while {@link #wgsToBdShifted(int, long, long)} first moves it into BD-09, gated on the China bounding box
 * as configured.
 * This class is threadsafe.
 */
public class TileAddressConverter {
  private static final Logger LOG = LoggerFactory.getLogger(TileAddressConverter.class);

  public static final int TILE_SIZE = 256;

  // The zoom at which one Baidu pixel is one BD09MC metre
  static final int BAIDU_REFERENCE_ZOOM = 18;

  private final CoordinateTransformer transformer;
  private final boolean checkChina;

  public TileAddressConverter() {
    this(new CoordinateTransformer(), true);
  }

  public TileAddressConverter(CoordinateTransformer transformer) {
    this(transformer, true);
  }

  /**
   * @param transformer the datum transforms used by the shifted conversions
   * @param checkChina  whether the shifted conversions leave coordinates outside China unchanged by GCJ-02
   */
  public TileAddressConverter(CoordinateTransformer transformer, boolean checkChina) {
    this.transformer = transformer;
    this.checkChina = checkChina;
  }

  /**
   * Provides the standard slippy map tile containing the coordinate. The poles and the antimeridian fall on the edge
   * tiles of the pyramid.
   *
   * @param zoom       the zoom level
   * @param coordinate a WGS-84 or GCJ-02 coordinate
   * @return the tile address, within [0, 2<sup>zoom</sup>) on both axes
   */
  public static TileAddress coordToTile(int zoom, Coordinate<? extends Datum.StandardGrid> coordinate) {
    TileAddress tile = slippyTile(zoom, coordinate.getLat(), coordinate.getLon());
    long max = (1L << zoom) - 1;
    return new TileAddress(zoom, Math.min(Math.max(tile.getX(), 0), max), Math.min(Math.max(tile.getY(), 0), max));
  }

  // unbounded, so points projected from far outside the pyramid keep their position
  private static TileAddress slippyTile(int zoom, double lat, double lon) {
    checkZoom(zoom);
    double n = pow(2, zoom);
    double latRad = toRadians(lat);

    long x = (long) floor((lon + 180) / 360 * n);
    long y = (long) floor((1 - asinh(tan(latRad)) / PI) / 2 * n);
    return new TileAddress(zoom, x, y);
  }

  /**
   * @return the north-west corner of the standard tile
   */
  public static Coordinate<Wgs84> tileToCoord(int zoom, long x, long y) {
    checkZoom(zoom);
    double n = pow(2, zoom);
    double lon = x / n * 360 - 180;
    double lat = toDegrees(atan(sinh(PI * (1 - 2 * y / n))));
    return Coordinate.wgs84(lat, lon);
  }

  public static Coordinate<Wgs84> tileToCoord(TileAddress tile) {
    return tileToCoord(tile.getZoom(), tile.getX(), tile.getY());
  }

  /**
   * Returns the envelope of the standard tile, from its north-west corner and that of its south-east neighbour.
   */
  public static BoundingBox tileToBbox(int zoom, long x, long y) {
    Coordinate<Wgs84> northWest = tileToCoord(zoom, x, y);
    Coordinate<Wgs84> southEast = tileToCoord(zoom, x + 1, y + 1);
    return new BoundingBox(northWest.getLon(), southEast.getLat(), southEast.getLon(), northWest.getLat());
  }

  /**
   * Flips a row between the slippy map and TMS numbering; the operation is its own inverse.
   */
  public static long tmsConvertY(int zoom, long y) {
    checkZoom(zoom);
    return ((1L << zoom) - 1) - y;
  }

  /**
   * Identity: GCJ-02 maps use the WGS-84 tile grid.
   */
  public static TileAddress wgsToGcj(int zoom, long x, long y) {
    checkZoom(zoom);
    return new TileAddress(zoom, x, y);
  }

  /**
   * Identity: GCJ-02 maps use the WGS-84 tile grid.
   */
  public static TileAddress gcjToWgs(int zoom, long x, long y) {
    checkZoom(zoom);
    return new TileAddress(zoom, x, y);
  }

  /**
   * Finds the Baidu tile holding the north-west corner of the standard tile. The corner is projected into BD09MC
   * without a datum shift.
   */
  public static TileAddress wgsToBd(int zoom, long x, long y) {
    Coordinate<Wgs84> corner = tileToCoord(zoom, x, y);
    TileAddress baidu = baiduCoordToTile(zoom, Coordinate.bd09(corner.getLat(), corner.getLon()));
    if (LOG.isTraceEnabled()) {
      LOG.trace("WGS-84 tile {}/{}/{} is Baidu tile {}", zoom, x, y, baidu);
    }
    return baidu;
  }

  public static TileAddress wgsToBd(TileAddress tile) {
    return wgsToBd(tile.getZoom(), tile.getX(), tile.getY());
  }

  /**
   * Finds the standard tile holding the origin corner of the Baidu tile, without a datum shift. Baidu tiles beyond
   * the Web Mercator square give indices outside the pyramid.
   */
  public static TileAddress bdToWgs(int zoom, long x, long y) {
    Coordinate<Bd09> corner = baiduTileToCoord(zoom, x, y);
    return slippyTile(zoom, corner.getLat(), corner.getLon());
  }

  public static TileAddress bdToWgs(TileAddress tile) {
    return bdToWgs(tile.getZoom(), tile.getX(), tile.getY());
  }

  /**
   * As {@link #wgsToBd(int, long, long)}, with the corner moved from WGS-84 into BD-09 before the projection.
   */
  public TileAddress wgsToBdShifted(int zoom, long x, long y) {
    Coordinate<Bd09> corner = transformer.wgsToBd(tileToCoord(zoom, x, y), checkChina);
    TileAddress baidu = baiduCoordToTile(zoom, corner);
    if (LOG.isTraceEnabled()) {
      LOG.trace("WGS-84 tile {}/{}/{} is shifted Baidu tile {}", zoom, x, y, baidu);
    }
    return baidu;
  }

  public TileAddress wgsToBdShifted(TileAddress tile) {
    return wgsToBdShifted(tile.getZoom(), tile.getX(), tile.getY());
  }

  /**
   * As {@link #bdToWgs(int, long, long)}, with the corner moved from BD-09 back to WGS-84 before the tiling.
   */
  public TileAddress bdToWgsShifted(int zoom, long x, long y) {
    Coordinate<Wgs84> corner = transformer.bdToWgs(baiduTileToCoord(zoom, x, y), checkChina);
    return slippyTile(zoom, corner.getLat(), corner.getLon());
  }

  public TileAddress bdToWgsShifted(TileAddress tile) {
    return bdToWgsShifted(tile.getZoom(), tile.getX(), tile.getY());
  }

  /**
   * Converts a WGS-84 indexed standard tile into the address a provider using the given scheme expects.
   *
   * @param tile   the standard tile, WGS-84 indexed
   * @param scheme the scheme of the provider
   * @return the tile address in the provider's scheme
   */
  public static TileAddress toScheme(TileAddress tile, TileScheme scheme) {
    switch (scheme) {
      case BAIDU:
        return wgsToBd(tile);
      case TMS:
        return new TileAddress(tile.getZoom(), tile.getX(), tmsConvertY(tile.getZoom(), tile.getY()));
      case WEB_MERCATOR:
      default:
        return wgsToGcj(tile.getZoom(), tile.getX(), tile.getY());
    }
  }

  /**
   * Provides the Baidu tile containing the BD-09 coordinate. Low zooms and the western or southern hemispheres give
   * negative indices, as the Baidu origin is at (0°, 0°).
   */
  public static TileAddress baiduCoordToTile(int zoom, Coordinate<Bd09> coordinate) {
    checkZoom(zoom);
    MercatorPoint mc = BaiduMercator.llToMc(coordinate);
    double resolution = pow(2, zoom - BAIDU_REFERENCE_ZOOM);

    long x = (long) floor(mc.getX() * resolution / TILE_SIZE);
    long y = (long) floor(mc.getY() * resolution / TILE_SIZE);
    return new TileAddress(zoom, x, y);
  }

  /**
   * @return the BD-09 coordinate of the origin corner (south-west in the northern hemisphere) of the Baidu tile
   */
  public static Coordinate<Bd09> baiduTileToCoord(int zoom, long x, long y) {
    checkZoom(zoom);
    double resolution = pow(2, zoom - BAIDU_REFERENCE_ZOOM);
    return BaiduMercator.mcToLl(x * TILE_SIZE / resolution, y * TILE_SIZE / resolution);
  }

  private static void checkZoom(int zoom) {
    Preconditions.checkArgument(zoom >= 0 && zoom < 63, "Zoom must be within [0, 62]: %s", zoom);
  }

  private static double asinh(double value) {
    double a = abs(value);
    return Math.copySign(log(a + sqrt(a * a + 1)), value);
  }
}
