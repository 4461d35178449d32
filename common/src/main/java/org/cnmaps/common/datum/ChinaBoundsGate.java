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

/**
 * A coarse bounding box around China used to decide whether the GCJ-02 obfuscation applies at all.
 * <p>
 * This is deliberately a rectangle, not the national border: points in the sea or in neighbouring countries inside
 * the box are treated as Chinese. Map data outside China is never obfuscated, so coordinates outside the box pass
 * through the transforms unchanged.
 */
public class ChinaBoundsGate {

  public static final double MIN_LATITUDE = 0.8293;
  public static final double MAX_LATITUDE = 55.8271;
  public static final double MIN_LONGITUDE = 72.004;
  public static final double MAX_LONGITUDE = 137.8347;

  private ChinaBoundsGate() {}

  /**
   * @return true if the coordinate falls within the box, edges included
   */
  public static boolean sanityInChina(Coordinate<?> coordinate) {
    return coordinate.getLat() >= MIN_LATITUDE && coordinate.getLat() <= MAX_LATITUDE
           && coordinate.getLon() >= MIN_LONGITUDE && coordinate.getLon() <= MAX_LONGITUDE;
  }
}
