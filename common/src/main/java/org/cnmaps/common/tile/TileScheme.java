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

/**
 * Describes how a provider arranges and numbers its tiles.
 */
public enum TileScheme {
  /** Slippy map tiles, origin at the north-west corner of the Web Mercator square, rows counted southwards. */
  WEB_MERCATOR (true),
  /** As {@link #WEB_MERCATOR} with rows counted northwards from the south edge. */
  TMS (true),
  /** Baidu's tiles over BD09MC, origin at (0°, 0°), rows counted northwards, 256 px at the zoom 18 resolution. */
  BAIDU (false);

  private final boolean standardGrid;

  TileScheme(boolean standardGrid) {
    this.standardGrid = standardGrid;
  }

  /**
   * True if tiles are cut from the Web Mercator square shared by WGS-84 and GCJ-02 maps.
   */
  public boolean isStandardGrid() {
    return standardGrid;
  }

  @Override
  public String toString() {
    return String.format("%s; %s grid", name(), standardGrid ? "standard" : "own");
  }
}
