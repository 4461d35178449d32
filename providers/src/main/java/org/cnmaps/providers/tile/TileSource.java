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
package org.cnmaps.providers.tile;

import java.util.List;

import org.cnmaps.common.coordinate.Datum;
import org.cnmaps.common.tile.TileScheme;

import com.google.common.collect.ImmutableList;

/**
 * The raster tile providers, with the datum their imagery is drawn in and the tile scheme their URLs are addressed by.
 * URL templates use the placeholders {@code {s}}, {@code {z}}, {@code {x}} and {@code {y}}.
 */
public enum TileSource {
  AMAP ("Amap", Datum.GCJ02, TileScheme.WEB_MERCATOR,
        "https://webrd0{s}.is.autonavi.com/appmaptile?z={z}&x={x}&y={y}&lang=zh_cn&size=1&scale=1&style=7",
        "1", "2", "3", "4"),
  BAIDU ("Baidu", Datum.BD09, TileScheme.BAIDU,
         "https://maponline{s}.bdimg.com/tile/?qt=vtile&z={z}&x={x}&y={y}&styles=pl&scaler=1",
         "0", "1", "2", "3"),
  GOOGLE ("Google", Datum.GCJ02, TileScheme.WEB_MERCATOR,
          "https://mt{s}.google.com/vt/?lyrs=m&hl=zh&gl=cn&z={z}&x={x}&y={y}",
          "0", "1", "2", "3"),
  OPENSTREETMAP ("OpenStreetMap", Datum.WGS84, TileScheme.WEB_MERCATOR,
                 "https://{s}.tile.osm.org/{z}/{x}/{y}.png",
                 "a", "b", "c"),
  // rows are counted from the south
  TENCENT ("Tencent", Datum.GCJ02, TileScheme.TMS,
           "https://rt{s}.map.gtimg.com/tile?z={z}&x={x}&y={y}&type=vector&styleid=1",
           "0", "1", "2", "3");

  private final String displayName;
  private final Datum<?> datum;
  private final TileScheme scheme;
  private final String urlTemplate;
  private final List<String> subdomains;

  TileSource(String displayName, Datum<?> datum, TileScheme scheme, String urlTemplate, String... subdomains) {
    this.displayName = displayName;
    this.datum = datum;
    this.scheme = scheme;
    this.urlTemplate = urlTemplate;
    this.subdomains = ImmutableList.copyOf(subdomains);
  }

  /**
   * @return the source with the given display name, ignoring case, or null if there is none
   */
  public static TileSource fromName(String name) {
    if (name == null) {
      return null;
    }
    for (TileSource source : values()) {
      if (source.displayName.equalsIgnoreCase(name.trim())) {
        return source;
      }
    }
    return null;
  }

  public String getDisplayName() {
    return displayName;
  }

  public Datum<?> getDatum() {
    return datum;
  }

  public TileScheme getScheme() {
    return scheme;
  }

  public String getUrlTemplate() {
    return urlTemplate;
  }

  public List<String> getSubdomains() {
    return subdomains;
  }

  @Override
  public String toString() {
    return String.format("%s (%s, %s)", displayName, datum, scheme);
  }
}
