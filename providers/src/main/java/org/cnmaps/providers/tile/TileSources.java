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

import org.cnmaps.common.tile.TileAddress;
import org.cnmaps.common.tile.TileAddressConverter;
import org.cnmaps.providers.ProvidersConfiguration;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import lombok.extern.slf4j.Slf4j;

/**
 * Resolves the tile source a client asks for and builds the upstream URL for a standard, WGS-84 indexed tile.
 * This class is threadsafe.
 */
@Slf4j
public class TileSources {

  private final TileSource defaultSource;
  private final TileAddressConverter converter;
  private final boolean shiftBaiduTiles;

  public TileSources(ProvidersConfiguration configuration) {
    TileSource configured = TileSource.fromName(configuration.getDefaultSource());
    Preconditions.checkArgument(configured != null, "Unknown default tile source: %s",
                                configuration.getDefaultSource());
    this.defaultSource = configured;
    this.converter = new TileAddressConverter(configuration.newTransformer(), configuration.isCheckChina());
    this.shiftBaiduTiles = configuration.isShiftBaiduTiles();
  }

  public TileSource getDefaultSource() {
    return defaultSource;
  }

  /**
   * @param requested the source name the client asked for, possibly null
   * @return the named source, or the default one when the name is blank or unknown
   */
  public TileSource resolve(String requested) {
    if (Strings.isNullOrEmpty(requested) || requested.trim().isEmpty()) {
      return defaultSource;
    }
    TileSource source = TileSource.fromName(requested);
    if (source == null) {
      log.debug("Unknown tile source [{}], using {}", requested, defaultSource.getDisplayName());
      return defaultSource;
    }
    return source;
  }

  /**
   * Converts the standard tile into the address the source expects. Tiles of sources with their own grid are shifted
   * into the source's datum first when so configured.
   */
  public TileAddress remap(TileSource source, TileAddress wgsTile) {
    if (shiftBaiduTiles && !source.getScheme().isStandardGrid()) {
      return converter.wgsToBdShifted(wgsTile);
    }
    return TileAddressConverter.toScheme(wgsTile, source.getScheme());
  }

  /**
   * Builds the URL of the source's tile covering the standard tile. The subdomain is picked from the remapped column
   * and row, so repeated requests for the same tile go to the same host.
   */
  public String tileUrl(TileSource source, TileAddress wgsTile) {
    TileAddress remapped = remap(source, wgsTile);
    String url = source.getUrlTemplate()
      .replace("{s}", subdomain(source, remapped))
      .replace("{z}", String.valueOf(remapped.getZoom()))
      .replace("{x}", String.valueOf(remapped.getX()))
      .replace("{y}", String.valueOf(remapped.getY()));
    log.debug("Tile {} from {} is {}", wgsTile, source.getDisplayName(), url);
    return url;
  }

  /**
   * Resolves the source by name, then builds the URL.
   *
   * @throws IllegalArgumentException if the zoom is outside [0, 62]
   */
  public String tileUrl(String requested, int zoom, long x, long y) {
    return tileUrl(resolve(requested), new TileAddress(zoom, x, y));
  }

  private static String subdomain(TileSource source, TileAddress tile) {
    List<String> subdomains = source.getSubdomains();
    if (subdomains.isEmpty()) {
      return "";
    }
    return subdomains.get((int) Math.floorMod(tile.getX() + tile.getY(), (long) subdomains.size()));
  }
}
