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
package org.cnmaps.providers.geocode;

import java.util.Map;

import org.cnmaps.common.coordinate.Datum;

import com.google.common.collect.ImmutableMap;

/**
 * The reverse geocoding services, with the datum each one expects its query location in.
 * The fixed parameters exclude the location and any credentials.
 */
public enum GeocodeProvider {
  // GCJ-02 only, the location is written longitude first
  AMAP ("https://restapi.amap.com", "/v3/geocode/regeo", Datum.GCJ02, false,
        ImmutableMap.of("output", "json", "extensions", "all", "radius", "500", "roadlevel", "0")),
  // accepts WGS-84 when told so, the location is written latitude first
  BAIDU ("https://api.map.baidu.com", "/reverse_geocoding/v3", Datum.WGS84, true,
         ImmutableMap.of("coordtype", "wgs84ll", "extensions_poi", "1", "ret_coordtype", "gcj02ll", "output", "json"));

  private final String baseUrl;
  private final String path;
  private final Datum<?> datum;
  private final boolean latitudeFirst;
  private final Map<String, String> fixedParameters;

  GeocodeProvider(String baseUrl, String path, Datum<?> datum, boolean latitudeFirst,
                  Map<String, String> fixedParameters) {
    this.baseUrl = baseUrl;
    this.path = path;
    this.datum = datum;
    this.latitudeFirst = latitudeFirst;
    this.fixedParameters = fixedParameters;
  }

  public String getBaseUrl() {
    return baseUrl;
  }

  public String getPath() {
    return path;
  }

  public Datum<?> getDatum() {
    return datum;
  }

  public boolean isLatitudeFirst() {
    return latitudeFirst;
  }

  public Map<String, String> getFixedParameters() {
    return fixedParameters;
  }
}
