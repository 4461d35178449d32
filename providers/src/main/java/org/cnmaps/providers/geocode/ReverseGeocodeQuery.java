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

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import java.util.Optional;

import org.cnmaps.common.coordinate.Coordinate;
import org.cnmaps.common.coordinate.CoordinateNormalizer;
import org.cnmaps.common.coordinate.Coordinates;
import org.cnmaps.common.coordinate.Datum;
import org.cnmaps.common.coordinate.Datum.Wgs84;
import org.cnmaps.common.datum.CoordinateTransformer;
import org.cnmaps.providers.ProvidersConfiguration;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * A reverse geocoding request ready to be sent: the caller's position converted to the provider's datum and
 * rendered the way the provider reads it, together with the synthetic identifier of the location.
 */
@Data
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Slf4j
public class ReverseGeocodeQuery {

  public static final String LOCATION = "location";

  @NonNull
  private final GeocodeProvider provider;
  // rounded to the configured precision
  @NonNull
  private final Coordinate<Wgs84> origin;
  @NonNull
  private final Coordinate<?> location;
  private final long locationId;
  @NonNull
  private final Map<String, String> parameters;

  /**
   * Prepares a query with the default settings: China gate on, 6 decimal places.
   *
   * @param provider the geocoding service
   * @param lat      the raw WGS-84 latitude, in any form {@link CoordinateNormalizer} accepts
   * @param lon      the raw WGS-84 longitude
   * @return the query, or empty if the raw values are unusable
   */
  public static Optional<ReverseGeocodeQuery> prepare(GeocodeProvider provider, Object lat, Object lon) {
    return prepare(provider, lat, lon, ProvidersConfiguration.builder().build());
  }

  public static Optional<ReverseGeocodeQuery> prepare(GeocodeProvider provider, Object lat, Object lon,
                                                      ProvidersConfiguration configuration) {
    Optional<Coordinate<Wgs84>> normalized = CoordinateNormalizer.normalize(lat, lon);
    if (!normalized.isPresent()) {
      log.debug("Cannot geocode invalid coordinates [{}, {}]", lat, lon);
      return Optional.empty();
    }

    int precision = configuration.getFormatPrecision();
    Coordinate<Wgs84> origin = Coordinates.format(normalized.get(), precision);
    Coordinate<?> location = Coordinates.format(toProviderDatum(provider, normalized.get(), configuration), precision);

    Map<String, String> parameters = ImmutableMap.<String, String>builder()
      .put(LOCATION, render(location, provider.isLatitudeFirst(), precision))
      .putAll(provider.getFixedParameters())
      .build();

    return Optional.of(new ReverseGeocodeQuery(provider, origin, location, Coordinates.hash(origin), parameters));
  }

  public String getLocationParameter() {
    return parameters.get(LOCATION);
  }

  /**
   * @return the URL the query parameters are sent to
   */
  public String getEndpoint() {
    return provider.getBaseUrl() + provider.getPath();
  }

  private static Coordinate<?> toProviderDatum(GeocodeProvider provider, Coordinate<Wgs84> wgs,
                                               ProvidersConfiguration configuration) {
    if (Datum.GCJ02.equals(provider.getDatum())) {
      CoordinateTransformer transformer = configuration.newTransformer();
      return transformer.wgsToGcj(wgs, configuration.isCheckChina());
    }
    Preconditions.checkState(Datum.WGS84.equals(provider.getDatum()), "No query datum for %s", provider);
    return wgs;
  }

  private static String render(Coordinate<?> coordinate, boolean latitudeFirst, int precision) {
    String lat = plain(coordinate.getLat(), precision);
    String lon = plain(coordinate.getLon(), precision);
    return latitudeFirst ? lat + "," + lon : lon + "," + lat;
  }

  private static String plain(double value, int precision) {
    return BigDecimal.valueOf(value).setScale(precision, RoundingMode.HALF_UP).toPlainString();
  }
}
