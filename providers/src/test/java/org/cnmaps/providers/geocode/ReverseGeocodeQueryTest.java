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
import java.util.Optional;

import org.cnmaps.common.coordinate.Coordinate;
import org.cnmaps.common.coordinate.Coordinates;
import org.cnmaps.common.coordinate.Datum;
import org.cnmaps.providers.ProvidersConfiguration;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

public class ReverseGeocodeQueryTest {

  @Test
  public void testAmap() {
    ReverseGeocodeQuery query = ReverseGeocodeQuery.prepare(GeocodeProvider.AMAP, 39.907354, 116.39122).get();

    assertEquals(Datum.GCJ02, query.getLocation().getDatum());
    assertEquals("116.397461,39.908755", query.getLocationParameter());
    assertEquals("all", query.getParameters().get("extensions"));
    assertEquals("500", query.getParameters().get("radius"));
    assertEquals(Coordinate.wgs84(39.907354, 116.39122), query.getOrigin());
    assertEquals(Coordinates.hash(Coordinate.wgs84(39.907354, 116.39122)), query.getLocationId());
  }

  @Test
  public void testBaidu() {
    ReverseGeocodeQuery query = ReverseGeocodeQuery.prepare(GeocodeProvider.BAIDU, "39.907354", "116.39122").get();

    assertEquals(Datum.WGS84, query.getLocation().getDatum());
    assertEquals("39.907354,116.391220", query.getLocationParameter());
    assertEquals("wgs84ll", query.getParameters().get("coordtype"));
    assertEquals("gcj02ll", query.getParameters().get("ret_coordtype"));
  }

  @Test
  public void testEndpoint() {
    assertEquals("https://restapi.amap.com/v3/geocode/regeo",
                 ReverseGeocodeQuery.prepare(GeocodeProvider.AMAP, 39.907354, 116.39122).get().getEndpoint());
    assertEquals("https://api.map.baidu.com/reverse_geocoding/v3",
                 ReverseGeocodeQuery.prepare(GeocodeProvider.BAIDU, 39.907354, 116.39122).get().getEndpoint());
  }

  @Test
  public void testSameLocationSameId() {
    ReverseGeocodeQuery amap = ReverseGeocodeQuery.prepare(GeocodeProvider.AMAP, 39.9073541, 116.3912204).get();
    ReverseGeocodeQuery baidu = ReverseGeocodeQuery.prepare(GeocodeProvider.BAIDU,
                                                             new BigDecimal("39.907354"),
                                                             new BigDecimal("116.39122")).get();
    assertEquals(amap.getOrigin(), baidu.getOrigin());
    assertEquals(amap.getLocationId(), baidu.getLocationId());
  }

  @Test
  public void testAmapOutsideChina() {
    ReverseGeocodeQuery query = ReverseGeocodeQuery.prepare(GeocodeProvider.AMAP, 37.7749, -122.4194).get();
    assertEquals("-122.419400,37.774900", query.getLocationParameter());
  }

  @Test
  public void testConfiguredGateAndPrecision() {
    ProvidersConfiguration config = ProvidersConfiguration.builder().checkChina(false).formatPrecision(5).build();

    ReverseGeocodeQuery amap = ReverseGeocodeQuery.prepare(GeocodeProvider.AMAP, 37.7749, -122.4194, config).get();
    assertNotEquals("-122.41940,37.77490", amap.getLocationParameter());

    ReverseGeocodeQuery baidu = ReverseGeocodeQuery.prepare(GeocodeProvider.BAIDU, 39.907354, 116.39122, config).get();
    assertEquals("39.90735,116.39122", baidu.getLocationParameter());
  }

  @Test
  public void testInvalidInput() {
    assertFalse(ReverseGeocodeQuery.prepare(GeocodeProvider.AMAP, "abc", "116.39").isPresent());
    assertFalse(ReverseGeocodeQuery.prepare(GeocodeProvider.AMAP, 39, 116.39).isPresent());
    assertFalse(ReverseGeocodeQuery.prepare(GeocodeProvider.BAIDU, 91.0, 116.39).isPresent());
    assertFalse(ReverseGeocodeQuery.prepare(GeocodeProvider.BAIDU, null, null).isPresent());
  }

  @Test
  public void testParametersAreComplete() {
    Optional<ReverseGeocodeQuery> query = ReverseGeocodeQuery.prepare(GeocodeProvider.BAIDU, 31.2304, 121.4737);
    assertTrue(query.isPresent());
    assertEquals(5, query.get().getParameters().size());
    assertTrue(query.get().getParameters().containsKey(ReverseGeocodeQuery.LOCATION));
  }
}
