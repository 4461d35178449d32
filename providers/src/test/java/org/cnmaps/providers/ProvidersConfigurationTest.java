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
package org.cnmaps.providers;

import java.io.IOException;

import org.cnmaps.common.datum.IterationPolicy;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class ProvidersConfigurationTest {

  @Test
  public void testLoadDefaultFile() throws IOException {
    ProvidersConfiguration config = ProvidersConfiguration.load();
    assertEquals("OpenStreetMap", config.getDefaultSource());
    assertTrue(config.isCheckChina());
    assertEquals(6, config.getFormatPrecision());
    assertFalse(config.isShiftBaiduTiles());
    assertEquals(IterationPolicy.DEFAULT, config.getIterationPolicy());
  }

  @Test
  public void testBuildFromFile() throws IOException {
    ProvidersConfiguration config = ProvidersConfiguration.build("cnmaps-test.yml");
    assertEquals("baidu", config.getDefaultSource());
    assertFalse(config.isCheckChina());
    assertEquals(5, config.getFormatPrecision());
    assertTrue(config.isShiftBaiduTiles());
    assertEquals(new IterationPolicy(1.0e-9, 20), config.getIterationPolicy());
  }

  @Test
  public void testBuilderDefaults() {
    ProvidersConfiguration config = ProvidersConfiguration.builder().build();
    assertEquals("OpenStreetMap", config.getDefaultSource());
    assertTrue(config.isCheckChina());
    assertEquals(6, config.getFormatPrecision());
    assertEquals(IterationPolicy.DEFAULT, config.getIterationPolicy());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMissingFile() throws IOException {
    ProvidersConfiguration.build("no-such-file.yml");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnusableTolerance() {
    ProvidersConfiguration.builder()
      .precise(ProvidersConfiguration.PreciseConfiguration.builder().tolerance(0).build())
      .build()
      .getIterationPolicy();
  }
}
