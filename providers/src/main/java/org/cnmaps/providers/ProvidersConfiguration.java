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
import java.net.URL;

import org.cnmaps.common.datum.CoordinateTransformer;
import org.cnmaps.common.datum.IterationPolicy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.google.common.io.Resources;

import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;
import lombok.extern.slf4j.Slf4j;

/**
 * Settings shared by the tile sources and the geocoding query preparation, read from a YAML file on the classpath.
 */
@Data
@Builder
@Jacksonized
@Slf4j
public class ProvidersConfiguration {

  /** The file read by {@link #load()}. */
  public static final String DEFAULT_FILE = "cnmaps.yml";

  @Builder.Default
  private String defaultSource = "OpenStreetMap";
  @Builder.Default
  private boolean checkChina = true;
  @Builder.Default
  private int formatPrecision = 6;
  // move WGS-84 tile corners into BD-09 before finding the Baidu tile
  @Builder.Default
  private boolean shiftBaiduTiles = false;
  @Builder.Default
  private PreciseConfiguration precise = PreciseConfiguration.builder().build();

  @Data
  @Builder
  @Jacksonized
  public static class PreciseConfiguration {
    @Builder.Default
    private double tolerance = IterationPolicy.DEFAULT_TOLERANCE;
    @Builder.Default
    private int maxIterations = IterationPolicy.DEFAULT_MAX_ITERATIONS;
  }

  public static ProvidersConfiguration load() throws IOException {
    return build(DEFAULT_FILE);
  }

  /** Pass in the filename relative to the classpath, e.g. "cnmaps.yml" */
  public static ProvidersConfiguration build(String filename) throws IOException {
    URL conf = Resources.getResource(filename);
    log.info("Reading from {}", conf);
    return new ObjectMapper(new YAMLFactory()).readValue(conf, ProvidersConfiguration.class);
  }

  /**
   * @throws IllegalArgumentException if the configured tolerance or iteration cap is unusable
   */
  public IterationPolicy getIterationPolicy() {
    return new IterationPolicy(precise.tolerance, precise.maxIterations);
  }

  public CoordinateTransformer newTransformer() {
    return new CoordinateTransformer(getIterationPolicy());
  }
}
