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
package org.cnmaps.common.coordinate;

import java.io.Serializable;

/**
 * A geodetic datum in which a {@link Coordinate} is expressed.
 * <p>
 * The type parameter is a phantom tag which lets the compiler reject a GCJ-02 coordinate where a WGS-84 one is
 * expected. Only the three constants exist; the tag classes are never instantiated.
 *
 * @param <D> the tag identifying the datum
 */
public final class Datum<D extends Datum.Tag> implements Serializable {
  private static final long serialVersionUID = -2230461357418622816L;

  /** Marker for all datum tags. */
  public interface Tag {}

  /**
   * Marker for the datums which share the standard Web Mercator tile grid. Their tiles are indexed identically and
   * differ only in the rendered content.
   */
  public interface StandardGrid extends Tag {}

  /** The global datum used by GPS. */
  public static final class Wgs84 implements StandardGrid {
    private Wgs84() {}
  }

  /** The obfuscated datum required for maps published in China, a.k.a. "Mars coordinates". */
  public static final class Gcj02 implements StandardGrid {
    private Gcj02() {}
  }

  /** Baidu's datum, a further obfuscation of GCJ-02. */
  public static final class Bd09 implements Tag {
    private Bd09() {}
  }

  public static final Datum<Wgs84> WGS84 = new Datum<>("WGS-84");
  public static final Datum<Gcj02> GCJ02 = new Datum<>("GCJ-02");
  public static final Datum<Bd09> BD09 = new Datum<>("BD-09");

  private final String name;

  private Datum(String name) {
    this.name = name;
  }

  public String getName() {
    return name;
  }

  /**
   * Creates a coordinate in this datum.
   */
  public Coordinate<D> at(double lat, double lon) {
    return Coordinate.of(this, lat, lon);
  }

  // keeps the constants singletons across serialization
  private Object readResolve() {
    switch (name) {
      case "WGS-84": return WGS84;
      case "GCJ-02": return GCJ02;
      default: return BD09;
    }
  }

  @Override
  public String toString() {
    return name;
  }
}
