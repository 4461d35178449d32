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

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;

import org.cnmaps.common.coordinate.Datum.Gcj02;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class CoordinatesTest {

  @Test
  public void testFormat() {
    Coordinate<Gcj02> gcj = Coordinate.gcj02(39.123456789, 116.987654321);

    assertEquals(Coordinate.gcj02(39.123, 116.988), Coordinates.format(gcj, 3));
    assertEquals(Coordinate.gcj02(39.123457, 116.987654), Coordinates.format(gcj));
    assertEquals(Coordinate.gcj02(39.0, 117.0), Coordinates.format(gcj, 0));
    assertEquals(Coordinate.wgs84(-37.775, -122.419), Coordinates.format(Coordinate.wgs84(-37.7749, -122.4194), 3));
    assertSame(Datum.GCJ02, Coordinates.format(gcj).getDatum());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testFormatNegativePrecision() {
    Coordinates.format(Coordinate.wgs84(1, 2), -1);
  }

  @Test
  public void testHash() {
    long hash = Coordinates.hash(Coordinate.wgs84(39.1234, 116.5678));

    assertEquals(hash, Coordinates.hash(Coordinate.wgs84(39.1234, 116.5678)));
    assertNotEquals(hash, Coordinates.hash(Coordinate.wgs84(39.1235, 116.5678)));
    assertNotEquals(hash, Coordinates.hash(Coordinate.wgs84(116.5678, 39.1234)));
    assertTrue("Unsigned 32 bit expected: " + hash, hash >= 0 && hash <= 0xFFFFFFFFL);

    // the fingerprint covers the position only
    assertEquals(hash, Coordinates.hash(Coordinate.bd09(39.1234, 116.5678)));
  }

  @Test
  public void testEquality() {
    assertEquals(Coordinate.wgs84(39.9, 116.4), Datum.WGS84.at(39.9, 116.4));
    assertNotEquals(Coordinate.wgs84(39.9, 116.4), Coordinate.gcj02(39.9, 116.4));
    assertEquals(Coordinate.wgs84(40.0, 117.0), Coordinate.wgs84(39.9, 116.4).offset(0.1, 0.6).offset(0, 0));
  }

  @Test
  public void testSerializationKeepsDatumSingleton() throws Exception {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
      out.writeObject(Coordinate.gcj02(39.9, 116.4));
    }

    try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(bytes.toByteArray()))) {
      Coordinate<?> read = (Coordinate<?>) in.readObject();
      assertSame(Datum.GCJ02, read.getDatum());
      assertEquals(Coordinate.gcj02(39.9, 116.4), read);
    }
  }
}
