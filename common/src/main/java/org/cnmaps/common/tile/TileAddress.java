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

import java.io.Serializable;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * An immutable tile address within a tile pyramid. For the standard schemes {@code 0 ≤ x, y < 2^zoom}; Baidu's scheme
 * has its origin at (0°, 0°) so negative columns and rows are normal there.
 */
@Data
@AllArgsConstructor
public class TileAddress implements Serializable {
  private static final long serialVersionUID = 2867411956312072315L;

  private final int zoom;
  private final long x;
  private final long y;

  @Override
  public String toString() {
    return zoom + "/" + x + "/" + y;
  }
}
