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
package org.cnmaps.common.projection;

import java.io.Serializable;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * An immutable planar position in Baidu Mercator (BD09MC) metres. There is no range restriction, values beyond
 * ±2×10⁷ occur near the antimeridian and at high latitudes.
 */
@Data
@AllArgsConstructor
public class MercatorPoint implements Serializable {
  private static final long serialVersionUID = -4391877452205473962L;

  private final double x;
  private final double y;
}
