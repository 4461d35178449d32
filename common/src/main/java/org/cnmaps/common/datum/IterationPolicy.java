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
package org.cnmaps.common.datum;

import java.io.Serializable;

import com.google.common.base.Preconditions;
import lombok.Data;

/**
 * Bounds the fixed-point iteration used by the precise inverse transforms: the loop stops as soon as the residual on
 * both axes is within the tolerance, or after the iteration cap, whichever comes first.
 */
@Data
public class IterationPolicy implements Serializable {
  private static final long serialVersionUID = -6146937542310227185L;

  public static final double DEFAULT_TOLERANCE = 1.0e-5;
  public static final int DEFAULT_MAX_ITERATIONS = 10;

  public static final IterationPolicy DEFAULT = new IterationPolicy(DEFAULT_TOLERANCE, DEFAULT_MAX_ITERATIONS);

  // degrees
  private final double tolerance;
  private final int maxIterations;

  public IterationPolicy(double tolerance, int maxIterations) {
    Preconditions.checkArgument(tolerance > 0, "Tolerance must be positive: %s", tolerance);
    Preconditions.checkArgument(maxIterations >= 0, "Iteration cap must not be negative: %s", maxIterations);
    this.tolerance = tolerance;
    this.maxIterations = maxIterations;
  }
}
