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

import java.util.function.Function;

import org.cnmaps.common.coordinate.Coordinate;
import org.cnmaps.common.coordinate.Datum;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Inverts a forward transform by fixed-point iteration (Cai Jun, 2014).
 * <p>
 * Starting from an approximate inverse, the forward transform is applied to the current estimate, and the difference
 * between the result and the target is subtracted from the estimate. When the iteration cap is reached without
 * meeting the tolerance the last estimate is returned as is; the shortfall is only reported in the debug log.
 * This class is threadsafe.
 */
class FixedPointInverter {
  private static final Logger LOG = LoggerFactory.getLogger(FixedPointInverter.class);

  private final IterationPolicy policy;

  FixedPointInverter(IterationPolicy policy) {
    this.policy = policy;
  }

  /**
   * @param forward the transform to invert
   * @param initial the first estimate, usually the one-step approximate inverse of the target
   * @param target  the value the forward transform should produce
   * @return the best estimate found within the policy
   */
  <S extends Datum.Tag, T extends Datum.Tag> Coordinate<S> invert(Function<Coordinate<S>, Coordinate<T>> forward,
                                                                  Coordinate<S> initial, Coordinate<T> target) {
    Coordinate<S> current = initial;
    double residual = Double.NaN;
    for (int i = 0; i < policy.getMaxIterations(); i++) {
      Coordinate<T> projected = forward.apply(current);
      double dLat = projected.getLat() - target.getLat();
      double dLon = projected.getLon() - target.getLon();

      residual = Math.max(Math.abs(dLat), Math.abs(dLon));
      if (residual <= policy.getTolerance()) {
        if (LOG.isTraceEnabled()) {
          LOG.trace("Converged on {} after {} iterations, residual {}°", target, i, residual);
        }
        return current;
      }
      current = current.offset(-dLat, -dLon);
    }

    LOG.debug("No convergence on {} within {} iterations, last residual {}°, returning {}",
              target, policy.getMaxIterations(), residual, current);
    return current;
  }
}
