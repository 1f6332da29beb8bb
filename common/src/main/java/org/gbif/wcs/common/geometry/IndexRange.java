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
package org.gbif.wcs.common.geometry;

import java.io.Serializable;

import com.google.common.base.Preconditions;
import lombok.EqualsAndHashCode;

/**
 * A half-open range of array indexes {@code [start, stop)} with a step, either end of which may be left open by
 * supplying null.  Negative ends count back from the end of the axis they are applied to.
 */
@EqualsAndHashCode
public class IndexRange implements Serializable {
  private static final long serialVersionUID = -3051761840126452310L;

  public static final IndexRange ALL = new IndexRange(null, null, 1);

  private final Integer start;
  private final Integer stop;
  private final int step;

  /**
   * Constructs the range.
   * @param start the first index, or null for the start of the axis
   * @param stop the index after the last one, or null for the end of the axis
   * @param step the distance between selected indexes, never 0
   */
  public IndexRange(Integer start, Integer stop, int step) {
    Preconditions.checkArgument(step != 0, "The step of an index range cannot be zero");
    this.start = start;
    this.stop = stop;
    this.step = step;
  }

  public IndexRange(Integer start, Integer stop) {
    this(start, stop, 1);
  }

  /**
   * The range selecting the single index given.
   */
  public static IndexRange of(int index) {
    return new IndexRange(index, index + 1, 1);
  }

  public Integer getStart() {
    return start;
  }

  public Integer getStop() {
    return stop;
  }

  public int getStep() {
    return step;
  }

  /**
   * @return the number of indexes selected, when both ends are known and non-negative
   */
  public int length() {
    Preconditions.checkState(start != null && stop != null, "Length of an open range is undefined");
    if (step > 0) {
      return Math.max(0, (stop - start + step - 1) / step);
    }
    return Math.max(0, (start - stop - step - 1) / -step);
  }

  /**
   * Resolves the range against an axis of the given length, returning the first and the stop index.  Open ends
   * become the axis ends, negative ends count back from the end, and both are clamped to {@code [0, length]}.
   */
  public int[] resolve(int length) {
    int first = start == null ? 0 : clamp(start < 0 ? length + start : start, length);
    int last = stop == null ? length : clamp(stop < 0 ? length + stop : stop, length);
    return new int[] {first, last};
  }

  private static int clamp(int value, int length) {
    return Math.min(Math.max(value, 0), length);
  }

  @Override
  public String toString() {
    return String.format("[%s:%s:%d]", start == null ? "" : start, stop == null ? "" : stop, step);
  }
}
