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
package org.gbif.wcs.common.header;

import java.io.Serializable;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.gbif.wcs.common.coords.MalformedCoordinateMetadataException;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;
import com.google.common.primitives.Doubles;

/**
 * The key-value record of coordinate metadata exchanged with the readers and writers of image containers.  Keys
 * are FITS keywords (e.g. CRPIX1, CD1_2, CUNIT3), held upper case and in insertion order.  Values are numbers or
 * strings; numeric strings are accepted wherever a number is expected since not every reader converts them.
 * <p/>
 * This class is not threadsafe.
 */
public class WcsHeader implements Serializable {
  private static final long serialVersionUID = -6170235583468934802L;

  private final Map<String, Object> cards = Maps.newLinkedHashMap();

  public WcsHeader() {
  }

  /**
   * Copies the entries of the given map, in its iteration order.
   */
  public static WcsHeader of(Map<String, ?> values) {
    WcsHeader header = new WcsHeader();
    values.forEach(header::put);
    return header;
  }

  public WcsHeader copy() {
    return of(cards);
  }

  /**
   * Sets a keyword, replacing any previous value.
   * @return this header for chaining
   */
  public WcsHeader put(String key, Object value) {
    Preconditions.checkNotNull(key, "Header keys cannot be null");
    Preconditions.checkNotNull(value, "Header values cannot be null (key %s)", key);
    cards.put(normalize(key), value);
    return this;
  }

  /**
   * Sets every keyword of the other header, replacing existing values.
   */
  public WcsHeader putAll(WcsHeader other) {
    cards.putAll(other.cards);
    return this;
  }

  public boolean contains(String key) {
    return cards.containsKey(normalize(key));
  }

  public boolean containsAny(String... keys) {
    for (String key : keys) {
      if (contains(key)) {
        return true;
      }
    }
    return false;
  }

  public Object remove(String key) {
    return cards.remove(normalize(key));
  }

  /**
   * @throws MalformedCoordinateMetadataException if the key is absent or not numeric
   */
  public double getDouble(String key) {
    if (!contains(key)) {
      throw new MalformedCoordinateMetadataException("Missing required keyword " + normalize(key));
    }
    return toDouble(key, cards.get(normalize(key)));
  }

  public double getDouble(String key, double defaultValue) {
    return contains(key) ? getDouble(key) : defaultValue;
  }

  /**
   * @return the value, or null when absent
   */
  public Double getDoubleOrNull(String key) {
    return contains(key) ? getDouble(key) : null;
  }

  /**
   * @throws MalformedCoordinateMetadataException if the key is absent or not an integral number
   */
  public int getInt(String key) {
    double value = getDouble(key);
    if (value != Math.rint(value)) {
      throw new MalformedCoordinateMetadataException("Keyword " + normalize(key) + " is not an integer: " + value);
    }
    return (int) value;
  }

  /**
   * @return the value, or null when absent
   */
  public Integer getIntOrNull(String key) {
    return contains(key) ? getInt(key) : null;
  }

  /**
   * @return the value as a trimmed string, or the default when absent
   */
  public String getString(String key, String defaultValue) {
    Object value = cards.get(normalize(key));
    return value == null ? defaultValue : value.toString().trim();
  }

  public Set<String> keys() {
    return ImmutableSet.copyOf(cards.keySet());
  }

  /**
   * @return an immutable snapshot of the header
   */
  public Map<String, Object> asMap() {
    return ImmutableMap.copyOf(cards);
  }

  public int size() {
    return cards.size();
  }

  private static double toDouble(String key, Object value) {
    if (value instanceof Number) {
      return ((Number) value).doubleValue();
    }
    Double parsed = Doubles.tryParse(value.toString().trim());
    if (parsed == null) {
      throw new MalformedCoordinateMetadataException("Keyword " + normalize(key) + " is not numeric: " + value);
    }
    return parsed;
  }

  private static String normalize(String key) {
    return key.trim().toUpperCase(Locale.ROOT);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return cards.equals(((WcsHeader) o).cards);
  }

  @Override
  public int hashCode() {
    return cards.hashCode();
  }

  @Override
  public String toString() {
    return cards.toString();
  }
}
