/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.seqmatch;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property that configures a {@link SequenceMatcher}.
 *
 * @see SequenceMatcher#create(Map)
 */
public enum MatchProp {
  /**
   * Boolean property "memoize" controls whether the matcher remembers states
   * from which no walk exists, so that it does not explore them twice.
   * Default is false.
   */
  MEMOIZE("memoize", Boolean.class, false),

  /**
   * Integer property "stepLimit" is the maximum number of steps that one
   * traversal may take before the matcher throws {@link
   * StepLimitExceededException}. Default is 0, which means no limit.
   */
  STEP_LIMIT("stepLimit", Integer.class, 0),

  /**
   * Boolean property "trace" controls whether a matcher that has no explicit
   * tracer writes a trace of each traversal to standard error. Default is
   * false.
   */
  TRACE("trace", Boolean.class, false);

  /** Prefix of the system properties read by {@link #fromSystemProperties}. */
  public static final String SYSTEM_PREFIX = "seqmatch.";

  public final String camelName;
  private final Class<?> type;
  private final Object defaultValue;

  /**
   * Map of all properties, keyed by both {@link #name()} and {@link
   * #camelName}.
   */
  public static final ImmutableMap<String, MatchProp> BY_NAME;

  /** List of all properties sorted by {@link #camelName}. */
  public static final List<MatchProp> BY_CAMEL_NAME;

  static {
    final Ordering<MatchProp> ordering =
        Ordering.from(Comparator.comparing((MatchProp o) -> o.camelName));
    BY_CAMEL_NAME = ordering.sortedCopy(Arrays.asList(values()));

    final Map<String, MatchProp> map = new LinkedHashMap<>();
    for (MatchProp value : BY_CAMEL_NAME) {
      map.put(value.name(), value);
      map.put(value.camelName, value);
    }
    BY_NAME = ImmutableMap.copyOf(map);
  }

  MatchProp(String camelName, Class<?> type, Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.defaultValue = defaultValue;
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    checkArgument(type.isInstance(defaultValue));
  }

  /** Looks up a property by name. Throws if not found; never returns null. */
  public static MatchProp lookup(String propName) {
    final MatchProp prop = BY_NAME.get(propName);
    if (prop == null) {
      throw new IllegalArgumentException(
          "property " + propName + " not found");
    }
    return prop;
  }

  /**
   * Reads property values from the system properties; for example,
   * "-Dseqmatch.memoize=true" sets {@link #MEMOIZE}.
   */
  public static Map<MatchProp, Object> fromSystemProperties() {
    return fromProperties(System.getProperties());
  }

  /**
   * Reads property values from a {@link Properties}, looking for keys that
   * start with {@link #SYSTEM_PREFIX}. Properties that are absent keep their
   * default value.
   */
  public static Map<MatchProp, Object> fromProperties(Properties properties) {
    final Map<MatchProp, Object> map = new EnumMap<>(MatchProp.class);
    for (MatchProp prop : values()) {
      final String value =
          properties.getProperty(SYSTEM_PREFIX + prop.camelName);
      if (value != null) {
        prop.setLenient(map, value);
      }
    }
    return map;
  }

  /** Returns the value of a property. */
  public Object get(Map<MatchProp, Object> map) {
    final Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  /** Throws if the requested type does not match this property's type. */
  private void checkType(Class<?> requestedType) {
    checkArgument(
        type == requestedType,
        "invalid type %s for property %s",
        type,
        camelName);
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Map<MatchProp, Object> map) {
    checkType(Boolean.class);
    return (Boolean) get(map);
  }

  /** Returns the value of an integer property. */
  public int intValue(Map<MatchProp, Object> map) {
    checkType(Integer.class);
    return (Integer) get(map);
  }

  /**
   * Sets the value of a property, converting strings to the property's type.
   *
   * <p>For boolean properties, "", "true" and "1" are true, "false" and "0"
   * are false, regardless of case; other values are invalid.
   */
  public void setLenient(Map<MatchProp, Object> map, @Nullable Object value) {
    if (value instanceof String && type != String.class) {
      final String s = ((String) value).trim();
      if (type == Boolean.class) {
        set(map, parseBoolean(s));
      } else if (type == Integer.class) {
        try {
          set(map, Integer.valueOf(s));
        } catch (NumberFormatException e) {
          throw new IllegalArgumentException(
              "value for property " + camelName + " must be an integer", e);
        }
      } else {
        set(map, value);
      }
      return;
    }
    set(map, value);
  }

  private boolean parseBoolean(String s) {
    final String low = s.toLowerCase(Locale.ROOT);
    if (low.isEmpty() || low.equals("true") || low.equals("1")) {
      return true;
    }
    if (low.equals("false") || low.equals("0")) {
      return false;
    }
    throw new IllegalArgumentException(
        "value for property " + camelName + " must be a boolean: " + s);
  }

  /**
   * Sets the value of a property. Checks that its type is valid. A null value
   * restores the default.
   */
  public void set(Map<MatchProp, Object> map, @Nullable Object value) {
    if (value == null) {
      // Revert to the default value
      map.remove(this);
    } else {
      checkArgument(
          type.isInstance(value),
          "value for property %s must have type %s",
          camelName,
          type);
      if (this == STEP_LIMIT) {
        checkArgument((Integer) value >= 0, "negative stepLimit: %s", value);
      }
      map.put(this, value);
    }
  }
}

// End MatchProp.java
