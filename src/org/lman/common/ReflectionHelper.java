// Copyright 2012 Benjamin Kalman
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package org.lman.common;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;

/**
 * Reflection utilities.
 */
public class ReflectionHelper {

  private ReflectionHelper() {}

  /**
   * Visits the public instance fields of an object. A visitor can stop early and leave a result
   * with {@link #breakAndReturn}.
   */
  public static abstract class FieldVisitor {
    protected enum Control { CONTINUE, BREAK }

    private Object returnValue = null;

    protected abstract Control visit(Field field, Object value);

    protected Control breakAndReturn(Object value) {
      returnValue = value;
      return Control.BREAK;
    }
  }

  /**
   * Calls {@code visitor} with each public instance field of {@code obj} and its value, and
   * returns whatever the visitor broke out with (null if it didn't).
   */
  public static Object forEach(Object obj, FieldVisitor visitor) {
    for (Field field : obj.getClass().getFields()) {
      if (Modifier.isStatic(field.getModifiers()))
        continue;
      if (visitor.visit(field, get(obj, field)) == FieldVisitor.Control.BREAK)
        break;
    }
    return visitor.returnValue;
  }

  /** Reads a public field of {@code obj}. */
  public static Object get(Object obj, Field field) {
    try {
      return field.get(obj);
    } catch (IllegalAccessException e) {
      throw new IllegalArgumentException(e);
    }
  }
}
