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

package org.lman.json;

import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;

import org.json.JSONException;
import org.json.JSONObject;

/**
 * Reads JSON objects into classes with public fields (see {@link org.lman.common.Struct}).
 * Fields missing from the JSON keep the value the class's no-arg constructor gave them.
 */
public class JsonConverter {

  private static class ReadJsonException extends Exception {
    private static final long serialVersionUID = 1L;

    public ReadJsonException(String message) {
      super(message);
    }
  }

  private JsonConverter() {}

  /**
   * @throws JSONException if {@code json} isn't valid JSON or doesn't fit {@code clazz}
   */
  @SuppressWarnings("unchecked")
  public static <E> E fromJson(String json, Class<E> clazz) throws JSONException {
    try {
      return (E) readJson(new JSONObject(json), clazz, "");
    } catch (ReadJsonException e) {
      throw new JSONException(e.getMessage(), e);
    } catch (InstantiationException e) {
      throw new JSONException("Can't create " + clazz.getName(), e);
    } catch (IllegalAccessException e) {
      throw new JSONException("Can't create " + clazz.getName(), e);
    } catch (InvocationTargetException e) {
      throw new JSONException("Can't create " + clazz.getName(), e);
    } catch (NoSuchMethodException e) {
      throw new JSONException(clazz.getName() + " has no no-arg constructor", e);
    }
  }

  private static Object readJson(Object json, Class<?> clazz, String path)
      throws ReadJsonException,
      InstantiationException,
      IllegalAccessException,
      InvocationTargetException,
      NoSuchMethodException {
    if (json == null || json == JSONObject.NULL) {
      return null;
    } else if (clazz == String.class) {
      return expect(json, String.class, path);
    } else if (clazz == Boolean.class || clazz == boolean.class) {
      return expect(json, Boolean.class, path);
    } else {
      JSONObject jsonObject = expect(json, JSONObject.class, path);
      Object object = clazz.getConstructor().newInstance();
      for (Field field : clazz.getFields()) {
        if (Modifier.isStatic(field.getModifiers()) || Modifier.isFinal(field.getModifiers()))
          continue;
        if (!jsonObject.has(field.getName()))
          continue;
        field.set(object, readJson(
            jsonObject.get(field.getName()),
            field.getType(),
            path.isEmpty() ? field.getName() : path + "." + field.getName()));
      }
      return object;
    }
  }

  private static <T> T expect(Object json, Class<T> clazz, String path)
      throws ReadJsonException {
    if (!clazz.isInstance(json))
      throw new ReadJsonException(describe(path) + " should be a " + clazz.getSimpleName() +
          " but is " + json);
    return clazz.cast(json);
  }

  private static String describe(String path) {
    return path.isEmpty() ? "The top level" : "\"" + path + "\"";
  }
}
