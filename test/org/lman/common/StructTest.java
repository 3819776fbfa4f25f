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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class StructTest {

  public static class Simple extends Struct {
    public Boolean aBoolean;
    public Integer aNumber;
    public String aString;
    public String[] anArray;

    public Simple(Boolean aBoolean, Integer aNumber, String aString, String... anArray) {
      this.aBoolean = aBoolean;
      this.aNumber = aNumber;
      this.aString = aString;
      this.anArray = anArray;
    }
  }

  public static class Other extends Struct {
    public Boolean aBoolean;

    public Other(Boolean aBoolean) {
      this.aBoolean = aBoolean;
    }
  }

  @Test
  public void equality() {
    Simple reference = new Simple(true, 42, "hello", "one", "two");
    Simple test = new Simple(true, 42, "hello", "one", "two");

    assertEquals(reference, test);
    assertEquals(reference.hashCode(), test.hashCode());

    test.aBoolean = false;
    assertFalse(reference.equals(test));
    assertFalse(reference.hashCode() == test.hashCode());

    test.aBoolean = reference.aBoolean;
    test.aNumber = 7;
    assertFalse(reference.equals(test));
    assertFalse(reference.hashCode() == test.hashCode());

    test.aNumber = reference.aNumber;
    test.aString = null;
    assertFalse(reference.equals(test));
    assertFalse(test.equals(reference));

    test.aString = reference.aString;
    test.anArray = new String[] { "one" };
    assertFalse(reference.equals(test));
    assertFalse(reference.hashCode() == test.hashCode());

    test.anArray = new String[] { "one", "two" };
    assertEquals(reference, test);
    assertEquals(reference.hashCode(), test.hashCode());
  }

  @Test
  public void differentClasses() {
    assertFalse(new Other(true).equals(new Simple(true, null, null)));
    assertFalse(new Other(true).equals(null));
  }

  @Test
  public void toString_() {
    String string = new Simple(true, null, "hi", "a", "b").toString();
    assertTrue(string, string.startsWith("Simple{ "));
    assertTrue(string, string.endsWith(" }"));
    assertTrue(string, string.contains("aBoolean: true"));
    assertTrue(string, string.contains("aNumber: (null)"));
    assertTrue(string, string.contains("anArray: [a, b]"));
  }
}
