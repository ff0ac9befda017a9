/*
 * Copyright Affinity Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package net.affinity.common;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import org.junit.Test;

public final class ClassUtilsTest extends AffinityTest {

  @Test
  public void testInstantiateWithArgs() {
    Number n = ClassUtils.loadInstanceOf(Integer.class.getName(),
                                         Number.class,
                                         new Class<?>[] {int.class},
                                         new Object[] {3});
    assertEquals(3, n.intValue());
  }

  @Test
  public void testInstantiateNoArgs() {
    Set<?> set = ClassUtils.loadInstanceOf(TreeSet.class.getName(), Set.class, new Class<?>[0], new Object[0]);
    assertTrue(set instanceof TreeSet);
  }

  @Test(expected = IllegalStateException.class)
  public void testMissingClass() {
    ClassUtils.loadInstanceOf("net.affinity.NoSuchThing", Collection.class, new Class<?>[0], new Object[0]);
  }

  @Test(expected = ClassCastException.class)
  public void testWrongSupertype() {
    ClassUtils.loadInstanceOf(TreeSet.class.getName(), List.class, new Class<?>[0], new Object[0]);
  }

}
