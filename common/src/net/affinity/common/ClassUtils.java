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

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;

/**
 * {@link Class}-related utility methods.
 */
public final class ClassUtils {

  private ClassUtils() {
  }

  /**
   * Loads and instantiates a named implementation class, a subclass of a given supertype,
   * whose constructor takes the given arguments. Used to bind implementations that live in modules
   * the caller can't depend on at compile time.
   *
   * @param implClassName implementation class name
   * @param superClass superclass or interface that the implementation extends
   * @param constructorTypes argument types of constructor to use
   * @param constructorArgs actual constructor arguments
   * @return instance of {@code implClassName}
   * @throws IllegalStateException if the class can't be found or instantiated
   */
  public static <T> T loadInstanceOf(String implClassName,
                                     Class<T> superClass,
                                     Class<?>[] constructorTypes,
                                     Object[] constructorArgs) {
    Class<? extends T> implClass;
    try {
      implClass = Class.forName(implClassName, true, ClassUtils.class.getClassLoader()).asSubclass(superClass);
    } catch (ClassNotFoundException cnfe) {
      throw new IllegalStateException("No " + superClass.getSimpleName() + " implementation " + implClassName, cnfe);
    }
    try {
      Constructor<? extends T> constructor = implClass.getConstructor(constructorTypes);
      return constructor.newInstance(constructorArgs);
    } catch (InvocationTargetException ite) {
      throw new IllegalStateException("Could not instantiate " + implClassName, ite.getCause());
    } catch (ReflectiveOperationException roe) {
      throw new IllegalStateException("No usable constructor in " + implClassName, roe);
    }
  }

}
