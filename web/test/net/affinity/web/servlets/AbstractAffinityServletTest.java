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

package net.affinity.web.servlets;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import javax.servlet.http.HttpServletRequest;

import org.junit.Test;

import net.affinity.common.AffinityTest;

public final class AbstractAffinityServletTest extends AffinityTest {

  @Test
  public void testDefaultIsJSON() {
    AbstractAffinityServlet servlet = new SimilarServlet();
    assertEquals(AbstractAffinityServlet.ResponseContentType.JSON,
                 servlet.determineResponseType(requestAccepting(null)));
    assertEquals(AbstractAffinityServlet.ResponseContentType.JSON,
                 servlet.determineResponseType(requestAccepting("text/html")));
  }

  @Test
  public void testPreference() {
    AbstractAffinityServlet servlet = new SimilarServlet();
    assertEquals(AbstractAffinityServlet.ResponseContentType.CSV,
                 servlet.determineResponseType(requestAccepting("text/csv")));
    assertEquals(AbstractAffinityServlet.ResponseContentType.CSV,
                 servlet.determineResponseType(requestAccepting("application/json;q=0.5, text/plain;q=0.9")));
    assertEquals(AbstractAffinityServlet.ResponseContentType.JSON,
                 servlet.determineResponseType(requestAccepting("application/json, text/csv")));
    // Second lookup comes from the cache
    assertEquals(AbstractAffinityServlet.ResponseContentType.CSV,
                 servlet.determineResponseType(requestAccepting("text/csv")));
  }

  @Test
  public void testCachedAcceptHeadersBounded() {
    AbstractAffinityServlet servlet = new SimilarServlet();
    int distinct = 5 * AbstractAffinityServlet.MAX_CACHED_ACCEPT_HEADERS;
    for (int i = 0; i < distinct; i++) {
      String accept = "text/csv;q=0.5, application/x-custom-" + i;
      assertEquals(AbstractAffinityServlet.ResponseContentType.CSV,
                   servlet.determineResponseType(requestAccepting(accept)));
    }
    long cached = servlet.cachedResponseTypes();
    assertTrue(cached > 0);
    assertTrue(cached <= AbstractAffinityServlet.MAX_CACHED_ACCEPT_HEADERS);
  }

  private static HttpServletRequest requestAccepting(final String acceptHeader) {
    return (HttpServletRequest) Proxy.newProxyInstance(
        AbstractAffinityServletTest.class.getClassLoader(),
        new Class<?>[] { HttpServletRequest.class },
        new InvocationHandler() {
          @Override
          public Object invoke(Object proxy, Method method, Object[] args) {
            if ("getHeader".equals(method.getName()) && "Accept".equals(args[0])) {
              return acceptHeader;
            }
            return null;
          }
        });
  }

}
