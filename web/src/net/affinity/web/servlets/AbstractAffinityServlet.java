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

import java.io.IOException;
import java.io.PrintWriter;
import java.util.Iterator;
import java.util.Map;
import java.util.SortedMap;
import javax.servlet.ServletConfig;
import javax.servlet.ServletContext;
import javax.servlet.ServletException;
import javax.servlet.ServletRequest;
import javax.servlet.ServletResponse;
import javax.servlet.http.HttpServlet;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.collect.Maps;
import org.apache.mahout.cf.taste.recommender.RecommendedItem;

import net.affinity.common.AffinityRecommender;
import net.affinity.common.LangUtils;
import net.affinity.web.common.stats.ServletStats;

/**
 * Superclass of {@link HttpServlet}s used in the application. All API methods return the following
 * HTTP statuses in certain situations:
 *
 * <ul>
 *  <li>{@code 400 Bad Request} if the arguments are invalid, like a non-numeric ID</li>
 *  <li>{@code 405 Method Not Allowed} if an incorrect HTTP method is used, like {@code GET}
 *  where {@code POST} is required</li>
 *  <li>{@code 500 Internal Server Error} if an unexpected server-side exception occurs</li>
 *  <li>{@code 503 Service Unavailable} if no model is yet available to serve requests</li>
 * </ul>
 */
public abstract class AbstractAffinityServlet extends HttpServlet {

  private static final Splitter COMMA = Splitter.on(',').omitEmptyStrings().trimResults();
  static final Splitter SLASH = Splitter.on('/').omitEmptyStrings();
  static final int DEFAULT_HOW_MANY = 10;
  static final int MAX_CACHED_ACCEPT_HEADERS = 1000;

  private static final String KEY_PREFIX = AbstractAffinityServlet.class.getName();
  public static final String READ_ONLY_KEY = KEY_PREFIX + ".READ_ONLY";
  public static final String RECOMMENDER_KEY = KEY_PREFIX + ".RECOMMENDER";
  public static final String TIMINGS_KEY = KEY_PREFIX + ".TIMINGS";
  public static final String LOCAL_INPUT_DIR_KEY = KEY_PREFIX + ".LOCAL_INPUT_DIR";
  public static final String TRANSACTIONAL_STORE_KEY = KEY_PREFIX + ".TRANSACTIONAL_STORE";

  private AffinityRecommender recommender;
  private ServletStats timing;
  private final Cache<String,ResponseContentType> responseTypeCache =
      CacheBuilder.newBuilder().maximumSize(MAX_CACHED_ACCEPT_HEADERS).build();

  @Override
  public void init(ServletConfig config) throws ServletException {
    super.init(config);

    ServletContext context = config.getServletContext();
    recommender = (AffinityRecommender) context.getAttribute(RECOMMENDER_KEY);

    Map<String,ServletStats> timings;
    synchronized (context) {
      @SuppressWarnings("unchecked")
      Map<String,ServletStats> theTimings = (Map<String,ServletStats>) context.getAttribute(TIMINGS_KEY);
      timings = theTimings;
      if (timings == null) {
        timings = Maps.newTreeMap();
        context.setAttribute(TIMINGS_KEY, timings);
      }
      String key = getClass().getSimpleName();
      ServletStats theTiming = timings.get(key);
      if (theTiming == null) {
        theTiming = new ServletStats();
        timings.put(key, theTiming);
      }
      timing = theTiming;
    }
  }

  @Override
  protected final void service(HttpServletRequest request, HttpServletResponse response)
      throws ServletException, IOException {
    long start = System.nanoTime();
    super.service(request, response);
    timing.addTiming(System.nanoTime() - start);

    int status = response.getStatus();
    if (status >= 400) {
      if (status >= 500) {
        timing.incrementServerErrors();
      } else {
        timing.incrementClientErrors();
      }
    }
  }

  protected final AffinityRecommender getRecommender() {
    return recommender;
  }

  public final ServletStats getTiming() {
    return timing;
  }

  protected static int getHowMany(ServletRequest request) {
    String howManyString = request.getParameter("howMany");
    if (howManyString == null) {
      return DEFAULT_HOW_MANY;
    }
    int howMany = Integer.parseInt(howManyString);
    Preconditions.checkArgument(howMany > 0, "howMany must be positive");
    return howMany;
  }

  /**
   * @return the single product ID in a path like {@code /similar/[productID]}
   * @throws IllegalArgumentException if the path holds no ID, more than one, or a non-numeric one
   */
  static long getProductID(HttpServletRequest request) {
    String pathInfo = request.getPathInfo();
    Preconditions.checkArgument(pathInfo != null, "No path");
    Iterator<String> pathComponents = SLASH.split(pathInfo).iterator();
    Preconditions.checkArgument(pathComponents.hasNext(), "No product ID");
    long productID = Long.parseLong(pathComponents.next());
    Preconditions.checkArgument(!pathComponents.hasNext(), "Only one product ID is allowed");
    return productID;
  }

  /**
   * <p>Outputs items in CSV or JSON format based on the HTTP {@code Accept} header.</p>
   *
   * <p>CSV output contains one result per line, and each line is of the form {@code productID, score},
   * like {@code 325, 0.53}.</p>
   *
   * <p>JSON output is an array of arrays, with each sub-array containing a product ID and score.
   * Example: {@code [[325, 0.53], [98, 0.499]]}.</p>
   */
  protected final void output(HttpServletRequest request,
                              ServletResponse response,
                              Iterable<RecommendedItem> items) throws IOException {

    PrintWriter writer = response.getWriter();
    switch (determineResponseType(request)) {
      case JSON:
        response.setContentType("application/json");
        writer.write('[');
        boolean first = true;
        for (RecommendedItem item : items) {
          if (first) {
            first = false;
          } else {
            writer.write(',');
          }
          writer.write('[');
          writer.write(Long.toString(item.getItemID()));
          writer.write(',');
          writer.write(Float.toString(item.getValue()));
          writer.write(']');
        }
        writer.write(']');
        break;
      case CSV:
        response.setContentType("text/csv");
        for (RecommendedItem item : items) {
          writer.write(Long.toString(item.getItemID()));
          writer.write(',');
          writer.write(Float.toString(item.getValue()));
          writer.write('\n');
        }
        break;
      default:
        throw new IllegalStateException("Unknown response type");
    }
  }

  /**
   * Determines the appropriate content type for the response based on request headers. At the moment these
   * are chosen from the values in {@link ResponseContentType}.
   */
  final ResponseContentType determineResponseType(HttpServletRequest request) {

    String acceptHeader = request.getHeader("Accept");
    if (acceptHeader == null) {
      return ResponseContentType.JSON;
    }
    ResponseContentType cached = responseTypeCache.getIfPresent(acceptHeader);
    if (cached != null) {
      return cached;
    }

    SortedMap<Double,ResponseContentType> types = Maps.newTreeMap();
    for (String accept : COMMA.split(acceptHeader)) {
      double preference;
      String type;
      int semiColon = accept.indexOf(';');
      if (semiColon < 0) {
        preference = 1.0;
        type = accept;
      } else {
        String valueString = accept.substring(semiColon + 1).trim();
        if (valueString.startsWith("q=")) {
          valueString = valueString.substring(2);
        }
        try {
          preference = LangUtils.parseDouble(valueString);
        } catch (IllegalArgumentException iae) {
          preference = 1.0;
        }
        type = accept.substring(0, semiColon).trim();
      }
      ResponseContentType parsedType = null;
      if ("text/csv".equals(type) || "text/plain".equals(type)) {
        parsedType = ResponseContentType.CSV;
      } else if ("application/json".equals(type)) {
        parsedType = ResponseContentType.JSON;
      }
      // First listed type wins among equal preferences
      if (parsedType != null && !types.containsKey(preference)) {
        types.put(preference, parsedType);
      }
    }

    ResponseContentType finalType;
    if (types.isEmpty()) {
      finalType = ResponseContentType.JSON;
    } else {
      finalType = types.get(types.lastKey());
    }

    responseTypeCache.put(acceptHeader, finalType);
    return finalType;
  }

  final long cachedResponseTypes() {
    responseTypeCache.cleanUp();
    return responseTypeCache.size();
  }

  /**
   * Available content types / formats for response bodies.
   */
  enum ResponseContentType {
    JSON,
    CSV,
  }

}
