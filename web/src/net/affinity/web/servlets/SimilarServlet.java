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
import java.util.List;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;

import org.apache.mahout.cf.taste.common.NoSuchItemException;
import org.apache.mahout.cf.taste.common.TasteException;
import org.apache.mahout.cf.taste.recommender.RecommendedItem;

import net.affinity.common.AffinityRecommender;
import net.affinity.common.NotReadyException;

/**
 * <p>Responds to a GET request to {@code /similar/[productID](?howMany=n)}, and in turn calls
 * {@link AffinityRecommender#getSimilar(long, int)} with the supplied values.
 * If howMany is not specified, defaults to {@link AbstractAffinityServlet#DEFAULT_HOW_MANY}.</p>
 *
 * <p>An unknown product ID results in a {@link HttpServletResponse#SC_NOT_FOUND} status.</p>
 *
 * <p>Outputs product/score pairs in CSV or JSON format, as in
 * {@link AbstractAffinityServlet#output(HttpServletRequest, javax.servlet.ServletResponse, Iterable)}.</p>
 *
 * @since 1.0
 */
public final class SimilarServlet extends AbstractAffinityServlet {

  @Override
  protected void doGet(HttpServletRequest request, HttpServletResponse response) throws IOException {
    AffinityRecommender recommender = getRecommender();
    try {
      long productID = getProductID(request);
      List<RecommendedItem> similar = recommender.getSimilar(productID, getHowMany(request));
      output(request, response, similar);
    } catch (NoSuchItemException nsie) {
      response.sendError(HttpServletResponse.SC_NOT_FOUND, nsie.toString());
    } catch (NotReadyException nre) {
      response.sendError(HttpServletResponse.SC_SERVICE_UNAVAILABLE, nre.toString());
    } catch (TasteException te) {
      response.sendError(HttpServletResponse.SC_INTERNAL_SERVER_ERROR, te.toString());
      getServletContext().log("Unexpected error in " + getClass().getSimpleName(), te);
    } catch (IllegalArgumentException iae) {
      response.sendError(HttpServletResponse.SC_BAD_REQUEST, iae.toString());
    }
  }

}
