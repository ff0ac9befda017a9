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
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;

import net.affinity.common.SyncSummary;

/**
 * <p>Responds to a POST request to {@code /sync} by copying products and order items from the
 * transactional database into a fresh local snapshot, via
 * {@link net.affinity.common.AffinityRecommender#syncSnapshot()}. Returns the sync summary as JSON.</p>
 *
 * <p>Returns {@link HttpServletResponse#SC_SERVICE_UNAVAILABLE} if no database is configured.</p>
 */
public final class SyncServlet extends AbstractAffinityServlet {

  @Override
  protected void doPost(HttpServletRequest request, HttpServletResponse response) throws IOException {
    SyncSummary summary;
    try {
      summary = getRecommender().syncSnapshot();
    } catch (IllegalStateException ise) {
      response.sendError(HttpServletResponse.SC_SERVICE_UNAVAILABLE, ise.getMessage());
      return;
    } catch (IOException ioe) {
      response.sendError(HttpServletResponse.SC_INTERNAL_SERVER_ERROR, ioe.toString());
      getServletContext().log("Snapshot sync failed", ioe);
      return;
    }
    JSONOutput.write(response, JSONOutput.toJSON(summary));
  }

}
