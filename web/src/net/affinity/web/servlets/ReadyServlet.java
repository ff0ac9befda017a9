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

import net.affinity.common.GenerationSummary;

/**
 * <p>Responds to a HEAD or GET request to {@code /ready}. Returns {@code 200 OK} once a model generation is
 * live, and {@code 503 Service Unavailable} before then. A GET also writes the live generation ID.</p>
 */
public final class ReadyServlet extends AbstractAffinityServlet {

  @Override
  protected void doGet(HttpServletRequest request, HttpServletResponse response) throws IOException {
    GenerationSummary summary = getRecommender().getGenerationSummary();
    if (summary == null) {
      response.sendError(HttpServletResponse.SC_SERVICE_UNAVAILABLE, "No model generation is live");
      return;
    }
    response.setContentType("text/plain");
    response.getWriter().write("generation " + summary.getGenerationID() + '\n');
  }

  @Override
  protected void doHead(HttpServletRequest request, HttpServletResponse response) {
    response.setStatus(getRecommender().isReady() ? HttpServletResponse.SC_OK
                                                  : HttpServletResponse.SC_SERVICE_UNAVAILABLE);
  }

}
