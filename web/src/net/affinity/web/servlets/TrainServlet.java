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
import net.affinity.common.TrainingException;
import net.affinity.online.generation.TrainingInProgressException;

/**
 * <p>Responds to a POST request to {@code /train} by running one training run over the current snapshot,
 * via {@link net.affinity.common.AffinityRecommender#train()}. The request blocks until the new generation
 * is live, and returns its summary as a JSON object.</p>
 *
 * <p>Returns {@link HttpServletResponse#SC_CONFLICT} if another run is in progress, and
 * {@link HttpServletResponse#SC_INTERNAL_SERVER_ERROR} if the run fails. A failed run leaves
 * the live generation in place.</p>
 */
public final class TrainServlet extends AbstractAffinityServlet {

  @Override
  protected void doPost(HttpServletRequest request, HttpServletResponse response) throws IOException {
    GenerationSummary summary;
    try {
      summary = getRecommender().train();
    } catch (TrainingInProgressException tipe) {
      response.sendError(HttpServletResponse.SC_CONFLICT, tipe.getMessage());
      return;
    } catch (TrainingException te) {
      response.sendError(HttpServletResponse.SC_INTERNAL_SERVER_ERROR,
                         "Training failed in " + te.getFailedIn() + ": " + te.getMessage());
      getServletContext().log("Training failed in " + te.getFailedIn(), te);
      return;
    }
    JSONOutput.write(response, JSONOutput.toJSON(summary));
  }

}
