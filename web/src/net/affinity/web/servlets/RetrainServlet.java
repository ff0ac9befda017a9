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

import com.fasterxml.jackson.databind.node.ObjectNode;

import net.affinity.common.AffinityRecommender;
import net.affinity.common.GenerationSummary;
import net.affinity.common.SyncSummary;
import net.affinity.common.TrainingException;
import net.affinity.online.generation.TrainingInProgressException;

/**
 * <p>Responds to a POST request to {@code /retrain} by syncing a fresh snapshot and then training on it,
 * as {@link SyncServlet} and {@link TrainServlet} would one after the other. Training is skipped if the
 * sync fails. Returns a JSON object like {@code {"sync":{...},"generation":{...}}}.</p>
 */
public final class RetrainServlet extends AbstractAffinityServlet {

  @Override
  protected void doPost(HttpServletRequest request, HttpServletResponse response) throws IOException {
    AffinityRecommender recommender = getRecommender();

    SyncSummary syncSummary;
    try {
      syncSummary = recommender.syncSnapshot();
    } catch (IllegalStateException ise) {
      response.sendError(HttpServletResponse.SC_SERVICE_UNAVAILABLE, ise.getMessage());
      return;
    } catch (IOException ioe) {
      response.sendError(HttpServletResponse.SC_INTERNAL_SERVER_ERROR, ioe.toString());
      getServletContext().log("Snapshot sync failed", ioe);
      return;
    }

    GenerationSummary generationSummary;
    try {
      generationSummary = recommender.train();
    } catch (TrainingInProgressException tipe) {
      response.sendError(HttpServletResponse.SC_CONFLICT, tipe.getMessage());
      return;
    } catch (TrainingException te) {
      response.sendError(HttpServletResponse.SC_INTERNAL_SERVER_ERROR,
                         "Training failed in " + te.getFailedIn() + ": " + te.getMessage());
      getServletContext().log("Training failed in " + te.getFailedIn(), te);
      return;
    }

    ObjectNode json = JSONOutput.newObject();
    json.set("sync", JSONOutput.toJSON(syncSummary));
    json.set("generation", JSONOutput.toJSON(generationSummary));
    JSONOutput.write(response, json);
  }

}
