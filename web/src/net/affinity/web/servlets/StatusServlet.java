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
import java.util.Map;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;

import com.fasterxml.jackson.databind.node.ObjectNode;

import net.affinity.common.AffinityRecommender;
import net.affinity.online.snapshot.TransactionalStore;
import net.affinity.web.common.stats.ServletStats;

/**
 * <p>Responds to a GET request to {@code /status} with a JSON object describing the live generation
 * ({@code null} before the first training run), the training state machine, whether the transactional
 * database answers, and request timings per endpoint.</p>
 *
 * <p>{@code database} is {@code "healthy"}, {@code "not configured"} when no database URL was given,
 * or {@code "error: "} followed by the reason it could not be reached.</p>
 */
public final class StatusServlet extends AbstractAffinityServlet {

  static final String DATABASE_HEALTHY = "healthy";
  static final String DATABASE_NOT_CONFIGURED = "not configured";

  @Override
  protected void doGet(HttpServletRequest request, HttpServletResponse response) throws IOException {
    AffinityRecommender recommender = getRecommender();
    ObjectNode json = JSONOutput.newObject();
    json.put("ready", recommender.isReady());
    json.set("generation", JSONOutput.toJSON(recommender.getGenerationSummary()));
    json.set("training", JSONOutput.toJSON(recommender.getTrainingStatus()));
    json.put("database", databaseStatus());
    Map<String,ServletStats> timings = getTimings();
    if (timings != null) {
      synchronized (getServletContext()) {
        json.set("endpoints", JSONOutput.toJSON(timings));
      }
    }
    JSONOutput.write(response, json);
  }

  private String databaseStatus() {
    TransactionalStore store = (TransactionalStore) getServletContext().getAttribute(TRANSACTIONAL_STORE_KEY);
    if (store == null) {
      return DATABASE_NOT_CONFIGURED;
    }
    try {
      store.checkReachable();
      return DATABASE_HEALTHY;
    } catch (IOException ioe) {
      return "error: " + ioe.getMessage();
    }
  }

  @SuppressWarnings("unchecked")
  private Map<String,ServletStats> getTimings() {
    return (Map<String,ServletStats>) getServletContext().getAttribute(TIMINGS_KEY);
  }

}
