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
import javax.servlet.ServletResponse;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import net.affinity.common.GenerationSummary;
import net.affinity.common.SyncSummary;
import net.affinity.common.TrainingStatus;
import net.affinity.web.common.stats.ServletStats;

/**
 * Renders the summary objects returned by training, sync and status requests as JSON objects.
 * Fields appear in the order they are added.
 */
final class JSONOutput {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private JSONOutput() {
  }

  static ObjectNode newObject() {
    return MAPPER.createObjectNode();
  }

  /**
   * @return summary as JSON, or a JSON {@code null} if there is no generation yet
   */
  static JsonNode toJSON(GenerationSummary summary) {
    if (summary == null) {
      return NullNode.getInstance();
    }
    ObjectNode json = newObject();
    json.put("generationID", summary.getGenerationID());
    json.put("createdAt", summary.getCreatedAt());
    json.put("productCount", summary.getProductCount());
    json.put("basketCount", summary.getBasketCount());
    json.put("featureDimension", summary.getFeatureDimension());
    json.put("coPurchasePairs", summary.getCoPurchasePairs());
    return json;
  }

  static ObjectNode toJSON(SyncSummary summary) {
    ObjectNode json = newObject();
    json.put("products", summary.getProducts());
    json.put("orders", summary.getOrders());
    json.put("orderItems", summary.getOrderItems());
    json.put("syncedAt", summary.getSyncedAt());
    return json;
  }

  static ObjectNode toJSON(TrainingStatus status) {
    ObjectNode json = newObject();
    json.put("state", status.getState().name());
    json.put("since", status.getSince());
    json.put("failedIn", status.getFailedIn() == null ? null : status.getFailedIn().name());
    json.put("lastFailure", status.getLastFailure());
    return json;
  }

  static ObjectNode toJSON(Map<String,ServletStats> timings) {
    ObjectNode json = newObject();
    for (Map.Entry<String,ServletStats> entry : timings.entrySet()) {
      ServletStats stats = entry.getValue();
      ObjectNode endpoint = json.putObject(entry.getKey());
      endpoint.put("count", stats.getCount());
      if (stats.getCount() > 0) {
        endpoint.put("meanMillis", stats.getMeanMillis());
        endpoint.put("maxMillis", stats.getMaxMillis());
      }
      endpoint.put("clientErrors", stats.getNumClientErrors());
      endpoint.put("serverErrors", stats.getNumServerErrors());
    }
    return json;
  }

  static void write(ServletResponse response, JsonNode json) throws IOException {
    response.setContentType("application/json");
    response.getWriter().write(MAPPER.writeValueAsString(json));
  }

}
