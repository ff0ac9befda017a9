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

import java.util.Map;

import com.google.common.collect.Maps;
import org.junit.Test;

import net.affinity.common.AffinityTest;
import net.affinity.common.GenerationSummary;
import net.affinity.common.SyncSummary;
import net.affinity.common.TrainingState;
import net.affinity.common.TrainingStatus;
import net.affinity.web.common.stats.ServletStats;

public final class JSONOutputTest extends AffinityTest {

  @Test
  public void testNoGeneration() {
    assertEquals("null", JSONOutput.toJSON((GenerationSummary) null).toString());
  }

  @Test
  public void testSyncFieldOrder() {
    assertEquals("{\"products\":4,\"orders\":3,\"orderItems\":9,\"syncedAt\":1000}",
                 JSONOutput.toJSON(new SyncSummary(4, 3, 9, 1000L)).toString());
  }

  @Test
  public void testFailureMessageEscaped() {
    TrainingStatus status =
        new TrainingStatus(TrainingState.FAILED, TrainingState.SYNCING, "Table \"orderitem\" missing\nretry", 7L);
    assertEquals("{\"state\":\"FAILED\",\"since\":7,\"failedIn\":\"SYNCING\"," +
                 "\"lastFailure\":\"Table \\\"orderitem\\\" missing\\nretry\"}",
                 JSONOutput.toJSON(status).toString());
  }

  @Test
  public void testIdleStatusHasNullFailure() {
    TrainingStatus status = new TrainingStatus(TrainingState.IDLE, null, null, 0L);
    assertEquals("{\"state\":\"IDLE\",\"since\":0,\"failedIn\":null,\"lastFailure\":null}",
                 JSONOutput.toJSON(status).toString());
  }

  @Test
  public void testUnusedEndpointOmitsTimings() {
    Map<String,ServletStats> timings = Maps.newTreeMap();
    timings.put("SimilarServlet", new ServletStats());
    assertEquals("{\"SimilarServlet\":{\"count\":0,\"clientErrors\":0,\"serverErrors\":0}}",
                 JSONOutput.toJSON(timings).toString());
  }

}
