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

package net.affinity.common;

import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;

import com.google.common.collect.Lists;
import org.apache.mahout.cf.taste.impl.recommender.GenericRecommendedItem;
import org.apache.mahout.cf.taste.recommender.RecommendedItem;
import org.junit.Test;

public final class TopNTest extends AffinityTest {

  private static final Comparator<RecommendedItem> BY_VALUE_THEN_ID = new Comparator<RecommendedItem>() {
    @Override
    public int compare(RecommendedItem a, RecommendedItem b) {
      int byValue = Float.compare(b.getValue(), a.getValue());
      if (byValue != 0) {
        return byValue;
      }
      return a.getItemID() < b.getItemID() ? -1 : a.getItemID() > b.getItemID() ? 1 : 0;
    }
  };

  @Test
  public void testEmpty() {
    List<RecommendedItem> empty = Collections.emptyList();
    List<RecommendedItem> top2 = TopN.selectTopN(empty.iterator(), 2, BY_VALUE_THEN_ID);
    assertNotNull(top2);
    assertTrue(top2.isEmpty());
  }

  @Test
  public void testTopExactly() {
    List<RecommendedItem> top3 = TopN.selectTopN(makeNCandidates(3).iterator(), 3, BY_VALUE_THEN_ID);
    assertEquals(3, top3.size());
    assertEquals(3L, top3.get(0).getItemID());
    assertEquals(3.0f, top3.get(0).getValue());
    assertEquals(1L, top3.get(2).getItemID());
    assertEquals(1.0f, top3.get(2).getValue());
  }

  @Test
  public void testTopOfMany() {
    List<RecommendedItem> top3 = TopN.selectTopN(makeNCandidates(20).iterator(), 3, BY_VALUE_THEN_ID);
    assertEquals(3, top3.size());
    assertEquals(20L, top3.get(0).getItemID());
    assertEquals(19L, top3.get(1).getItemID());
    assertEquals(18L, top3.get(2).getItemID());
  }

  @Test
  public void testTiesKeepLowerID() {
    List<RecommendedItem> candidates = Lists.newArrayList();
    for (long id = 10; id >= 1; id--) {
      candidates.add(new GenericRecommendedItem(id, 0.5f));
    }
    List<RecommendedItem> top3 = TopN.selectTopN(candidates.iterator(), 3, BY_VALUE_THEN_ID);
    assertEquals(3, top3.size());
    assertEquals(1L, top3.get(0).getItemID());
    assertEquals(2L, top3.get(1).getItemID());
    assertEquals(3L, top3.get(2).getItemID());
  }

  @Test
  public void testNullsSkipped() {
    List<RecommendedItem> candidates = makeNCandidates(2);
    candidates.add(1, null);
    List<RecommendedItem> top = TopN.selectTopN(candidates.iterator(), 5, BY_VALUE_THEN_ID);
    assertEquals(2, top.size());
    assertEquals(2L, top.get(0).getItemID());
  }

  @Test
  public void testReusedValuesAreCopied() {
    final ReusableScoredProduct reused = new ReusableScoredProduct();
    List<RecommendedItem> top = TopN.selectTopN(new Iterator<RecommendedItem>() {
      private int i = 0;
      @Override
      public boolean hasNext() {
        return i < 4;
      }
      @Override
      public RecommendedItem next() {
        i++;
        reused.set(i, i);
        return reused;
      }
      @Override
      public void remove() {
        throw new UnsupportedOperationException();
      }
    }, 2, BY_VALUE_THEN_ID);
    assertEquals(2, top.size());
    assertEquals(4L, top.get(0).getItemID());
    assertEquals(3L, top.get(1).getItemID());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNonPositiveN() {
    TopN.selectTopN(makeNCandidates(2).iterator(), 0, BY_VALUE_THEN_ID);
  }

  private static List<RecommendedItem> makeNCandidates(int n) {
    List<RecommendedItem> candidates = Lists.newArrayListWithCapacity(n);
    for (int i = 1; i <= n; i++) {
      candidates.add(new GenericRecommendedItem(i, i));
    }
    return candidates;
  }

}
