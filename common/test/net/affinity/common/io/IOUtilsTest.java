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

package net.affinity.common.io;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.Writer;

import com.google.common.base.Charsets;
import com.google.common.io.Files;
import org.junit.Test;

import net.affinity.common.AffinityTest;

public final class IOUtilsTest extends AffinityTest {

  private static final byte[] SOME_BYTES = { 0x01, 0x02, 0x03 };

  @Test
  public void testGZIPRoundTrip() throws IOException {
    File file = new File(getTestTempDir(), "lines.csv.gz");
    Writer out = IOUtils.buildGZIPWriter(file);
    try {
      out.write("1,shoes\n2,hats\n");
    } finally {
      out.close();
    }
    BufferedReader in = IOUtils.buffer(IOUtils.openReaderMaybeDecompressing(file));
    try {
      assertEquals("1,shoes", in.readLine());
      assertEquals("2,hats", in.readLine());
      assertNull(in.readLine());
    } finally {
      in.close();
    }
  }

  @Test
  public void testPlainFile() throws IOException {
    File file = new File(getTestTempDir(), "lines.csv");
    Files.write("a,b\n", file, Charsets.UTF_8);
    BufferedReader in = IOUtils.buffer(IOUtils.openReaderMaybeDecompressing(file));
    try {
      assertEquals("a,b", in.readLine());
    } finally {
      in.close();
    }
  }

  @Test
  public void testDeleteRecursively() throws IOException {
    File tempDir = getTestTempDir();
    assertTrue(tempDir.exists());
    File subFile1 = new File(tempDir, "subFile1");
    Files.write(SOME_BYTES, subFile1);
    File subDir1 = new File(tempDir, "subDir1");
    assertTrue(subDir1.mkdirs());
    File subFile2 = new File(subDir1, "subFile2");
    Files.write(SOME_BYTES, subFile2);
    File subDir2 = new File(subDir1, "subDir2");
    assertTrue(subDir2.mkdirs());

    assertTrue(IOUtils.deleteRecursively(tempDir));

    assertFalse(tempDir.exists());
    assertFalse(subFile1.exists());
    assertFalse(subDir1.exists());
    assertFalse(subFile2.exists());
    assertFalse(subDir2.exists());
  }

  @Test
  public void testDeleteNull() {
    assertFalse(IOUtils.deleteRecursively(null));
  }

}
