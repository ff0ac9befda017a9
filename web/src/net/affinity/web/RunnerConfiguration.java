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


package net.affinity.web;

import java.io.File;

import com.google.common.base.Preconditions;

/**
 * Configuration for a {@link Runner}. This configures the Serving Layer server instance that it runs.
 */
public final class RunnerConfiguration {

  public static final int DEFAULT_PORT = 8080;

  private int port;
  private String contextPath;
  private boolean readOnly;
  private File localInputDir;
  private String databaseURL;
  private String databaseUser;
  private String databasePassword;

  public RunnerConfiguration() {
    port = DEFAULT_PORT;
  }

  /**
   * @return port on which the Serving Layer listens for HTTP connections
   */
  public int getPort() {
    return port;
  }

  public void setPort(int port) {
    Preconditions.checkArgument(port >= 0, "port must be nonnegative: %s", port);
    this.port = port;
  }

  /**
   * @return context path under which endpoints are deployed, or {@code null} for the root context
   */
  public String getContextPath() {
    return contextPath;
  }

  public void setContextPath(String contextPath) {
    if (contextPath != null) {
      Preconditions.checkArgument(contextPath.startsWith("/"), "contextPath must start with /: %s", contextPath);
      Preconditions.checkArgument(!contextPath.endsWith("/"), "contextPath must not end with /: %s", contextPath);
    }
    this.contextPath = contextPath;
  }

  /**
   * @return true if endpoints that sync snapshots or train models are disabled
   */
  public boolean isReadOnly() {
    return readOnly;
  }

  public void setReadOnly(boolean readOnly) {
    this.readOnly = readOnly;
  }

  /**
   * @return local directory holding the snapshot and {@code model.bin.gz}. If {@code null}, a temporary
   *  directory is used and deleted on shutdown.
   */
  public File getLocalInputDir() {
    return localInputDir;
  }

  public void setLocalInputDir(File localInputDir) {
    this.localInputDir = localInputDir;
  }

  /**
   * @return JDBC URL of the transactional database that snapshots are synced from, or {@code null}
   *  if snapshots are only ever placed in the local input dir by hand
   */
  public String getDatabaseURL() {
    return databaseURL;
  }

  public void setDatabaseURL(String databaseURL) {
    this.databaseURL = databaseURL;
  }

  public String getDatabaseUser() {
    return databaseUser;
  }

  public void setDatabaseUser(String databaseUser) {
    this.databaseUser = databaseUser;
  }

  public String getDatabasePassword() {
    return databasePassword;
  }

  public void setDatabasePassword(String databasePassword) {
    this.databasePassword = databasePassword;
  }

}
