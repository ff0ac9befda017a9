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

import com.lexicalscope.jewel.cli.Option;

/**
 * Arguments for {@link Runner}.
 *
 * @since 1.0
 */
public interface RunnerArgs {

  @Option(defaultToNull = true, description = "Working directory for snapshot and model files")
  File getLocalInputDir();

  @Option(defaultValue = "8080", description = "HTTP port number")
  int getPort();

  @Option(defaultToNull = true, description = "Non-root context path to deploy endpoints under")
  String getContextPath();

  @Option(description = "Disables all API methods that sync data or train models")
  boolean isReadOnly();

  @Option(defaultToNull = true, description = "JDBC URL of the transactional database to sync snapshots from")
  String getDatabaseURL();

  @Option(defaultToNull = true, description = "User name for the transactional database")
  String getDatabaseUser();

  @Option(defaultToNull = true, description = "Password for the transactional database")
  String getDatabasePassword();

  @Option(helpRequest = true)
  boolean getHelp();

}
