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

import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.util.logging.Handler;
import javax.servlet.ServletContext;
import javax.servlet.ServletContextEvent;
import javax.servlet.ServletContextListener;

import com.google.common.io.Files;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.affinity.common.AffinityRecommender;
import net.affinity.common.io.IOUtils;
import net.affinity.common.log.MemoryHandler;
import net.affinity.online.ServerRecommender;
import net.affinity.online.snapshot.JdbcTransactionalStore;
import net.affinity.online.snapshot.TransactionalStore;
import net.affinity.web.servlets.AbstractAffinityServlet;

/**
 * <p>This servlet lifecycle listener makes sure that the shared {@link AffinityRecommender} instance
 * is initialized at startup, along with related objects, and shut down when the container is destroyed.</p>
 *
 * @since 1.0
 */
public final class InitListener implements ServletContextListener {

  private static final Logger log = LoggerFactory.getLogger(InitListener.class);

  private static final String KEY_PREFIX = InitListener.class.getName();
  public static final String LOG_HANDLER = KEY_PREFIX + ".LOG_HANDLER";
  public static final String LOCAL_INPUT_DIR_KEY = KEY_PREFIX + ".LOCAL_INPUT_DIR";
  public static final String READ_ONLY_KEY = KEY_PREFIX + ".READ_ONLY";
  public static final String DATABASE_URL_KEY = KEY_PREFIX + ".DATABASE_URL";
  public static final String DATABASE_USER_KEY = KEY_PREFIX + ".DATABASE_USER";
  public static final String DATABASE_PASSWORD_KEY = KEY_PREFIX + ".DATABASE_PASSWORD";

  private File tempDirToDelete;
  private HikariDataSource dataSource;

  @Override
  public void contextInitialized(ServletContextEvent event) {
    log.info("Initializing Affinity in servlet context...");
    ServletContext context = event.getServletContext();

    configureLogging(context);

    File localInputDir = configureLocalInputDir(context);

    boolean readOnly = Boolean.parseBoolean(getAttributeOrParam(context, READ_ONLY_KEY));
    context.setAttribute(AbstractAffinityServlet.READ_ONLY_KEY, readOnly);

    TransactionalStore transactionalStore = configureTransactionalStore(context);
    if (transactionalStore != null) {
      context.setAttribute(AbstractAffinityServlet.TRANSACTIONAL_STORE_KEY, transactionalStore);
    }

    AffinityRecommender recommender = new ServerRecommender(localInputDir, transactionalStore);
    context.setAttribute(AbstractAffinityServlet.RECOMMENDER_KEY, recommender);

    log.info("Affinity is initialized");
  }

  private static void configureLogging(ServletContext context) {
    MemoryHandler.setSensibleLogFormat();
    Handler logHandler = null;
    for (Handler handler : java.util.logging.Logger.getLogger("").getHandlers()) {
      if (handler instanceof MemoryHandler) {
        logHandler = handler;
        break;
      }
    }
    if (logHandler == null) {
      // Not previously configured by command line, make a new one
      logHandler = new MemoryHandler();
      java.util.logging.Logger.getLogger("").addHandler(logHandler);
    }
    context.setAttribute(LOG_HANDLER, logHandler);
  }

  private File configureLocalInputDir(ServletContext context) {
    String localInputDirName = getAttributeOrParam(context, LOCAL_INPUT_DIR_KEY);
    File localInputDir;
    if (localInputDirName == null) {
      localInputDir = Files.createTempDir();
      localInputDir.deleteOnExit();
      tempDirToDelete = localInputDir;
      log.info("No local input dir set; using temporary dir {}", localInputDir);
    } else {
      localInputDir = new File(localInputDirName);
      if (!localInputDir.exists()) {
        boolean madeDirs = localInputDir.mkdirs();
        if (!madeDirs) {
          log.warn("Failed to create local input dir {}", localInputDir);
        }
      }
      tempDirToDelete = null;
    }
    context.setAttribute(AbstractAffinityServlet.LOCAL_INPUT_DIR_KEY, localInputDir.getAbsolutePath());
    return localInputDir;
  }

  private TransactionalStore configureTransactionalStore(ServletContext context) {
    String databaseURL = getAttributeOrParam(context, DATABASE_URL_KEY);
    if (databaseURL == null) {
      log.info("No database configured; training reads only the existing local snapshot");
      return null;
    }
    HikariConfig poolConfig = new HikariConfig();
    poolConfig.setPoolName("AffinitySnapshotPool");
    poolConfig.setJdbcUrl(databaseURL);
    poolConfig.setUsername(getAttributeOrParam(context, DATABASE_USER_KEY));
    poolConfig.setPassword(getAttributeOrParam(context, DATABASE_PASSWORD_KEY));
    // Syncs are rare and sequential
    poolConfig.setMaximumPoolSize(2);
    poolConfig.setReadOnly(true);
    // Connect lazily, so a database that is down at startup doesn't stop serving
    poolConfig.setInitializationFailTimeout(-1);
    // Status checks give up after this long rather than hang on a dead database
    poolConfig.setConnectionTimeout(5000L);
    log.info("Syncing snapshots from {}", databaseURL);
    dataSource = new HikariDataSource(poolConfig);
    return new JdbcTransactionalStore(dataSource);
  }

  private static String getAttributeOrParam(ServletContext context, String key) {
    Object valueObject = context.getAttribute(key);
    String valueString = valueObject == null ? null : valueObject.toString();
    if (valueString == null) {
      valueString = context.getInitParameter(key);
    }
    return valueString;
  }

  @Override
  public void contextDestroyed(ServletContextEvent event) {
    log.info("Uninitializing Affinity in servlet context...");

    ServletContext context = event.getServletContext();
    Closeable recommender = (Closeable) context.getAttribute(AbstractAffinityServlet.RECOMMENDER_KEY);
    if (recommender != null) {
      try {
        recommender.close();
      } catch (IOException e) {
        log.warn("Unexpected error while closing", e);
      }
    }
    HikariDataSource theDataSource = dataSource;
    if (theDataSource != null) {
      theDataSource.close();
    }
    IOUtils.deleteRecursively(tempDirToDelete);
    log.info("Affinity is uninitialized");
  }

}
