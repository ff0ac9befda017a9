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
import java.util.concurrent.Callable;
import javax.servlet.Servlet;

import com.google.common.base.Preconditions;
import com.google.common.io.Files;
import com.lexicalscope.jewel.cli.ArgumentValidationException;
import com.lexicalscope.jewel.cli.CliFactory;
import org.apache.catalina.Context;
import org.apache.catalina.Host;
import org.apache.catalina.LifecycleException;
import org.apache.catalina.Server;
import org.apache.catalina.Wrapper;
import org.apache.catalina.connector.Connector;
import org.apache.catalina.core.JreMemoryLeakPreventionListener;
import org.apache.catalina.core.ThreadLocalLeakPreventionListener;
import org.apache.catalina.startup.Tomcat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.affinity.common.io.IOUtils;
import net.affinity.common.log.MemoryHandler;
import net.affinity.web.servlets.CoPurchaseServlet;
import net.affinity.web.servlets.LogServlet;
import net.affinity.web.servlets.ReadyServlet;
import net.affinity.web.servlets.RetrainServlet;
import net.affinity.web.servlets.SimilarServlet;
import net.affinity.web.servlets.StatusServlet;
import net.affinity.web.servlets.SyncServlet;
import net.affinity.web.servlets.TrainServlet;

/**
 * <p>This is the runnable class which starts the Serving Layer and its Tomcat-based HTTP server. It is
 * started with {@link #call()} and can be shut down with {@link #close()}.</p>
 *
 * <p>{@link Runner} is configured by {@link RunnerConfiguration} but when run as a command-line program,
 * it is configured via a set of analogous flags:</p>
 *
 * <ul>
 *   <li>{@code --localInputDir}: Optional. The local directory holding the analytical snapshot
 *   ({@code snapshot/}) and the persisted model ({@code model.bin.gz}). Defaults to a temporary directory.</li>
 *   <li>{@code --port}: Port on which to listen for HTTP requests. Defaults to 8080.</li>
 *   <li>{@code --contextPath}: Optional. Non-root context path, like {@code /recs}, under which all endpoints
 *   are deployed.</li>
 *   <li>{@code --readOnly}: If set, disables the {@code /sync}, {@code /train} and {@code /retrain}
 *   endpoints</li>
 *   <li>{@code --databaseURL}: Optional. JDBC URL of the transactional database that {@code /sync} copies
 *   products and order items from. Without it, training reads whatever snapshot is already in
 *   {@code --localInputDir}.</li>
 *   <li>{@code --databaseUser}, {@code --databasePassword}: credentials for {@code --databaseURL}</li>
 * </ul>
 *
 * <p>If {@code model.bin.gz} is present at startup, it is read to restore the last trained generation,
 * rather than waiting for a new training run.</p>
 *
 * <p>Example:</p>
 *
 * <p>{@code java -jar affinity-web-x.y.jar --port 8080 --localInputDir /var/affinity
 *  --databaseURL jdbc:postgresql://db/shop --databaseUser reader}</p>
 *
 * <p>Some more advanced tuning parameters are available as system properties, set with
 * {@code -Dproperty=value}.</p>
 *
 * <ul>
 *   <li>{@code model.similarity.cacheTopK}: If positive, each product's top K most similar products are
 *   precomputed at training time. Defaults to 0, which scans all products per query.</li>
 *   <li>{@code serving.maxHowMany}: Largest number of results any query returns. Defaults to 50.</li>
 * </ul>
 */
public final class Runner implements Callable<Boolean>, Closeable {

  private static final Logger log = LoggerFactory.getLogger(Runner.class);

  private final RunnerConfiguration config;
  private Tomcat tomcat;
  private final File noSuchBaseDir;
  private boolean closed;

  /**
   * Creates a new instance with the given configuration.
   */
  public Runner(RunnerConfiguration config) {
    Preconditions.checkNotNull(config);
    this.config = config;
    this.noSuchBaseDir = Files.createTempDir();
    this.noSuchBaseDir.deleteOnExit();
  }

  /**
   * @return the underlying {@link Tomcat} server that is being configured and run inside this instance.
   */
  public Tomcat getTomcat() {
    return tomcat;
  }

  public static void main(String[] args) throws Exception {

    RunnerConfiguration config;
    try {
      RunnerArgs runnerArgs = CliFactory.parseArguments(RunnerArgs.class, args);
      config = buildConfiguration(runnerArgs);
    } catch (ArgumentValidationException ave) {
      printHelp(ave.getMessage());
      return;
    }

    final Runner runner = new Runner(config);
    runner.call();

    Runtime.getRuntime().addShutdownHook(new Thread(new Runnable() {
      @Override
      public void run() {
        runner.close();
      }
    }, "AffinityShutdownHook"));

    runner.await();
    runner.close();
  }

  private static RunnerConfiguration buildConfiguration(RunnerArgs runnerArgs) {

    RunnerConfiguration config = new RunnerConfiguration();

    config.setPort(runnerArgs.getPort());
    config.setContextPath(runnerArgs.getContextPath());
    config.setReadOnly(runnerArgs.isReadOnly());
    config.setLocalInputDir(runnerArgs.getLocalInputDir());

    boolean hasUser = runnerArgs.getDatabaseUser() != null || runnerArgs.getDatabasePassword() != null;
    if (hasUser && runnerArgs.getDatabaseURL() == null) {
      throw new ArgumentValidationException("--databaseUser and --databasePassword require --databaseURL");
    }
    config.setDatabaseURL(runnerArgs.getDatabaseURL());
    config.setDatabaseUser(runnerArgs.getDatabaseUser());
    config.setDatabasePassword(runnerArgs.getDatabasePassword());

    return config;
  }

  @Override
  public Boolean call() throws IOException {

    MemoryHandler.setSensibleLogFormat();
    java.util.logging.Logger.getLogger("").addHandler(new MemoryHandler());

    Tomcat tomcat = new Tomcat();
    Connector connector = makeConnector();
    configureTomcat(tomcat, connector);
    configureServer(tomcat.getServer());
    configureHost(tomcat.getHost());
    Context context = makeContext(tomcat, noSuchBaseDir);

    addServlet(context, new SimilarServlet(), "/similar/*");
    addServlet(context, new CoPurchaseServlet(), "/copurchase/*");
    addServlet(context, new ReadyServlet(), "/ready/*");
    addServlet(context, new StatusServlet(), "/status/*");

    if (!config.isReadOnly()) {
      addServlet(context, new SyncServlet(), "/sync/*");
      addServlet(context, new TrainServlet(), "/train/*");
      addServlet(context, new RetrainServlet(), "/retrain/*");
    }

    addServlet(context, new LogServlet(), "/log.txt");

    try {
      tomcat.start();
    } catch (LifecycleException le) {
      throw new IOException(le);
    }
    this.tomcat = tomcat;
    log.info("Serving Layer listening on port {}", connector.getLocalPort());
    return Boolean.TRUE;
  }

  /**
   * Blocks and waits until the server shuts down.
   */
  public void await() {
    tomcat.getServer().await();
  }

  @Override
  public synchronized void close() {
    if (!closed) {
      closed = true;
      if (tomcat != null) {
        try {
          tomcat.stop();
          tomcat.destroy();
        } catch (LifecycleException le) {
          log.warn("Unexpected error while stopping", le);
        }
      }
      if (!IOUtils.deleteRecursively(noSuchBaseDir)) {
        log.info("Could not delete {}", noSuchBaseDir);
      }
    }
  }

  private static void printHelp(String message) {
    System.out.println();
    System.out.println("Affinity Serving Layer. Serves similar-product and bought-together lookups.");
    System.out.println();
    if (message != null) {
      System.out.println(message);
      System.out.println();
    }
  }

  private void configureTomcat(Tomcat tomcat, Connector connector) {
    tomcat.setBaseDir(noSuchBaseDir.getAbsolutePath());
    tomcat.setConnector(connector);
  }

  private static void configureServer(Server server) {
    server.addLifecycleListener(new JreMemoryLeakPreventionListener());
    server.addLifecycleListener(new ThreadLocalLeakPreventionListener());
  }

  private static void configureHost(Host host) {
    host.setAutoDeploy(false);
  }

  private Connector makeConnector() {
    Connector connector = new Connector("org.apache.coyote.http11.Http11NioProtocol");
    connector.setPort(config.getPort());
    connector.setSecure(false);
    connector.setScheme("http");

    // Keep quiet about the server type
    connector.setXpoweredBy(false);
    connector.setProperty("server", "Affinity");

    // Basic tuning params:
    connector.setProperty("maxThreads", "400");
    connector.setProperty("acceptCount", "50");
    connector.setProperty("maxKeepAliveRequests", "100");

    return connector;
  }

  private Context makeContext(Tomcat tomcat, File noSuchBaseDir) throws IOException {

    File contextDir = new File(noSuchBaseDir, "context");
    if (!contextDir.mkdirs()) {
      throw new IOException("Could not create " + contextDir);
    }

    String contextPath = config.getContextPath();
    Context context = tomcat.addContext(contextPath == null ? "" : contextPath, contextDir.getAbsolutePath());
    context.addApplicationListener(InitListener.class.getName());

    File localInputDir = config.getLocalInputDir();
    addParameter(context, InitListener.LOCAL_INPUT_DIR_KEY,
                 localInputDir == null ? null : localInputDir.getAbsolutePath());
    addParameter(context, InitListener.READ_ONLY_KEY, Boolean.toString(config.isReadOnly()));
    addParameter(context, InitListener.DATABASE_URL_KEY, config.getDatabaseURL());
    addParameter(context, InitListener.DATABASE_USER_KEY, config.getDatabaseUser());
    addParameter(context, InitListener.DATABASE_PASSWORD_KEY, config.getDatabasePassword());

    context.setCookies(false);

    return context;
  }

  private static void addParameter(Context context, String key, String value) {
    // Absent values stay unset
    if (value != null) {
      context.addParameter(key, value);
    }
  }

  private static Wrapper addServlet(Context context, Servlet servlet, String path) {
    String name = servlet.getClass().getSimpleName();
    Wrapper servletWrapper = Tomcat.addServlet(context, name, servlet);
    servletWrapper.setLoadOnStartup(1);
    context.addServletMappingDecoded(path, name);
    return servletWrapper;
  }

}
