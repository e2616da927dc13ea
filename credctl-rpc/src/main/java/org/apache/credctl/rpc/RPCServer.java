package org.apache.credctl.rpc;

import java.lang.management.ManagementFactory;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.apache.credctl.rpc.util.Constants;
import org.apache.credctl.rpc.util.CredctlConfiguration;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.hbase.http.HttpServerUtil;
import org.apache.hadoop.hbase.log.HBaseMarkers;
import org.apache.hadoop.hbase.util.DNS;
import org.apache.hadoop.hbase.util.ReflectionUtils;
import org.apache.hadoop.hbase.util.Strings;

import org.apache.hbase.thirdparty.com.fasterxml.jackson.jaxrs.json.JacksonJsonProvider;
import org.apache.hbase.thirdparty.org.apache.commons.cli.CommandLine;
import org.apache.hbase.thirdparty.org.apache.commons.cli.HelpFormatter;
import org.apache.hbase.thirdparty.org.apache.commons.cli.Options;
import org.apache.hbase.thirdparty.org.apache.commons.cli.ParseException;
import org.apache.hbase.thirdparty.org.apache.commons.cli.PosixParser;
import org.apache.hbase.thirdparty.org.eclipse.jetty.jmx.MBeanContainer;
import org.apache.hbase.thirdparty.org.eclipse.jetty.server.HttpConfiguration;
import org.apache.hbase.thirdparty.org.eclipse.jetty.server.HttpConnectionFactory;
import org.apache.hbase.thirdparty.org.eclipse.jetty.server.Server;
import org.apache.hbase.thirdparty.org.eclipse.jetty.server.ServerConnector;
import org.apache.hbase.thirdparty.org.eclipse.jetty.servlet.ServletContextHandler;
import org.apache.hbase.thirdparty.org.eclipse.jetty.servlet.ServletHolder;
import org.apache.hbase.thirdparty.org.eclipse.jetty.util.thread.QueuedThreadPool;
import org.apache.hbase.thirdparty.org.glassfish.jersey.server.ResourceConfig;
import org.apache.hbase.thirdparty.org.glassfish.jersey.servlet.ServletContainer;

/**
 * Main class for launching the credential RPC gateway as a servlet hosted by Jetty.
 */
public class RPCServer {

    private static final Logger LOG = LoggerFactory.getLogger(RPCServer.class);

    private final Configuration conf;
    private Server server;
    private RPCServlet servlet;

    public RPCServer(Configuration conf) {
        this.conf = conf;
    }

    private static void printUsageAndExit(Options options, int exitCode) {
        HelpFormatter formatter = new HelpFormatter();
        formatter.printHelp("credctl rpc start", "", options,
                "\nTo run the RPC server as a daemon, execute "
                        + "credctl.sh start|stop rpc [-p <port>] [-s <credential_store_dir>]\n",
                true);
        System.exit(exitCode);
    }

    private static void parseCommandLine(String[] args, Configuration conf) {
        Options options = new Options();
        options.addOption("p", "port", true,
                "Port to bind to [default: " + Constants.DEFAULT_LISTEN_PORT + "]");
        options.addOption("s", "storedir", true,
                "Directory holding the credential file; credentials are kept in memory if unset");

        CommandLine commandLine = null;
        try {
            commandLine = new PosixParser().parse(options, args);
        } catch (ParseException e) {
            LOG.error("Could not parse: ", e);
            printUsageAndExit(options, -1);
        }

        // check for user-defined port setting, if so override the conf
        if (commandLine != null && commandLine.hasOption("port")) {
            String val = commandLine.getOptionValue("port");
            conf.setInt(Constants.CREDCTL_RPC_PORT, Integer.parseInt(val));
            LOG.debug("port set to {}", val);
        }

        // check for user-defined credential store, if so override the conf
        if (commandLine != null && commandLine.hasOption("storedir")) {
            String val = commandLine.getOptionValue("storedir");
            conf.set(Constants.AUTH_STORE_DIR, val);
            LOG.debug("credential store dir set to {}", val);
        }

        List<String> remainingArgs =
                commandLine != null ? commandLine.getArgList() : new ArrayList<>();
        if (remainingArgs.size() != 1) {
            printUsageAndExit(options, 1);
        }

        String command = remainingArgs.get(0);
        if ("start".equals(command)) {
            // continue and start container
        } else if ("stop".equals(command)) {
            System.exit(1);
        } else {
            printUsageAndExit(options, 1);
        }
    }

    /**
     * Runs the RPC server.
     */
    public synchronized void run() throws Exception {
        Class<? extends ServletContainer> containerClass = ServletContainer.class;

        servlet = new RPCServlet(conf);

        // set up the Jersey servlet container for Jetty
        ResourceConfig application = new ResourceConfig()
                .register(new RootResource(servlet))
                .register(JsonProcessingExceptionMapper.class)
                .register(WebApplicationExceptionMapper.class)
                .register(JacksonJsonProvider.class);
        ServletContainer servletContainer =
                ReflectionUtils.newInstance(containerClass, application);
        ServletHolder sh = new ServletHolder(servletContainer);

        // Bound the number of concurrent requests; Jetty defaults to 250 threads.
        int maxThreads = conf.getInt(Constants.RPC_THREAD_POOL_THREADS_MAX, 125);
        int minThreads = conf.getInt(Constants.RPC_THREAD_POOL_THREADS_MIN, 2);
        // Use the default queue (unbounded) if the queue size is negative, otherwise use
        // bounded {@link ArrayBlockingQueue} with the given size
        int queueSize = conf.getInt(Constants.RPC_THREAD_POOL_TASK_QUEUE_SIZE, -1);
        int idleTimeout = conf.getInt(Constants.RPC_THREAD_POOL_THREAD_IDLE_TIMEOUT, 60000);
        QueuedThreadPool threadPool = queueSize > 0 ?
                new QueuedThreadPool(maxThreads, minThreads, idleTimeout,
                        new ArrayBlockingQueue<>(queueSize)) :
                new QueuedThreadPool(maxThreads, minThreads, idleTimeout);

        this.server = new Server(threadPool);

        // Setup JMX
        MBeanContainer mbContainer = new MBeanContainer(ManagementFactory.getPlatformMBeanServer());
        server.addEventListener(mbContainer);
        server.addBean(mbContainer);

        String host = conf.get(Constants.CREDCTL_RPC_HOST, Constants.DEFAULT_HOST);
        int servicePort = conf.getInt(Constants.CREDCTL_RPC_PORT, Constants.DEFAULT_LISTEN_PORT);
        int httpHeaderCacheSize = conf.getInt(Constants.HTTP_HEADER_CACHE_SIZE,
                Constants.DEFAULT_HTTP_HEADER_CACHE_SIZE);

        HttpConfiguration httpConfig = new HttpConfiguration();
        httpConfig.setHeaderCacheSize(httpHeaderCacheSize);
        httpConfig.setRequestHeaderSize(Constants.DEFAULT_HTTP_MAX_HEADER_SIZE);
        httpConfig.setResponseHeaderSize(Constants.DEFAULT_HTTP_MAX_HEADER_SIZE);
        httpConfig.setSendServerVersion(false);

        ServerConnector serverConnector =
                new ServerConnector(server, new HttpConnectionFactory(httpConfig));

        int acceptQueueSize = conf.getInt(Constants.RPC_CONNECTOR_ACCEPT_QUEUE_SIZE, -1);
        if (acceptQueueSize >= 0) {
            serverConnector.setAcceptQueueSize(acceptQueueSize);
        }

        serverConnector.setPort(servicePort);
        serverConnector.setHost(host);

        server.addConnector(serverConnector);
        server.setStopAtShutdown(true);

        // set up context
        ServletContextHandler ctxHandler =
                new ServletContextHandler(server, "/", ServletContextHandler.SESSIONS);
        ctxHandler.addServlet(sh, Constants.PATH_SPEC_ANY);

        HttpServerUtil.constrainHttpMethods(ctxHandler,
                conf.getBoolean(Constants.RPC_HTTP_ALLOW_OPTIONS_METHOD,
                        Constants.RPC_HTTP_ALLOW_OPTIONS_METHOD_DEFAULT));

        // start server
        server.start();
        LOG.info("RPC server listening on {}:{}", host, getPort());
    }

    private static String getHostName(Configuration conf) throws UnknownHostException {
        return Strings.domainNamePointerToHostName(
                DNS.getDefaultHost(conf.get(Constants.RPC_DNS_INTERFACE, "default"),
                        conf.get(Constants.RPC_DNS_NAMESERVER, "default")));
    }

    public synchronized void join() throws Exception {
        if (server == null) {
            throw new IllegalStateException("Server is not running");
        }
        server.join();
    }

    public synchronized void stop() throws Exception {
        if (server == null) {
            throw new IllegalStateException("Server is not running");
        }
        server.stop();
        server = null;
        servlet.shutdown();
        servlet = null;
    }

    public synchronized int getPort() {
        if (server == null) {
            throw new IllegalStateException("Server is not running");
        }
        return ((ServerConnector) server.getConnectors()[0]).getLocalPort();
    }

    /**
     * @return host:port other processes reach this server on
     */
    public String getServerAddress() throws UnknownHostException {
        return getHostName(conf) + ":" + getPort();
    }

    synchronized RPCServlet getServlet() {
        return servlet;
    }

    public Configuration getConf() {
        return conf;
    }

    /**
     * The main method for the credential RPC server.
     *
     * @param args command-line arguments
     * @throws Exception exception
     */
    public static void main(String[] args) throws Exception {
        LOG.info("***** STARTING service '" + RPCServer.class.getSimpleName() + "' *****");
        final Configuration conf = CredctlConfiguration.create();

        String storeDir = System.getenv("CREDCTL_STORE_DIR");
        if (storeDir != null) {
            conf.set(Constants.AUTH_STORE_DIR, storeDir);
        }

        parseCommandLine(args, conf);
        RPCServer server = new RPCServer(conf);

        try {
            server.run();
            server.join();
        } catch (Exception e) {
            LOG.error(HBaseMarkers.FATAL, "Failed to start server", e);
            System.exit(1);
        }

        LOG.info("***** STOPPING service '" + RPCServer.class.getSimpleName() + "' *****");
    }
}
