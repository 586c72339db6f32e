package com.acme.hotdog.router.cli;

import com.acme.hotdog.router.config.ConfigurationException;
import com.acme.hotdog.router.config.HotdogConfig;
import com.acme.hotdog.router.config.RouterSettings;
import com.acme.hotdog.router.config.SettingsLoader;
import com.acme.hotdog.router.dispatch.Backoff;
import com.acme.hotdog.router.dispatch.Dispatcher;
import com.acme.hotdog.router.dispatch.KafkaDeliverySink;
import com.acme.hotdog.router.record.SyslogParser;
import com.acme.hotdog.router.rules.RuntimeValues;
import com.acme.hotdog.router.telemetry.AtomicRouterMetrics;
import com.acme.hotdog.router.telemetry.StatsdReporter;
import com.acme.hotdog.router.telemetry.StatusHttpEndpoint;
import com.acme.hotdog.router.transport.RoutingPipeline;
import com.acme.hotdog.router.transport.SyslogTcpListener;
import com.acme.hotdog.router.util.BuildInfo;
import com.acme.hotdog.router.util.EnvVars;
import com.acme.hotdog.router.util.RouterDefaults;
import com.acme.hotdog.router.util.RouterEnvKeys;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

public final class HotdogMain {
    private static final Logger LOG = Logger.getLogger(HotdogMain.class.getName());
    private static final int EXIT_CONFIG = 2;
    private static final int EXIT_USAGE = 64;
    private static final int EXIT_IO = 74;

    private HotdogMain() {}

    public static void main(String[] args) throws Exception {
        CommandLine cli;
        try {
            cli = CommandLine.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(CommandLine.usage());
            System.exit(EXIT_USAGE);
            return;
        }

        HotdogConfig config;
        try {
            config = new SettingsLoader(RuntimeValues.system()).load(cli.config());
        } catch (ConfigurationException e) {
            LOG.log(Level.SEVERE, "Invalid configuration " + cli.config() + ": " + e.getMessage());
            System.exit(EXIT_CONFIG);
            return;
        }

        if (cli.testMode()) {
            try {
                new RuleTester(config.ruleSet(), System.out).run(cli.testFile());
            } catch (IOException e) {
                LOG.log(Level.SEVERE, "Cannot read test file " + cli.testFile(), e);
                System.exit(EXIT_IO);
            }
            return;
        }
        run(config);
    }

    private static void run(HotdogConfig config) throws Exception {
        RouterSettings settings = config.settings();
        LOG.info(() -> "hotdog " + BuildInfo.version() + " starting, default topic " + settings.defaultTopic()
            + ", buffer " + settings.buffer());

        long drainTimeoutMs = EnvVars.getLongClamped(RouterEnvKeys.HOTDOG_DRAIN_TIMEOUT_MS,
            RouterDefaults.DEFAULT_DRAIN_TIMEOUT_MS, 100L, 600_000L);
        long deliveryTimeoutMs = EnvVars.getLongClamped(RouterEnvKeys.HOTDOG_DELIVERY_TIMEOUT_MS,
            RouterDefaults.DEFAULT_DELIVERY_TIMEOUT_MS, 100L, 600_000L);
        long backoffMinMs = EnvVars.getLongClamped(RouterEnvKeys.HOTDOG_BACKOFF_MIN_MS,
            RouterDefaults.DEFAULT_BACKOFF_MIN_MS, 1L, 60_000L);
        long backoffMaxMs = EnvVars.getLongClamped(RouterEnvKeys.HOTDOG_BACKOFF_MAX_MS,
            RouterDefaults.DEFAULT_BACKOFF_MAX_MS, backoffMinMs, 600_000L);
        int workers = EnvVars.getIntClamped(RouterEnvKeys.HOTDOG_LISTENER_WORKERS,
            RouterDefaults.DEFAULT_LISTENER_WORKERS, 1, 1024);
        int maxLineBytes = EnvVars.getIntClamped(RouterEnvKeys.HOTDOG_MAX_LINE_BYTES,
            RouterDefaults.DEFAULT_MAX_LINE_BYTES, 256, 16 * 1024 * 1024);
        int metricsIntervalSec = EnvVars.getIntClamped(RouterEnvKeys.HOTDOG_METRICS_INTERVAL_SEC,
            RouterDefaults.DEFAULT_METRICS_INTERVAL_SEC, 1, 3_600);

        AtomicRouterMetrics metrics = new AtomicRouterMetrics();
        Dispatcher dispatcher = new Dispatcher(
            settings.buffer(),
            KafkaDeliverySink.fromConfig(settings.producerConfig(), deliveryTimeoutMs),
            new Backoff(backoffMinMs, backoffMaxMs),
            metrics
        );
        RoutingPipeline pipeline = new RoutingPipeline(new SyslogParser(), config.ruleSet(), dispatcher, metrics);
        SyslogTcpListener listener = new SyslogTcpListener(settings.listener(), pipeline, metrics,
            workers, maxLineBytes, drainTimeoutMs);
        StatusHttpEndpoint statusEndpoint = new StatusHttpEndpoint(metrics, settings.statusAddress());
        StatsdReporter statsd = settings.statsd() == null
            ? null
            : new StatsdReporter(metrics, settings.statsd(), metricsIntervalSec);

        AtomicBoolean stopped = new AtomicBoolean(false);
        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Duration drainTimeout = Duration.ofMillis(drainTimeoutMs);
        Runnable stopAndSignal = () -> {
            try {
                stopAll(listener, dispatcher, statusEndpoint, statsd, drainTimeout, stopped);
            } finally {
                shutdownLatch.countDown();
            }
        };
        Thread shutdownHook = new Thread(stopAndSignal, "hotdog-shutdown-hook");
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        try {
            dispatcher.start();
            statusEndpoint.start();
            if (statsd != null) {
                statsd.start();
            }
            listener.start();
            shutdownLatch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (IllegalStateException ignored) {
                // JVM is shutting down and hook is already in-flight.
            }
            stopAndSignal.run();
        }
    }

    /**
     * Listener first so in-flight lines reach the dispatcher, then the
     * dispatcher drains and closes the sink.
     */
    static void stopAll(SyslogTcpListener listener,
                        Dispatcher dispatcher,
                        StatusHttpEndpoint statusEndpoint,
                        StatsdReporter statsd,
                        Duration drainTimeout,
                        AtomicBoolean stopped) {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        try {
            listener.stop();
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Shutdown: listener stop failed", e);
        }
        try {
            dispatcher.stopAndDrain(drainTimeout);
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Shutdown: dispatcher stop failed", e);
        }
        if (statsd != null) {
            try {
                statsd.close();
            } catch (RuntimeException e) {
                LOG.fine("Shutdown: statsd reporter stop failed: " + e.getClass().getSimpleName());
            }
        }
        try {
            statusEndpoint.close();
        } catch (RuntimeException e) {
            LOG.fine("Shutdown: status endpoint stop failed: " + e.getClass().getSimpleName());
        }
    }
}
