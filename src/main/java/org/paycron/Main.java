package org.paycron;

import org.paycron.config.CliOptions;
import org.paycron.config.ConfigLoader;
import org.paycron.config.LoggingConfigurator;
import org.paycron.config.XmlConfiguration;
import org.paycron.config.utils.EnvProvider;
import org.paycron.config.utils.LogContext;
import org.paycron.exceptions.ConfigurationException;
import org.paycron.lnurl.DestinationResolver;
import org.paycron.nodes.PaymentExecutor;
import org.paycron.nodes.lnd.LndRestClient;
import org.paycron.services.ApplicationJobs;
import org.paycron.services.ExecutorJobDispatcher;
import org.paycron.services.JobScheduler;
import org.paycron.services.jobs.Job;
import org.paycron.services.jobs.JobContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Entry point
 * Load Configuration from Xml
 * Build jobs and verify the payment node
 * Run the scheduler loop until drained or shut down
 */
public class Main {
    static {
        // picks the logback file, must run before the first logger exists
        EnvProvider.init();
    }

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    private static final Duration FIRING_GRACE_PERIOD =
            Duration.ofSeconds(PaymentExecutor.PAYMENT_TIMEOUT_SECONDS * 2L);

    public static void main(String[] args) {
        LogContext.start("Main");

        try {
            logger.info("[------------ Starting PayCron ------------]");

            CliOptions options = CliOptions.parse(args);
            String configPath = options.configPath() != null ? options.configPath()
                    : EnvProvider.configPath(ConfigLoader.DEFAULT_CONFIG_PATH);

            XmlConfiguration cfg = ConfigLoader.loadConfig(configPath);
            LoggingConfigurator.apply(cfg.logging, options.logPath());
            logger.debug("Configuration loaded from {}", configPath);

            ConfigLoader.ValidConfig config = ConfigLoader.validate(cfg, configPath);

            Clock clock = Clock.systemUTC();
            List<Job> jobs = ApplicationJobs.buildJobs(config.jobs(), new DestinationResolver(), clock);

            ApplicationJobs.verifyNode(config.connection(), LndRestClient::connect);

            JobContext context = ApplicationJobs.buildContext(config, LndRestClient::connect);
            ExecutorJobDispatcher dispatcher = new ExecutorJobDispatcher(context);
            JobScheduler scheduler = new JobScheduler(jobs, dispatcher, clock);

            CountDownLatch stopped = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("[------------ Shutdown initiated ------------]");
                scheduler.shutdown();
                try {
                    if (!stopped.await(FIRING_GRACE_PERIOD.toSeconds() + 5, TimeUnit.SECONDS)) {
                        logger.warn("Shutdown did not complete in time");
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                logger.info("[------------ PayCron shutdown complete ------------]");
            }));

            try {
                JobScheduler.State terminal = scheduler.run();
                logger.info("Scheduler stopped in state {}", terminal);
            } finally {
                dispatcher.stop(FIRING_GRACE_PERIOD);
                stopped.countDown();
            }

        } catch (ConfigurationException e) {
            logger.error("[------------ Startup failed: {} ------------]", e.getMessage(), e);
            System.exit(1);
        } catch (Exception e) {
            logger.error("[------------ PayCron failed: {} ------------]", e.getMessage(), e);
            System.exit(1);
        } finally {
            LogContext.clear();
        }
    }
}
