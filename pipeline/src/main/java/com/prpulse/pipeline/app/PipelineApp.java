package com.prpulse.pipeline.app;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.prpulse.pipeline.category.CategoryService;
import com.prpulse.pipeline.client.FixtureSourceClient;
import com.prpulse.pipeline.client.GitHubApiClient;
import com.prpulse.pipeline.client.SourceClient;
import com.prpulse.pipeline.config.AppConfig;
import com.prpulse.pipeline.metrics.JdbcMetricsService;
import com.prpulse.pipeline.metrics.MetricsService;
import com.prpulse.pipeline.reconcile.Reconciler;
import com.prpulse.pipeline.store.CategoryStore;
import com.prpulse.pipeline.store.Database;
import com.prpulse.pipeline.store.OrganizationStore;
import com.prpulse.pipeline.store.PullRequestStore;
import com.prpulse.pipeline.store.RepositoryStore;
import com.prpulse.pipeline.store.ReviewStore;
import com.prpulse.pipeline.store.UserStore;
import com.prpulse.pipeline.sync.RetryPolicy;
import com.prpulse.pipeline.sync.Sleeper;
import com.prpulse.pipeline.sync.StaticCredentialProvider;
import com.prpulse.pipeline.sync.SyncMode;
import com.prpulse.pipeline.sync.SyncOrchestrator;
import com.prpulse.pipeline.sync.SyncResult;
import com.prpulse.pipeline.sync.SyncRunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Main entry point of the PR Pulse pipeline. Parses the command, wires the
 * store handle, source client and services once, runs the command and exits
 * with an appropriate status code.
 *
 * <p>Usage:
 * <pre>
 *   java -jar pipeline.jar sync-org 1            # incremental sync of organization 1
 *   java -jar pipeline.jar sync-repo 7 --full    # full sync of repository 7
 *   java -jar pipeline.jar summary 1 30          # 30-day metrics summary as JSON
 *   java -jar pipeline.jar team 1 30 10 4 5      # top 10 contributors in repositories 4 and 5
 * </pre>
 */
public class PipelineApp implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(PipelineApp.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private final AppConfig config;
    private final Database database;
    private final ExecutorService executor;
    private final OrganizationStore organizations;
    private final RepositoryStore repositories;
    private final SyncOrchestrator orchestrator;
    private final MetricsService metrics;
    private final CategoryService categories;
    private final ObjectMapper objectMapper;

    PipelineApp(AppConfig config, Clock clock) {
        this.config = config;
        this.database = new Database(config.getDatabaseUrl(), config.getDatabaseUsername(),
                config.getDatabasePassword(), config.getSyncConcurrency() + 2);
        database.applySchema();

        this.organizations = new OrganizationStore(database.jdbc());
        this.repositories = new RepositoryStore(database.jdbc());
        PullRequestStore pullRequests = new PullRequestStore(database.jdbc());
        Reconciler reconciler = new Reconciler(organizations, repositories, pullRequests,
                new ReviewStore(database.jdbc()), new UserStore(database.jdbc()));

        StaticCredentialProvider credentials = new StaticCredentialProvider(
                StaticCredentialProvider.parseTokens(config.getInstallationTokens()), config.getGithubToken());
        RetryPolicy retryPolicy = new RetryPolicy(config.getSyncMaxAttempts(),
                RetryPolicy.DEFAULT_INITIAL_BACKOFF, RetryPolicy.DEFAULT_MAX_BACKOFF, Sleeper.THREAD);

        this.executor = Executors.newFixedThreadPool(config.getSyncConcurrency());
        this.orchestrator = new SyncOrchestrator(createSourceClient(config), reconciler, organizations,
                repositories, credentials, retryPolicy, executor, clock);
        this.metrics = new JdbcMetricsService(database, clock);
        this.categories = new CategoryService(new CategoryStore(database.jdbc()), pullRequests);

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public static void main(String[] args) {
        Command command;
        try {
            command = Command.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(Command.USAGE);
            System.exit(EXIT_USAGE);
            return;
        }

        logger.info("Starting PR Pulse pipeline (command: {})", command.name());
        int exitCode;
        try (PipelineApp app = new PipelineApp(new AppConfig(), Clock.systemUTC())) {
            exitCode = app.execute(command);
        } catch (Exception e) {
            logger.error("Fatal error running {}", command.name(), e);
            exitCode = EXIT_FAILURE;
        }
        System.exit(exitCode);
    }

    int execute(Command command) throws JsonProcessingException {
        switch (command.name()) {
            case "discover":
                return report(orchestrator.discoverOrganizations(config.getGithubToken()));
            case "sync-org":
                return report(orchestrator.syncOrganization(command.longArg(0), modeOf(command)));
            case "sync-repo":
                return report(orchestrator.syncRepository(command.longArg(0), modeOf(command)));
            case "summary":
                return print(metrics.getSummary(command.longArg(0),
                        command.intArg(1, config.getMetricsWindowDays())));
            case "timeseries":
                return print(metrics.getTimeSeries(command.longArg(0), command.intArg(1),
                        command.optionalLongArg(2)));
            case "team":
                return print(metrics.getTeamPerformance(command.longArg(0),
                        command.intArg(1, config.getMetricsWindowDays()), command.intArg(2, 10),
                        command.longArgsFrom(3)));
            case "distribution":
                return print(metrics.getCategoryDistribution(command.longArg(0),
                        command.intArg(1, config.getMetricsWindowDays())));
            case "insights":
                return print(metrics.getRepositoryInsights(command.longArg(0),
                        command.intArg(1, MetricsService.DEFAULT_INSIGHTS_WINDOW_DAYS)));
            case "categories":
                return print(categories.listForOrganization(command.longArg(0)));
            case "seed-categories":
                return print(Map.of("created", categories.seedDefaults()));
            case "link-installation":
                return updated(organizations.setInstallationId(command.longArg(0), command.arg(1)),
                        "organization " + command.longArg(0));
            case "track":
                return updated(repositories.setTracked(command.longArg(0), Boolean.parseBoolean(command.arg(1))),
                        "repository " + command.longArg(0));
            default:
                throw new IllegalArgumentException("Unknown command: " + command.name());
        }
    }

    private int report(SyncResult result) throws JsonProcessingException {
        print(result);
        if (result.status() == SyncRunState.FAILED || result.hasErrors()) {
            logger.warn("Sync {} finished as {} with {} errors", result.runId(), result.status(),
                    result.errors().size());
            return EXIT_FAILURE;
        }
        return EXIT_OK;
    }

    private int updated(boolean found, String target) {
        if (!found) {
            System.err.println("No such " + target);
            return EXIT_FAILURE;
        }
        System.out.println("Updated " + target);
        return EXIT_OK;
    }

    private int print(Object value) throws JsonProcessingException {
        System.out.println(objectMapper.writeValueAsString(value));
        return EXIT_OK;
    }

    private static SyncMode modeOf(Command command) {
        return command.full() ? SyncMode.FULL : SyncMode.INCREMENTAL;
    }

    private static SourceClient createSourceClient(AppConfig config) {
        if (config.isFixtureMode()) {
            logger.info("Using fixture source at {}", config.getFixtureDir());
            return new FixtureSourceClient(Path.of(config.getFixtureDir()));
        }
        return new GitHubApiClient(config.getGithubApiUrl(), Duration.ofSeconds(config.getHttpTimeoutSeconds()));
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        database.close();
    }
}
