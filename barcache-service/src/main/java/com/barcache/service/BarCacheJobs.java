package com.barcache.service;

import com.barcache.service.backfill.BackfillCheckpoint;
import com.barcache.service.backfill.BackfillPlan;
import com.barcache.service.backfill.BackfillPlanner;
import com.barcache.service.backfill.BackfillResult;
import com.barcache.service.backfill.CheckpointStore;
import com.barcache.service.backfill.HistoricalBackfillManager;
import com.barcache.service.calendar.TradingCalendar;
import com.barcache.service.client.HttpClientFactory;
import com.barcache.service.client.InstrumentMaster;
import com.barcache.service.client.SmartApiClient;
import com.barcache.service.config.BarCacheConfig;
import com.barcache.service.data.sqlite.SqliteBarCache;
import com.barcache.service.fetch.FetchCoordinator;
import com.barcache.service.fetch.ResilientFetchExecutor;
import com.barcache.service.fetch.Sleeper;
import com.barcache.service.health.CacheHealthMonitor;
import com.barcache.service.health.HealthReport;
import com.barcache.service.update.IncrementalUpdater;
import com.barcache.service.update.UpdateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Command-line entry point for scheduled cache jobs.
 * <pre>
 *   backfill &lt;years&gt; [--no-resume] [--dry-run] SYMBOL...
 *   update [SYMBOL...]
 *   cleanup &lt;days&gt;
 *   health
 * </pre>
 * Exit codes: 0 success, 1 some symbols failed or the cache is unhealthy, 2 usage or setup error.
 */
public class BarCacheJobs {
    private static final Logger LOG = LoggerFactory.getLogger(BarCacheJobs.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURES = 1;
    public static final int EXIT_ERROR = 2;

    private static final String USAGE = String.join(System.lineSeparator(),
        "Usage:",
        "  backfill <years> [--no-resume] [--dry-run] SYMBOL...",
        "  update [SYMBOL...]",
        "  cleanup <days>",
        "  health");

    public static void main(String[] args) {
        int code;
        try {
            code = run(args, BarCacheConfig.load(), Clock.systemUTC());
        } catch (IllegalArgumentException e) {
            LOG.error("Invalid configuration: {}", e.getMessage());
            code = EXIT_ERROR;
        }
        System.exit(code);
    }

    static int run(String[] args, BarCacheConfig config, Clock clock) {
        Command command;
        try {
            command = Command.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(USAGE);
            return EXIT_ERROR;
        }

        try (Jobs jobs = Jobs.create(config, clock)) {
            return command.execute(jobs);
        } catch (IOException e) {
            LOG.error("{} job failed", command.name, e);
            return EXIT_ERROR;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.error("{} job interrupted", command.name);
            return EXIT_ERROR;
        }
    }

    /**
     * Parsed command line.
     */
    static final class Command {
        final String name;
        final int amount;
        final boolean resume;
        final boolean dryRun;
        final List<String> symbols;

        private Command(String name, int amount, boolean resume, boolean dryRun, List<String> symbols) {
            this.name = name;
            this.amount = amount;
            this.resume = resume;
            this.dryRun = dryRun;
            this.symbols = symbols;
        }

        static Command parse(String[] args) {
            if (args == null || args.length == 0) {
                throw new IllegalArgumentException("Missing command");
            }
            List<String> rest = new ArrayList<>(Arrays.asList(args).subList(1, args.length));
            switch (args[0]) {
                case "backfill": {
                    int years = parsePositive(rest, "years");
                    boolean resume = !rest.remove("--no-resume");
                    boolean dryRun = rest.remove("--dry-run");
                    if (rest.isEmpty()) {
                        throw new IllegalArgumentException("backfill needs at least one symbol");
                    }
                    return new Command("backfill", years, resume, dryRun, rest);
                }
                case "update":
                    return new Command("update", 0, true, false, rest);
                case "cleanup": {
                    int days = parsePositive(rest, "days");
                    if (!rest.isEmpty()) {
                        throw new IllegalArgumentException("Unexpected arguments: " + rest);
                    }
                    return new Command("cleanup", days, true, false, List.of());
                }
                case "health":
                    if (!rest.isEmpty()) {
                        throw new IllegalArgumentException("Unexpected arguments: " + rest);
                    }
                    return new Command("health", 0, true, false, List.of());
                default:
                    throw new IllegalArgumentException("Unknown command: " + args[0]);
            }
        }

        private static int parsePositive(List<String> rest, String what) {
            if (rest.isEmpty()) {
                throw new IllegalArgumentException("Missing <" + what + ">");
            }
            String value = rest.remove(0);
            try {
                int n = Integer.parseInt(value);
                if (n < 1) {
                    throw new IllegalArgumentException("<" + what + "> must be positive: " + value);
                }
                return n;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("<" + what + "> is not a number: " + value, e);
            }
        }

        int execute(Jobs jobs) throws IOException, InterruptedException {
            switch (name) {
                case "backfill": {
                    if (dryRun) {
                        BackfillPlan plan = jobs.planner.plan(symbols, amount);
                        for (BackfillPlan.SymbolPlan symbol : plan.symbols()) {
                            LOG.info("Would backfill {}: {} of {} trading days missing",
                                symbol.symbol(), symbol.missingDates().size(), symbol.tradingDays());
                        }
                        return EXIT_OK;
                    }
                    BackfillResult result = jobs.backfill.run(symbols, amount,
                        jobs.config.getBackfillBatchSize(), resume);
                    for (BackfillCheckpoint.FailedSymbol failed : result.failed()) {
                        LOG.warn("Backfill failed: {} - {}", failed.symbol(), failed.reason());
                    }
                    return result.exitCode();
                }
                case "update": {
                    UpdateResult result = symbols.isEmpty() ? jobs.updater.runAll() : jobs.updater.run(symbols);
                    return result.exitCode();
                }
                case "cleanup": {
                    int deleted = jobs.cache.purgeStale(Duration.ofDays(amount));
                    LOG.info("Cleanup removed {} bars older than {} days", deleted, amount);
                    return EXIT_OK;
                }
                default: {
                    HealthReport report = jobs.health.report();
                    System.out.println(CacheHealthMonitor.toJson(report));
                    return report.exitCode();
                }
            }
        }
    }

    /**
     * Components wired from configuration, closed when the job ends.
     */
    static final class Jobs implements AutoCloseable {
        final BarCacheConfig config;
        final SqliteBarCache cache;
        final ResilientFetchExecutor executor;
        final HistoricalBackfillManager backfill;
        final BackfillPlanner planner;
        final IncrementalUpdater updater;
        final CacheHealthMonitor health;

        private Jobs(BarCacheConfig config, SqliteBarCache cache, ResilientFetchExecutor executor,
                     HistoricalBackfillManager backfill, BackfillPlanner planner, IncrementalUpdater updater,
                     CacheHealthMonitor health) {
            this.config = config;
            this.cache = cache;
            this.executor = executor;
            this.backfill = backfill;
            this.planner = planner;
            this.updater = updater;
            this.health = health;
        }

        static Jobs create(BarCacheConfig config, Clock clock) throws IOException {
            SqliteBarCache cache = new SqliteBarCache(config.getDatabasePath(), config.getCacheTtl(), clock);
            try {
                InstrumentMaster instruments = InstrumentMaster.load(config.getInstrumentMasterFile(),
                    HttpClientFactory.getMapper());
                SmartApiClient client = new SmartApiClient(HttpClientFactory.getClient(), HttpClientFactory.getMapper(),
                    config.getApiBaseUrl(), config.getApiKey(), config::getAccessToken, instruments,
                    config.getMarketZone());

                ResilientFetchExecutor executor = ResilientFetchExecutor.fromConfig(config, clock);
                FetchCoordinator coordinator = new FetchCoordinator(cache, client, executor);
                TradingCalendar calendar = new TradingCalendar(config.getHolidays());
                CheckpointStore checkpoints = new CheckpointStore(config.getCheckpointPath());

                HistoricalBackfillManager backfill = new HistoricalBackfillManager(coordinator, checkpoints,
                    config, clock, Sleeper.system());
                BackfillPlanner planner = new BackfillPlanner(cache, calendar, config, clock);
                IncrementalUpdater updater =
                    new IncrementalUpdater(coordinator, cache, calendar, config, clock);
                CacheHealthMonitor health = new CacheHealthMonitor(cache, checkpoints, calendar, config, clock);
                return new Jobs(config, cache, executor, backfill, planner, updater, health);
            } catch (IOException | RuntimeException e) {
                cache.close();
                throw e;
            }
        }

        @Override
        public void close() {
            executor.close();
            cache.close();
        }
    }
}
