package com.barcache.service;

import com.barcache.service.config.BarCacheConfig;
import com.barcache.service.support.MutableClock;
import com.barcache.service.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BarCacheJobsTest {

    @TempDir
    Path tempDir;

    private BarCacheConfig config;
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        config = TestFixtures.config(tempDir);
        clock = new MutableClock(Instant.parse("2024-01-10T12:00:00Z"));
    }

    private int run(String... args) {
        return BarCacheJobs.run(args, config, clock);
    }

    @Nested
    @DisplayName("Argument parsing")
    class ParseTests {

        @Test
        @DisplayName("Usage errors exit with 2 and open nothing")
        void usageErrors() {
            assertEquals(BarCacheJobs.EXIT_ERROR, run());
            assertEquals(BarCacheJobs.EXIT_ERROR, run("rebuild"));
            assertEquals(BarCacheJobs.EXIT_ERROR, run("backfill"));
            assertEquals(BarCacheJobs.EXIT_ERROR, run("backfill", "two", "TCS"));
            assertEquals(BarCacheJobs.EXIT_ERROR, run("backfill", "0", "TCS"));
            assertEquals(BarCacheJobs.EXIT_ERROR, run("backfill", "2"));
            assertEquals(BarCacheJobs.EXIT_ERROR, run("cleanup"));
            assertEquals(BarCacheJobs.EXIT_ERROR, run("health", "now"));

            assertFalse(Files.exists(config.getDatabasePath()));
        }

        @Test
        @DisplayName("Backfill arguments")
        void backfillCommand() {
            BarCacheJobs.Command command = BarCacheJobs.Command.parse(
                new String[]{"backfill", "3", "RELIANCE", "--no-resume", "TCS"});

            assertEquals("backfill", command.name);
            assertEquals(3, command.amount);
            assertFalse(command.resume);
            assertFalse(command.dryRun);
            assertEquals(List.of("RELIANCE", "TCS"), command.symbols);
        }

        @Test
        @DisplayName("Dry-run flag is taken out of the symbol list")
        void dryRunFlag() {
            BarCacheJobs.Command command = BarCacheJobs.Command.parse(
                new String[]{"backfill", "2", "--dry-run", "INFY"});

            assertTrue(command.dryRun);
            assertTrue(command.resume);
            assertEquals(List.of("INFY"), command.symbols);
        }

        @Test
        @DisplayName("Update without symbols updates everything cached")
        void updateCommand() {
            BarCacheJobs.Command command = BarCacheJobs.Command.parse(new String[]{"update"});

            assertEquals("update", command.name);
            assertTrue(command.symbols.isEmpty());
        }
    }

    @Nested
    @DisplayName("Jobs against an empty data directory")
    class JobTests {

        @Test
        @DisplayName("Health of an empty cache exits 1")
        void healthEmpty() {
            assertEquals(BarCacheJobs.EXIT_FAILURES, run("health"));
            assertTrue(Files.exists(config.getDatabasePath()));
        }

        @Test
        @DisplayName("Cleanup and update-all succeed on an empty cache")
        void cleanupAndUpdate() {
            assertEquals(BarCacheJobs.EXIT_OK, run("cleanup", "30"));
            assertEquals(BarCacheJobs.EXIT_OK, run("update"));
        }

        @Test
        @DisplayName("Backfill of unresolvable symbols exits 1 and keeps a checkpoint")
        void backfillUnknownSymbols() {
            assertEquals(BarCacheJobs.EXIT_FAILURES, run("backfill", "1", "NOSUCH"));
            assertTrue(Files.exists(config.getCheckpointPath()));
        }

        @Test
        @DisplayName("Dry-run backfill exits 0 without calling out or writing a checkpoint")
        void backfillDryRun() {
            assertEquals(BarCacheJobs.EXIT_OK, run("backfill", "1", "--dry-run", "NOSUCH"));
            assertFalse(Files.exists(config.getCheckpointPath()));
        }
    }
}
