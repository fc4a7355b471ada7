package io.judgebridge.cli;

import io.judgebridge.config.BridgeSettings;
import io.judgebridge.config.JudgeBridgeConfig;
import io.judgebridge.model.SubmissionDispatchRequest;
import io.judgebridge.observability.AuditLogger;
import io.judgebridge.observability.AuditResultSink;
import io.judgebridge.observability.PrometheusFormatter;
import io.judgebridge.server.JudgeServer;
import io.judgebridge.session.BoundedResultSink;
import io.judgebridge.session.JudgeRegistry;
import io.judgebridge.session.JudgeScheduler;
import io.judgebridge.session.SessionContext;
import io.judgebridge.storage.Database;
import io.judgebridge.storage.JdbcJudgeAuthenticator;
import io.judgebridge.storage.JdbcSubmissionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

@Command(
        name = "judgebridge",
        mixinStandardHelpOptions = true,
        description = "Bridge between the grading front-end and remote judge workers",
        subcommands = {
                JudgeBridgeCommand.InitCommand.class,
                JudgeBridgeCommand.JudgeAddCommand.class,
                JudgeBridgeCommand.SubmissionAddCommand.class,
                JudgeBridgeCommand.ServeCommand.class,
                JudgeBridgeCommand.AuditVerifyCommand.class
        }
)
public final class JudgeBridgeCommand implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(JudgeBridgeCommand.class);

    @Option(names = {"--root"}, description = "Data root directory", defaultValue = "data")
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | judge-add | submission-add | serve | audit-verify");
    }

    JudgeBridgeConfig config() {
        return JudgeBridgeConfig.fromRoot(root);
    }

    Database database() {
        Database database = new Database(config());
        database.init();
        return database;
    }

    @Command(name = "init", description = "Create the data directory and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        JudgeBridgeCommand parent;

        @Override
        public Integer call() {
            parent.database();
            System.out.println("Initialized judge bridge at: " + parent.config().rootDir());
            return 0;
        }
    }

    @Command(name = "judge-add", description = "Create or replace a judge credential")
    static final class JudgeAddCommand implements Callable<Integer> {
        @ParentCommand
        JudgeBridgeCommand parent;

        @Option(names = {"--id"}, required = true, description = "Judge name")
        String id;

        @Option(names = {"--key"}, required = true, description = "Judge key")
        String key;

        @Option(names = {"--blocked"}, description = "Store the judge as blocked")
        boolean blocked;

        @Override
        public Integer call() {
            new JdbcJudgeAuthenticator(parent.database()).upsert(id, key, blocked);
            System.out.println("Stored judge: " + id + (blocked ? " (blocked)" : ""));
            return 0;
        }
    }

    @Command(name = "submission-add", description = "Store dispatch metadata for a submission")
    static final class SubmissionAddCommand implements Callable<Integer> {
        @ParentCommand
        JudgeBridgeCommand parent;

        @Option(names = {"--id"}, required = true)
        String id;

        @Option(names = {"--time-limit"}, required = true, description = "Seconds")
        double timeLimit;

        @Option(names = {"--memory-limit"}, required = true, description = "Kilobytes")
        long memoryLimit;

        @Option(names = {"--short-circuit"})
        boolean shortCircuit;

        @Option(names = {"--pretests-only"})
        boolean pretestsOnly;

        @Option(names = {"--contest"})
        Long contest;

        @Option(names = {"--attempt"})
        Integer attempt;

        @Option(names = {"--user"}, required = true)
        String user;

        @Override
        public Integer call() {
            new JdbcSubmissionStore(parent.database()).put(id, new SubmissionDispatchRequest(
                    timeLimit, memoryLimit, shortCircuit, pretestsOnly, contest, attempt, user));
            System.out.println("Stored submission: " + id);
            return 0;
        }
    }

    @Command(name = "serve", description = "Accept judge connections until interrupted")
    static final class ServeCommand implements Callable<Integer> {
        @ParentCommand
        JudgeBridgeCommand parent;

        @Option(names = {"--bind"}, defaultValue = JudgeBridgeConfig.DEFAULT_BIND_HOST)
        String bind;

        @Option(names = {"--port"})
        int port = JudgeBridgeConfig.DEFAULT_PORT;

        @Override
        public Integer call() throws Exception {
            JudgeBridgeConfig config = parent.config();
            Database database = parent.database();
            BridgeSettings settings = BridgeSettings.load(config.settingsFile());
            AuditLogger audit = new AuditLogger(config.auditFile());
            JudgeRegistry registry = new JudgeRegistry();
            ScheduledExecutorService timers = Executors.newScheduledThreadPool(2);
            ExecutorService storeCalls = Executors.newFixedThreadPool(4);
            BoundedResultSink sink = new BoundedResultSink(
                    new AuditResultSink(audit), settings.resultQueueCapacity(), settings.storeTimeoutMs());
            SessionContext context = new SessionContext(
                    settings,
                    new JdbcJudgeAuthenticator(database),
                    new JdbcSubmissionStore(database),
                    sink,
                    registry,
                    loggingScheduler(),
                    timers,
                    storeCalls,
                    audit,
                    Clock.systemUTC()
            );
            JudgeServer server = new JudgeServer(bind, port, context);
            Runnable shutdown = shutdownOnce(server, timers, storeCalls, sink);
            CountDownLatch stopped = new CountDownLatch(1);
            try {
                server.start();
                timers.scheduleAtFixedRate(
                        () -> writeMetrics(config.metricsFile(), registry),
                        settings.pingIntervalMs(),
                        settings.pingIntervalMs(),
                        TimeUnit.MILLISECONDS
                );
                // The JVM exits once the hook returns, so the hook itself has to flush queued results.
                Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                    shutdown.run();
                    stopped.countDown();
                }, "judgebridge-shutdown"));
                System.out.println("Judge server started on " + bind + ":" + server.localPort());
                stopped.await();
            } finally {
                shutdown.run();
            }
            return 0;
        }

        // Judges go first so no new results arrive while the sink drains.
        static Runnable shutdownOnce(
                JudgeServer server,
                ExecutorService timers,
                ExecutorService storeCalls,
                BoundedResultSink sink
        ) {
            AtomicBoolean done = new AtomicBoolean(false);
            return () -> {
                if (!done.compareAndSet(false, true)) {
                    return;
                }
                server.close();
                timers.shutdownNow();
                storeCalls.shutdownNow();
                sink.close();
                if (sink.dropped() > 0L) {
                    log.warn("Result sink dropped {} events before shutdown", sink.dropped());
                }
            };
        }

        // Standalone mode has no scheduler to hand work back to; record it.
        private static JudgeScheduler loggingScheduler() {
            return new JudgeScheduler() {
                @Override
                public void rescheduleSubmission(String judge, String submissionId) {
                    log.warn("Submission {} needs rescheduling (judge {} lost it)", submissionId, judge);
                }

                @Override
                public void submissionNeedsAttention(String judge, String submissionId, String message) {
                    log.warn("Submission {} needs attention after internal error on {}: {}", submissionId, judge, message);
                }
            };
        }

        private static void writeMetrics(Path target, JudgeRegistry registry) {
            try {
                Files.createDirectories(target.getParent());
                Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
                Files.writeString(tmp, PrometheusFormatter.format(registry.snapshot()), StandardCharsets.UTF_8);
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (IOException | RuntimeException e) {
                log.warn("Failed to write metrics to {}: {}", target, e.getMessage());
            }
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit log hash chain")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        JudgeBridgeCommand parent;

        @Override
        public Integer call() {
            AuditLogger audit = new AuditLogger(parent.config().auditFile());
            long result = audit.verify();
            if (result < 0) {
                System.out.println("Audit chain broken at line " + (-result));
                return 1;
            }
            System.out.println("Audit chain ok: " + result + " rows");
            return 0;
        }
    }
}
