package io.provtrack.cli;

import io.provtrack.config.ProvTrackConfig;
import io.provtrack.revision.GitRevisions;
import io.provtrack.revision.Revisions;
import io.provtrack.revision.WorkingTreeRevisions;
import io.provtrack.runtime.ProvTrackRuntime;
import io.provtrack.runtime.StepDefinition;
import io.provtrack.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "provtrack",
        mixinStandardHelpOptions = true,
        description = "Provenance tracking for command-line pipelines",
        subcommands = {
                ProvTrackCommand.InitCommand.class,
                ProvTrackCommand.RunCommand.class,
                ProvTrackCommand.StatusCommand.class,
                ProvTrackCommand.UpdateCommand.class,
                ProvTrackCommand.PlansCommand.class,
                ProvTrackCommand.InvalidateCommand.class,
                ProvTrackCommand.LogCommand.class,
                ProvTrackCommand.JournalCommand.class
        }
)
public final class ProvTrackCommand implements Runnable {
    @Option(names = {"--root"}, description = "Repository root directory", defaultValue = ".")
    String root;

    @Option(names = {"--revision"}, description = "Revision to compare against", defaultValue = ProvTrackConfig.DEFAULT_REVISION)
    String revision;

    @Option(names = {"--working-tree"}, description = "Checksum files on disk instead of asking git")
    boolean workingTree;

    @Option(names = {"--step-timeout-ms"}, description = "Timeout for one executed step",
            defaultValue = "" + ProvTrackConfig.DEFAULT_STEP_TIMEOUT_MS)
    long stepTimeoutMs;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | run | status | update | plans | invalidate | log | journal");
    }

    ProvTrackConfig config() {
        return ProvTrackConfig.fromRoot(root, revision).withStepTimeoutMs(stepTimeoutMs);
    }

    ProvTrackRuntime runtime() {
        return new ProvTrackRuntime(config());
    }

    Revisions revisions() {
        Path rootDir = config().rootDir();
        return workingTree ? new WorkingTreeRevisions(rootDir) : new GitRevisions(rootDir);
    }

    @Command(name = "init", description = "Create the metadata directory and object catalog")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        ProvTrackCommand parent;

        @Override
        public Integer call() {
            ProvTrackRuntime.InitOutcome outcome = parent.runtime().init();
            System.out.println(Jsons.toJson(outcome));
            return 0;
        }
    }

    @Command(name = "run", description = "Record (and by default execute) a step from a JSON step file")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        ProvTrackCommand parent;

        @Option(names = {"--file"}, required = true, description = "Step JSON file path")
        String file;

        @Option(names = {"--no-execute"}, description = "Record the step without running it")
        boolean noExecute;

        @Override
        public Integer call() {
            StepDefinition step = StepDefinition.read(Path.of(file));
            ProvTrackRuntime.RunOutcome outcome = parent.runtime().run(step, parent.revisions(), !noExecute);
            System.out.println(Jsons.toJson(outcome));
            return 0;
        }
    }

    @Command(name = "status", description = "Show outputs that are stale because their inputs changed")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        ProvTrackCommand parent;

        @Override
        public Integer call() {
            ProvTrackRuntime.StatusReport report = parent.runtime().status(parent.revisions());
            if (!report.cycles().isEmpty()) {
                System.err.println("warning: plan graph contains cycles: " + report.cycles());
            }
            if (!report.blockedPlans().isEmpty()) {
                System.err.println("warning: plans blocked by deleted inputs: " + report.blockedPlans());
            }
            System.out.println(Jsons.toJson(report));
            return 0;
        }
    }

    @Command(name = "update", description = "Re-run every plan downstream of a modified input")
    static final class UpdateCommand implements Callable<Integer> {
        @ParentCommand
        ProvTrackCommand parent;

        @Option(names = {"--dry-run"}, description = "Only print the plans that would run")
        boolean dryRun;

        @Override
        public Integer call() {
            ProvTrackRuntime.UpdatePlan plan = parent.runtime().update(parent.revisions(), dryRun);
            if (!plan.blocked().isEmpty()) {
                System.err.println("warning: plans blocked by deleted inputs: " + plan.blocked());
            }
            System.out.println(Jsons.toJson(plan));
            return 0;
        }
    }

    @Command(name = "plans", description = "List recorded plans")
    static final class PlansCommand implements Callable<Integer> {
        @ParentCommand
        ProvTrackCommand parent;

        @Option(names = {"--all"}, description = "Include invalidated plans")
        boolean all;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().plans(all)));
            return 0;
        }
    }

    @Command(name = "invalidate", description = "Soft-delete a plan so it no longer takes part in updates")
    static final class InvalidateCommand implements Callable<Integer> {
        @ParentCommand
        ProvTrackCommand parent;

        @Parameters(index = "0", description = "Plan name or id")
        String plan;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().invalidate(plan)));
            return 0;
        }
    }

    @Command(name = "log", description = "Show recorded activities, oldest first")
    static final class LogCommand implements Callable<Integer> {
        @ParentCommand
        ProvTrackCommand parent;

        @Option(names = {"--limit"}, defaultValue = "20", description = "Number of latest activities (0 = all)")
        int limit;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().log(limit)));
            return 0;
        }
    }

    @Command(name = "journal", description = "Show or verify the command journal")
    static final class JournalCommand implements Callable<Integer> {
        @ParentCommand
        ProvTrackCommand parent;

        @Option(names = {"--lines"}, defaultValue = "20", description = "Number of latest entries")
        int lines;

        @Option(names = {"--verify"}, description = "Check the hash chain instead of printing entries")
        boolean verify;

        @Override
        public Integer call() {
            ProvTrackRuntime runtime = parent.runtime();
            if (!verify) {
                System.out.println(Jsons.toJson(runtime.journalTail(lines)));
                return 0;
            }
            int broken = runtime.verifyJournal();
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("valid", broken == 0);
            out.put("first_broken_line", broken);
            System.out.println(Jsons.toJson(out));
            return broken == 0 ? 0 : 1;
        }
    }
}
