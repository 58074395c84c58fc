package treeqa.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import treeqa.model.Step;
import treeqa.model.StepKind;
import treeqa.model.StructuralPath;
import treeqa.model.TreeNode;
import treeqa.model.ValidationResult;
import treeqa.player.LocatorNotFoundException;
import treeqa.player.ReplayFinder;
import treeqa.recorder.LocatorResolver;
import treeqa.recorder.PumpedOwnerContext;
import treeqa.recorder.RecorderConfig;
import treeqa.recorder.Resolution;
import treeqa.recorder.StepValidator;
import treeqa.snapshot.SnapshotNode;
import treeqa.snapshot.TreeSnapshotIO;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * PicoCLI entry-point working on JSON control-tree snapshots.
 *
 * <p>Sub-commands:
 * <ul>
 *   <li>{@code treeqa find}: look a locator up the way replay does</li>
 *   <li>{@code treeqa resolve}: compute and validate the locator the recorder would record</li>
 *   <li>{@code treeqa dump}: print the tree with each node's structural path</li>
 * </ul>
 *
 * <p>Exit codes: 0 success, 1 not found or validation failed, 2 unreadable input.
 */
@Command(
        name        = "treeqa",
        description = "Record/validate/replay locators against UI control tree snapshots",
        version     = "1.0.0-SNAPSHOT",
        mixinStandardHelpOptions = true,
        subcommands = {
                TreeQACLI.FindCommand.class,
                TreeQACLI.ResolveCommand.class,
                TreeQACLI.DumpCommand.class
        }
)
public class TreeQACLI implements Callable<Integer> {

    static final int EXIT_OK        = 0;
    static final int EXIT_NOT_FOUND = 1;
    static final int EXIT_BAD_INPUT = 2;

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return EXIT_OK;
    }

    // ── Entry-point ─────────────────────────────────────────────────────────

    public static void main(String[] args) {
        int exit = new CommandLine(new TreeQACLI()).execute(args);
        System.exit(exit);
    }

    // ── Sub-commands ─────────────────────────────────────────────────────────

    @Command(
            name        = "find",
            description = "Find the control a locator designates (stable id, display name or structural path)",
            mixinStandardHelpOptions = true
    )
    static class FindCommand implements Callable<Integer> {

        private static final Logger log = LoggerFactory.getLogger(FindCommand.class);

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", description = "Path to tree snapshot JSON file")
        Path snapshot;

        @Parameters(index = "1", description = "Locator: bare identifier or Type[idx]/Type[idx]/...")
        String locator;

        @Override
        public Integer call() {
            PrintWriter out = spec.commandLine().getOut();
            SnapshotNode root = load(snapshot, spec);
            if (root == null) return EXIT_BAD_INPUT;

            ReplayFinder finder = new ReplayFinder(root);
            ReplayFinder.Lookup lookup = finder.lookup(locator);
            if (!lookup.found()) {
                LocatorNotFoundException e = finder.notFound(locator, lookup.failure());
                spec.commandLine().getErr().println(e.getMessage());
                return EXIT_NOT_FOUND;
            }
            TreeNode node = lookup.candidates().get(0);
            log.debug("'{}' matched {} by {}", locator, node, lookup.strategy());
            out.printf("%s  [%s by %s]%n", describe(node), StructuralPath.of(node), lookup.strategy());
            if (lookup.ambiguous()) {
                out.printf("warning: %d controls match, first one shown%n", lookup.candidates().size());
            }
            return EXIT_OK;
        }
    }

    @Command(
            name        = "resolve",
            description = "Compute the locator the recorder would record for the control at a structural path",
            mixinStandardHelpOptions = true
    )
    static class ResolveCommand implements Callable<Integer> {

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", description = "Path to tree snapshot JSON file")
        Path snapshot;

        @Parameters(index = "1", description = "Exact structural path of the control, e.g. Panel[0]/Button[1]")
        String path;

        @Option(names = "--prefer-display-name", negatable = true,
                description = "Try the display name before the structural path (default: from config)")
        Boolean preferDisplayName;

        @Option(names = "--structural-path", negatable = true,
                description = "Allow structural-path locators (default: from config)")
        Boolean allowStructuralPath;

        @Override
        public Integer call() {
            PrintWriter out = spec.commandLine().getOut();
            SnapshotNode root = load(snapshot, spec);
            if (root == null) return EXIT_BAD_INPUT;

            TreeNode node;
            try {
                node = navigateExact(root, path);
            } catch (IllegalArgumentException e) {
                spec.commandLine().getErr().println(e.getMessage());
                return EXIT_BAD_INPUT;
            }
            if (node == null) {
                spec.commandLine().getErr().println("No control at exact path: " + path);
                return EXIT_NOT_FOUND;
            }

            RecorderConfig config = new RecorderConfig();
            if (preferDisplayName != null) config.setPreferDisplayNameFallback(preferDisplayName);
            if (allowStructuralPath != null) config.setAllowStructuralPathFallback(allowStructuralPath);

            Resolution r = new LocatorResolver(config, new PumpedOwnerContext()).resolve(node);
            Step step = new Step(StepKind.CLICK, r.locator(), null, r.warning(), Instant.now());
            ValidationResult v = new StepValidator(new ReplayFinder(root)).validate(step, r.target());

            out.printf("control:    %s%n", describe(node));
            out.printf("locator:    %s%n", r.locator().value());
            out.printf("kind:       %s%n", r.locator().kind());
            out.printf("quality:    %s%n", step.quality());
            if (r.warning() != null) out.printf("warning:    %s%n", r.warning());
            out.printf("validation: %s%n", v.ok() ? "ok" : "FAILED: " + v.reason());
            return v.ok() ? EXIT_OK : EXIT_NOT_FOUND;
        }
    }

    @Command(
            name        = "dump",
            description = "Print a tree snapshot with each node's structural path",
            mixinStandardHelpOptions = true
    )
    static class DumpCommand implements Callable<Integer> {

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", description = "Path to tree snapshot JSON file")
        Path snapshot;

        @Override
        public Integer call() {
            SnapshotNode root = load(snapshot, spec);
            if (root == null) return EXIT_BAD_INPUT;
            dump(root, 0, spec.commandLine().getOut());
            return EXIT_OK;
        }

        private static void dump(TreeNode node, int depth, PrintWriter out) {
            String path = node.isRootBoundary() ? "(root)" : StructuralPath.of(node);
            out.printf("%s%s  [%s]%n", "  ".repeat(depth), describe(node), path);
            for (TreeNode child : node.orderedChildren()) {
                dump(child, depth + 1, out);
            }
        }
    }

    // ── Shared helpers ──────────────────────────────────────────────────────

    private static SnapshotNode load(Path file, CommandSpec spec) {
        if (!Files.exists(file)) {
            spec.commandLine().getErr().println("Snapshot file not found: " + file.toAbsolutePath());
            return null;
        }
        try {
            return TreeSnapshotIO.read(file);
        } catch (IOException | TreeSnapshotIO.SnapshotValidationException e) {
            spec.commandLine().getErr().println("Cannot read snapshot " + file + ": " + e.getMessage());
            return null;
        }
    }

    /** Follows {@code path} without any fault tolerance; {@code null} when a segment is absent. */
    static TreeNode navigateExact(TreeNode root, String path) {
        List<StructuralPath.Segment> segments = StructuralPath.parse(path);
        TreeNode current = root;
        for (StructuralPath.Segment seg : segments) {
            List<TreeNode> sameType = current.orderedChildren().stream()
                    .filter(c -> seg.typeTag().equals(c.typeTag()))
                    .toList();
            if (seg.index() >= sameType.size()) return null;
            current = sameType.get(seg.index());
        }
        return current;
    }

    static String describe(TreeNode node) {
        StringBuilder sb = new StringBuilder(node.typeTag());
        if (node.hasStableId()) sb.append(" #").append(node.stableId());
        if (node.hasDisplayName()) sb.append(" '").append(node.displayName()).append('\'');
        return sb.toString();
    }
}
