package treeqa.recorder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import treeqa.codegen.StepRenderer;
import treeqa.codegen.TemplateContext;
import treeqa.model.Locator;
import treeqa.model.Step;
import treeqa.model.StepKind;
import treeqa.model.TreeAccess;
import treeqa.model.TreeNode;
import treeqa.model.ValidationResult;
import treeqa.player.ReplayFinder;
import treeqa.recorder.assertion.AssertionExtractors;
import treeqa.recorder.assertion.AssertionValue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Records user interactions on one UI tree as typed {@link Step}s.
 *
 * <h3>Typical usage</h3>
 * <pre>{@code
 * InteractionSession session = new InteractionSession(tree, new RecorderConfig(), owner);
 * session.attach(inputSource);
 * session.start();
 * // user interacts with the window ...
 * session.stop();
 * Path saved = session.save();
 * }</pre>
 *
 * <p>State machine: {@code OFF → RECORDING ⇄ PAUSED → OFF}. Invalid
 * transitions are no-ops. Input events only produce steps while
 * {@code RECORDING}; hotkey key-downs are consumed as commands and never
 * recorded.
 *
 * <p>Consecutive text input on the same control is coalesced into a single
 * {@code TYPE_TEXT} step, closed by a quiet period of
 * {@link RecorderConfig#getTextDebounceMillis()}, by input on another control,
 * or by any other recorded event. The debounce timer runs on a scheduler
 * thread but only posts the flush back onto the {@link OwnerContext}; a
 * generation number keeps a stale timer from closing a newer buffer.
 *
 * <p>All state is confined to the owner thread. Public methods called from
 * another thread are dispatched there and wait for the result.
 */
public class InteractionSession implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(InteractionSession.class);

    private static final DateTimeFormatter FILE_TIMESTAMP_FMT =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final TreeAccess tree;
    private final RecorderConfig config;
    private final OwnerContext owner;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;
    private final Clock clock;
    private final LocatorResolver resolver;
    private final StepValidator validator;
    private final AssertionExtractors extractors;
    private final StepRenderer renderer;

    // Owner-thread state
    private RecorderState state = RecorderState.OFF;
    private List<Step> steps = new ArrayList<>();
    private PendingText pending;
    private long textGeneration;
    private TreeNode hovered;
    private double lastX = Double.NaN;
    private double lastY = Double.NaN;
    private InputSource inputSource;
    private boolean closed;

    /** Buffer of characters typed into one control that are not yet a step. */
    private static final class PendingText {
        final TreeNode target;
        final StringBuilder buffer = new StringBuilder();
        long generation;
        ScheduledFuture<?> timer;

        PendingText(TreeNode target) {
            this.target = target;
        }
    }

    // ── Construction ──────────────────────────────────────────────────────

    /**
     * Creates a session with the built-in assertion rules, a daemon debounce
     * scheduler and the system clock.
     */
    public InteractionSession(TreeAccess tree, RecorderConfig config, OwnerContext owner) {
        this(tree, config, owner, AssertionExtractors.defaults(), newDebounceScheduler(), true,
                Clock.systemDefaultZone());
    }

    public InteractionSession(TreeAccess tree, RecorderConfig config, OwnerContext owner,
                              AssertionExtractors extractors) {
        this(tree, config, owner, extractors, newDebounceScheduler(), true, Clock.systemDefaultZone());
    }

    /**
     * Package-private constructor for tests: accepts the debounce scheduler
     * and clock so timing can be driven deterministically.
     */
    InteractionSession(TreeAccess tree, RecorderConfig config, OwnerContext owner,
                       AssertionExtractors extractors, ScheduledExecutorService scheduler, Clock clock) {
        this(tree, config, owner, extractors, scheduler, false, clock);
    }

    private InteractionSession(TreeAccess tree, RecorderConfig config, OwnerContext owner,
                               AssertionExtractors extractors, ScheduledExecutorService scheduler,
                               boolean ownsScheduler, Clock clock) {
        this.tree          = tree;
        this.config        = config;
        this.owner         = owner;
        this.extractors    = extractors;
        this.scheduler     = scheduler;
        this.ownsScheduler = ownsScheduler;
        this.clock         = clock;
        this.resolver      = new LocatorResolver(config, owner);
        this.validator     = new StepValidator(new ReplayFinder(tree));
        this.renderer      = new StepRenderer();
    }

    private static ScheduledExecutorService newDebounceScheduler() {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "treeqa-text-debounce");
            t.setDaemon(true);
            return t;
        });
    }

    // ── Input wiring ──────────────────────────────────────────────────────

    /** Starts delivering events from {@code source}; replaces any previously attached source. */
    public void attach(InputSource source) {
        onOwner(() -> {
            if (inputSource != null) inputSource.stop();
            inputSource = source;
            source.start(this::onInputEvent);
            return null;
        });
    }

    /**
     * Entry point for raw input. Safe to call from any thread: events from
     * other threads are posted onto the owner context in arrival order.
     */
    public void onInputEvent(InputEvent event) {
        if (!owner.isOwnerThread()) {
            owner.post(() -> onInputEvent(event));
            return;
        }
        if (closed) return;

        trackPointer(event);

        if (event.type() == InputEvent.Type.KEY_DOWN) {
            Optional<HotkeyCommand> command = matchHotkey(event);
            if (command.isPresent()) {
                handleCommand(command.get());
                return;
            }
        }

        if (state != RecorderState.RECORDING) return;

        switch (event.type()) {
            case POINTER_PRESS -> onPress(event);
            case TEXT_INPUT    -> onText(event);
            case KEY_DOWN      -> onKeyDown(event);
            case SCROLL        -> onScroll(event);
            case POINTER_MOVE  -> { }
        }
    }

    // ── State machine ─────────────────────────────────────────────────────

    /** OFF → RECORDING; begins a fresh step list. */
    public void start() {
        onOwner(() -> {
            if (state != RecorderState.OFF || closed) return null;
            steps = new ArrayList<>();
            state = RecorderState.RECORDING;
            log.info("Recording started");
            return null;
        });
    }

    /** RECORDING|PAUSED → OFF; flushes pending text first. Recorded steps are kept. */
    public void stop() {
        onOwner(() -> {
            if (state == RecorderState.OFF) return null;
            flushPendingText();
            state = RecorderState.OFF;
            log.info("Recording stopped ({} steps)", steps.size());
            return null;
        });
    }

    /** RECORDING → PAUSED; flushes pending text first. */
    public void pause() {
        onOwner(() -> {
            if (state != RecorderState.RECORDING) return null;
            flushPendingText();
            state = RecorderState.PAUSED;
            log.info("Recording paused");
            return null;
        });
    }

    /** PAUSED → RECORDING. */
    public void resume() {
        onOwner(() -> {
            if (state != RecorderState.PAUSED) return null;
            state = RecorderState.RECORDING;
            log.info("Recording resumed");
            return null;
        });
    }

    /** Discards all recorded steps and any pending text. State is unchanged. */
    public void clear() {
        onOwner(() -> {
            cancelPendingText();
            steps = new ArrayList<>();
            log.info("Recorded steps cleared");
            return null;
        });
    }

    // ── Queries ───────────────────────────────────────────────────────────

    public RecorderState state() {
        return onOwner(() -> state);
    }

    /** Immutable copy of the steps recorded so far (pending text excluded). */
    public List<Step> currentSteps() {
        return onOwner(() -> List.copyOf(steps));
    }

    public int stepCount() {
        return onOwner(() -> steps.size());
    }

    public boolean hasPendingText() {
        return onOwner(() -> pending != null);
    }

    // ── Commands ──────────────────────────────────────────────────────────

    /**
     * Captures an assertion on the first available target of
     * {@link RecorderConfig#getAssertTargetPriority()}. Only records while
     * {@code RECORDING}.
     *
     * @return the appended step, or empty when nothing was recorded
     */
    public Optional<Step> captureAssertion() {
        return onOwner(() -> {
            if (state != RecorderState.RECORDING) {
                log.debug("Assertion capture ignored in state {}", state);
                return Optional.empty();
            }
            Optional<TreeNode> target = assertionTarget();
            if (target.isEmpty()) {
                log.warn("Assertion capture found no target control");
                return Optional.empty();
            }
            Optional<AssertionValue> value = extractors.extract(target.get());
            if (value.isEmpty()) return Optional.empty();
            flushPendingText();
            return Optional.of(record(value.get().kind(), target.get(), value.get().value()));
        });
    }

    /**
     * Renders the recorded steps (flushing pending text first). Works in any
     * state.
     */
    public ExportResult export() {
        List<Step> snapshot = onOwner(() -> {
            flushPendingText();
            return List.copyOf(steps);
        });
        String timestamp = FILE_TIMESTAMP_FMT.format(clock.instant().atZone(clock.getZone()));
        TemplateContext ctx = TemplateContext.forScenario(
                config.getCodegenPackage(),
                config.getScenarioName(),
                config.isIncludeTimestamp() ? timestamp : null,
                config.getCodegenBaseClass(),
                config.getTestFramework());
        String text = renderer.render(snapshot, ctx);
        String fileName = TemplateContext.toIdentifier(config.getAppId()) + "."
                + TemplateContext.toIdentifier(config.getScenarioName()) + "." + timestamp + ".g.java";
        return new ExportResult(text, fileName, snapshot.size());
    }

    /** Exports and writes into {@link RecorderConfig#getOutputDir()}. */
    public Path save() throws IOException {
        return save(Paths.get(config.getOutputDir()));
    }

    /**
     * Exports and writes into {@code directory} (created if missing).
     *
     * @return the written file
     */
    public Path save(Path directory) throws IOException {
        ExportResult result = export();
        Files.createDirectories(directory);
        Path file = directory.resolve(result.suggestedFileName());
        Files.writeString(file, result.text(), StandardCharsets.UTF_8);
        log.info("Saved {} steps to {}", result.stepCount(), file);
        return file;
    }

    /**
     * Disposes the session: stops the input source, drops pending text and
     * releases the debounce scheduler if this session created it. Recorded
     * steps remain queryable.
     */
    @Override
    public void close() {
        onOwner(() -> {
            if (closed) return null;
            closed = true;
            cancelPendingText();
            if (inputSource != null) {
                inputSource.stop();
                inputSource = null;
            }
            state = RecorderState.OFF;
            log.info("Session closed ({} steps)", steps.size());
            return null;
        });
        if (ownsScheduler) scheduler.shutdownNow();
    }

    // ── Event handlers ────────────────────────────────────────────────────

    private void onPress(InputEvent e) {
        flushPendingText();
        TreeNode node = sourceOrHit(e);
        StepKind kind = e.button() == InputEvent.Button.RIGHT ? StepKind.RIGHT_CLICK : StepKind.CLICK;
        record(kind, node, null);
    }

    private void onText(InputEvent e) {
        if (e.text() == null || e.text().isEmpty()) return;
        TreeNode target = e.source() != null ? e.source() : tree.focused().orElse(null);
        if (target == null) {
            log.warn("Text input with no target control dropped ({} chars)", e.text().length());
            return;
        }
        if (pending != null && !pending.target.equals(target)) {
            flushPendingText();
        }
        if (pending == null) {
            pending = new PendingText(target);
        }
        pending.buffer.append(e.text());
        scheduleDebounce(pending);
    }

    private void onKeyDown(InputEvent e) {
        String key = SpecialKeys.canonical(e.key());
        if (key == null) return;
        flushPendingText();
        appendStep(new Step(StepKind.KEY_PRESS, Locator.NONE,
                SpecialKeys.chord(e.modifiers(), key), null, clock.instant()));
    }

    private void onScroll(InputEvent e) {
        flushPendingText();
        TreeNode node = sourceOrHit(e);
        record(StepKind.SCROLL, node, formatDelta(e.dx()) + "," + formatDelta(e.dy()));
    }

    private void handleCommand(HotkeyCommand command) {
        log.debug("Hotkey {} in state {}", command, state);
        switch (command) {
            case START_STOP -> {
                if (state == RecorderState.OFF) start();
                else stop();
            }
            case PAUSE_RESUME -> {
                if (state == RecorderState.RECORDING) pause();
                else if (state == RecorderState.PAUSED) resume();
            }
            case SAVE -> {
                if (state == RecorderState.OFF) return;
                try {
                    save();
                } catch (IOException e) {
                    log.error("Saving recorded steps failed", e);
                }
            }
            case CAPTURE_ASSERT -> {
                if (state != RecorderState.OFF) captureAssertion();
            }
        }
    }

    private Optional<HotkeyCommand> matchHotkey(InputEvent e) {
        for (HotkeyCommand c : HotkeyCommand.values()) {
            if (config.getHotkey(c).matches(e)) return Optional.of(c);
        }
        return Optional.empty();
    }

    // ── Recording ─────────────────────────────────────────────────────────

    /** Resolves, validates and appends one control-scoped step. */
    private Step record(StepKind kind, TreeNode node, String parameter) {
        Resolution r = resolver.resolve(node, lastX, lastY);
        Step step = new Step(kind, r.locator(), parameter, r.warning(), clock.instant());
        ValidationResult v = validator.validate(step, r.target());
        if (!v.ok()) {
            log.warn("Step {} on '{}' failed validation: {}", kind, r.locator().value(), v.reason());
            step = step.withWarning(StepValidator.FAILURE_PREFIX + v.reason());
        }
        appendStep(step);
        return step;
    }

    private void appendStep(Step step) {
        steps.add(step);
        log.debug("Recorded {}", step);
    }

    private void flushPendingText() {
        PendingText p = pending;
        if (p == null) return;
        pending = null;
        if (p.timer != null) p.timer.cancel(false);
        if (p.buffer.length() > 0) {
            record(StepKind.TYPE_TEXT, p.target, p.buffer.toString());
        }
    }

    private void cancelPendingText() {
        if (pending != null && pending.timer != null) pending.timer.cancel(false);
        pending = null;
    }

    private void scheduleDebounce(PendingText p) {
        if (p.timer != null) p.timer.cancel(false);
        long generation = ++textGeneration;
        p.generation = generation;
        p.timer = scheduler.schedule(() -> owner.post(() -> onDebounceElapsed(generation)),
                config.getTextDebounceMillis(), TimeUnit.MILLISECONDS);
    }

    private void onDebounceElapsed(long generation) {
        if (pending == null || pending.generation != generation) {
            log.debug("Stale debounce timer {} ignored", generation);
            return;
        }
        flushPendingText();
    }

    // ── Target lookup ─────────────────────────────────────────────────────

    private void trackPointer(InputEvent e) {
        if (e.hasPosition()) {
            lastX = e.x();
            lastY = e.y();
        }
        if (e.type() == InputEvent.Type.POINTER_MOVE || e.type() == InputEvent.Type.POINTER_PRESS) {
            if (e.source() != null) {
                hovered = e.source();
            } else if (e.hasPosition()) {
                hovered = tree.hitTest(e.x(), e.y()).orElse(hovered);
            }
        }
    }

    private TreeNode sourceOrHit(InputEvent e) {
        if (e.source() != null) return e.source();
        if (e.hasPosition()) return tree.hitTest(e.x(), e.y()).orElse(null);
        return null;
    }

    private Optional<TreeNode> assertionTarget() {
        for (AssertTargetSource source : config.getAssertTargetPriority()) {
            Optional<TreeNode> found = switch (source) {
                case HOVER            -> Optional.ofNullable(hovered);
                case POINTER_HIT_TEST -> Double.isNaN(lastX) ? Optional.empty() : tree.hitTest(lastX, lastY);
                case FOCUSED          -> tree.focused();
            };
            if (found.isPresent()) {
                log.debug("Assertion target from {}: {}", source, found.get().typeTag());
                return found;
            }
        }
        return Optional.empty();
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private <T> T onOwner(Callable<T> task) {
        if (owner.isOwnerThread()) {
            try {
                return task.call();
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        }
        return owner.invoke(task);
    }

    static String formatDelta(double d) {
        if (d == Math.rint(d) && !Double.isInfinite(d)) return String.valueOf((long) d);
        return String.valueOf(d);
    }
}
