package de.bsommerfeld.canvas.core.lifecycle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Fixed, ordered list of teardown steps executed once when the owner closes.
 *
 * <h3>Contract</h3>
 * <ul>
 * <li>Steps run synchronously on the calling thread in registration
 * order.</li>
 * <li>A step that throws is logged and recorded; the next step runs
 * anyway. This includes linkage and assertion errors from native
 * collaborators.</li>
 * <li>{@link #run()} never throws, except for a {@link VirtualMachineError}.
 * The owner can always finish closing.</li>
 * <li>The sequence runs at most once. Later calls return the first report
 * without touching any collaborator again.</li>
 * </ul>
 *
 * <p>
 * Steps are registered when the owner is constructed. Collaborators that may
 * not exist yet at that point are registered through
 * {@link #stepFor(String, Supplier, TargetAction)} and skipped if still
 * absent at close.
 */
public final class ShutdownSequence {

    private static final Logger LOG = LoggerFactory.getLogger(ShutdownSequence.class);

    /** Teardown of a collaborator resolved at close time. */
    @FunctionalInterface
    public interface TargetAction<T> {
        void accept(T target) throws Exception;
    }

    private final String owner;
    private final List<Entry> steps = new ArrayList<>();
    private ShutdownReport report;

    public ShutdownSequence(String owner) {
        this.owner = owner;
    }

    /** Appends a step that always runs. */
    public synchronized ShutdownSequence step(String name, CleanupAction action) {
        ensureOpen();
        steps.add(new Entry(new ShutdownStep(name, action), null));
        return this;
    }

    /**
     * Appends a step for a collaborator looked up at close time. The step is
     * skipped if the supplier returns {@code null}.
     */
    public synchronized <T> ShutdownSequence stepFor(String name, Supplier<? extends T> target,
            TargetAction<? super T> action) {
        ensureOpen();
        Supplier<Boolean> present = () -> target.get() != null;
        steps.add(new Entry(new ShutdownStep(name, () -> {
            T resolved = target.get();
            if (resolved != null) {
                action.accept(resolved);
            }
        }), present));
        return this;
    }

    public synchronized List<String> stepNames() {
        List<String> names = new ArrayList<>(steps.size());
        for (Entry entry : steps) {
            names.add(entry.step.name());
        }
        return names;
    }

    public synchronized boolean hasRun() {
        return report != null;
    }

    /**
     * Executes every step once.
     *
     * @return the report of this run, or of the first run if already executed
     */
    public synchronized ShutdownReport run() {
        if (report != null) {
            LOG.warn("{} shutdown already ran, ignoring repeated request", owner);
            return report;
        }

        LOG.info("{} shutting down ({} steps)...", owner, steps.size());
        List<StepResult> results = new ArrayList<>(steps.size());
        for (Entry entry : steps) {
            results.add(execute(entry));
        }

        report = new ShutdownReport(results);
        if (report.isClean()) {
            LOG.info("{} shutdown complete: {}", owner, report);
        } else {
            LOG.warn("{} shutdown finished with failures: {}", owner, report);
        }
        return report;
    }

    private StepResult execute(Entry entry) {
        String name = entry.step.name();
        long start = System.nanoTime();
        try {
            if (entry.present != null && !entry.present.get()) {
                LOG.debug("[shutdown] {} skipped, nothing to release", name);
                return StepResult.skipped(name);
            }
            entry.step.action().run();
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            LOG.debug("[shutdown] {} done in {} ms", name, elapsed.toMillis());
            return StepResult.completed(name, elapsed);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Exception | Error e) {
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            LOG.warn("[shutdown] {} failed: {}", name, e.getMessage(), e);
            return StepResult.failed(name, e, elapsed);
        }
    }

    private void ensureOpen() {
        if (report != null) {
            throw new IllegalStateException(owner + " shutdown already ran");
        }
    }

    private record Entry(ShutdownStep step, Supplier<Boolean> present) {
    }
}
