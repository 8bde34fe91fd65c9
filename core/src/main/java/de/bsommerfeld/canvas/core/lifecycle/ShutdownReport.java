package de.bsommerfeld.canvas.core.lifecycle;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Results of a {@link ShutdownSequence} run, in execution order.
 */
public record ShutdownReport(List<StepResult> results) {

    public ShutdownReport {
        results = List.copyOf(results);
    }

    public List<StepResult> failures() {
        return results.stream().filter(StepResult::isFailed).collect(Collectors.toList());
    }

    public boolean isClean() {
        return results.stream().noneMatch(StepResult::isFailed);
    }

    public List<String> executedSteps() {
        return results.stream()
                .filter(r -> r.status() != StepResult.Status.SKIPPED)
                .map(StepResult::name)
                .collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return results.size() + " steps, " + failures().size() + " failed";
    }
}
