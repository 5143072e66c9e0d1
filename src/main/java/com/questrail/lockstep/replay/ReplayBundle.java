package com.questrail.lockstep.replay;

import com.questrail.lockstep.compare.DivergenceReport;
import com.questrail.lockstep.compare.OperationFormatter;
import com.questrail.lockstep.model.Operation;
import com.questrail.lockstep.model.Sequence;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Diagnostic snapshot of a diverged run: enough to read what happened and to
 * re-run the seed, nothing more. Bundles are written, never read back.
 *
 * <p>{@code entity} is {@code null} for primary-contract fields.</p>
 */
public record ReplayBundle(
    int schemaVersion,
    String profile,
    long seed,
    int step,
    String field,
    String entity,
    List<String> operations,
    String modelValue,
    String systemValue,
    String report
) {
    public static final int SCHEMA_VERSION = 1;

    public ReplayBundle {
        Objects.requireNonNull(profile, "profile");
        Objects.requireNonNull(field, "field");
        operations = List.copyOf(Objects.requireNonNull(operations, "operations"));
        Objects.requireNonNull(modelValue, "modelValue");
        Objects.requireNonNull(systemValue, "systemValue");
        Objects.requireNonNull(report, "report");
    }

    /**
     * Captures the operations up to and including the diverging step.
     */
    public static ReplayBundle of(String profile, long seed, Sequence<?> sequence, DivergenceReport report) {
        List<String> rendered = new ArrayList<>(report.step());
        for (Operation op : sequence.operations().subList(0, report.step())) {
            rendered.add(OperationFormatter.format(op));
        }
        return new ReplayBundle(
                SCHEMA_VERSION,
                profile,
                seed,
                report.step(),
                report.field().name(),
                report.entity().map(Object::toString).orElse(null),
                rendered,
                report.modelValue(),
                report.systemValue(),
                report.render());
    }

    public String fileName() {
        return "replay-" + profile + "-" + seed + ".json";
    }
}
