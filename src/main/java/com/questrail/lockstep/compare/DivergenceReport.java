package com.questrail.lockstep.compare;

import com.questrail.lockstep.api.Address;
import com.questrail.lockstep.model.Operation;

import java.util.Objects;
import java.util.Optional;

/**
 * DivergenceReport
 * -----------------------------------------------------------------------------
 * The first observable on which the reference model and the system under test
 * disagreed.
 *
 * <p>A report names a single cause: the step, the operation, one field (and the
 * entity it belongs to, for entity fields) and both renderings of that field.
 * Nothing from other checks leaks in.</p>
 *
 * <h2>Text form</h2>
 * {@link #render()} produces a stable block that tests assert on verbatim:
 * <pre>
 * ━━ Error: model and system &lt;label&gt; are different ━━
 * * Step &lt;k&gt; call with:
 * &lt;operation&gt;
 * ━━ Model &lt;label&gt; ━━
 * &lt;model value&gt;
 * ━━ System &lt;label&gt; ━━
 * &lt;system value&gt;
 * </pre>
 */
public record DivergenceReport(
    int step,
    Operation operation,
    ObservableField field,
    Optional<Address> entity,
    String modelValue,
    String systemValue
) {
    public DivergenceReport {
        if (step < 1) {
            throw new IllegalArgumentException("step is 1-based, was " + step);
        }
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(entity, "entity");
        Objects.requireNonNull(modelValue, "modelValue");
        Objects.requireNonNull(systemValue, "systemValue");
        if (field.isEntityField() != entity.isPresent()) {
            throw new IllegalArgumentException("entity handle must be present exactly for entity fields");
        }
    }

    public String label() {
        return field.label(entity);
    }

    public String render() {
        String label = label();
        return "━━ Error: model and system " + label + " are different ━━\n"
                + "* Step " + step + " call with:\n"
                + OperationFormatter.format(operation) + "\n"
                + "━━ Model " + label + " ━━\n"
                + modelValue + "\n"
                + "━━ System " + label + " ━━\n"
                + systemValue;
    }
}
