package com.questrail.lockstep.compare;

import com.questrail.lockstep.model.Operation;

/**
 * Renders operations for divergence reports and replay bundles.
 *
 * <p>Output is deterministic: it depends only on the operation's value, so a
 * report rendered twice is byte-identical.</p>
 */
public final class OperationFormatter
{
    private OperationFormatter() {}

    public static String format(Operation operation) {
        StringBuilder sb = new StringBuilder();
        sb.append(operation.entrypoint().entrypointName())
          .append(" from ").append(operation.sender())
          .append(" (");
        if (operation.advance().isPresent()) {
            sb.append("advance ").append(operation.advance().getAsLong());
        } else {
            sb.append("no advance");
        }
        sb.append(", amount ").append(operation.amount())
          .append("): ")
          .append(operation.entrypoint());
        return sb.toString();
    }
}
