package com.questrail.lockstep.model;

/**
 * Plain transfer to the primary contract with no entrypoint; the attached amount
 * is the operation's {@link Operation#amount()}.
 */
public record DefaultTransfer() implements Entrypoint
{
    @Override
    public Kind kind() {
        return Kind.DEFAULT;
    }
}
