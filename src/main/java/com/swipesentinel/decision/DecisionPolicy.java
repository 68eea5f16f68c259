package com.swipesentinel.decision;

import com.swipesentinel.model.PacketContext;

/**
 * One way of choosing the next action from a packet context.
 *
 * Implementations must only ever choose from {@link PacketContext#getAvailableActions()}.
 */
public interface DecisionPolicy {
    DecisionOutcome decide(PacketContext context, Directive directive);
}
