package com.family.library.flow;

import com.family.library.dto.InboundEvent;

import java.util.List;

/**
 * Entry point of one or more top-level {@code /commands}.
 */
public interface CommandHandler {

    /**
     * Command tokens without the leading slash, e.g. {@code "last"}.
     */
    List<String> tokens();

    StepOutcome start(InboundEvent event);
}
