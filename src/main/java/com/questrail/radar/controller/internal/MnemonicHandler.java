package com.questrail.radar.controller.internal;

import com.questrail.radar.controller.model.ControllerCommand;

/**
 * Effect of one controller mnemonic on the replay state.
 */
@FunctionalInterface
public interface MnemonicHandler
{
    MnemonicHandler NO_OP = (state, time, command) -> { };

    /**
     * @param state   replay state of the running cycle
     * @param time    absolute time in seconds (time control register applied)
     * @param command the command being executed
     */
    void execute(CycleState state, double time, ControllerCommand command);
}
