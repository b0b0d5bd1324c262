package com.questrail.radar.controller.internal;

import com.questrail.radar.controller.ControllerException;
import com.questrail.radar.controller.ControllerTimeline;
import com.questrail.radar.controller.config.ReceiverConfig;
import com.questrail.radar.controller.model.ControllerCommand;
import com.questrail.radar.controller.observability.ControllerObservabilitySink;
import com.questrail.radar.controller.observability.ControllerWarningEvent;
import com.questrail.radar.controller.observability.NullObservabilitySink;
import com.questrail.radar.controller.observability.Slf4jControllerObservabilitySink;
import com.questrail.radar.core.Phase;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * ControllerInterpreter
 * -----------------------------------------------------------------------------
 * Replays a controller program and produces its validated
 * {@link ControllerTimeline}.
 *
 * <h2>Cycle structure</h2>
 * <ul>
 *   <li>The first command, whatever it is, opens the cycle and the first
 *       subcycle at 0.</li>
 *   <li>{@code SETTCR t} with {@code t > 0} closes the running subcycle at
 *       {@code t}, opens the next one at {@code t} and sets the time control
 *       register (TCR) to {@code t}.</li>
 *   <li>{@code SETTCR 0} only resets the TCR. It belongs either first in the
 *       program or right before {@code REP}; anywhere else it is reported as a
 *       warning and executed anyway.</li>
 *   <li>{@code REP} closes the subcycle and the cycle at its literal time.</li>
 *   <li>Every other mnemonic runs at {@code TCR + t} through
 *       {@link MnemonicTable}. Unknown mnemonics are reported and skipped.</li>
 * </ul>
 *
 * <h2>Failure semantics</h2>
 * Structural errors are fatal and raised as {@link ControllerException}
 * carrying the source line: a line switched twice, a line still on when its
 * subcycle closes, a command after the cycle ended, a program not ending in
 * {@code REP}.
 *
 * Instances are stateless between runs; each {@link #run} starts from a fresh
 * {@link CycleState}.
 */
public final class ControllerInterpreter
{
    private final ReceiverConfig config;
    private final ControllerObservabilitySink sink;

    public ControllerInterpreter(ReceiverConfig config) {
        this(config, new Slf4jControllerObservabilitySink());
    }

    /**
     * @param sink receives warnings and closed subcycles; {@code null} discards
     *             them
     */
    public ControllerInterpreter(ReceiverConfig config, ControllerObservabilitySink sink) {
        this.config = Objects.requireNonNull(config, "config");
        this.sink = Objects.requireNonNullElse(sink, NullObservabilitySink.INSTANCE);
    }

    /**
     * Replays {@code program}, which must end with {@code REP}.
     *
     * @throws ControllerException if the program is structurally invalid
     */
    public ControllerTimeline run(List<ControllerCommand> program) {
        Objects.requireNonNull(program, "program");
        if (program.isEmpty()) {
            throw new ControllerException(0, "Program contains no commands");
        }

        CycleState state = new CycleState(config, sink);
        for (int i = 0; i < program.size(); i++) {
            ControllerCommand command = program.get(i);
            try {
                if (i == 0) {
                    state.openCycle();
                }
                if (command.isSetTcr()) {
                    onSetTcr(state, program, i);
                } else if (command.isRep()) {
                    state.closeCycle(command.time(), command.line());
                } else {
                    execute(state, command);
                }
            } catch (IllegalStateException | IllegalArgumentException e) {
                throw new ControllerException(command.line(), e.getMessage(), e);
            }
        }

        ControllerCommand last = program.get(program.size() - 1);
        if (!last.isRep()) {
            throw new ControllerException(last.line(),
                    "Program must end with REP, but ends with " + last.mnemonic());
        }
        return state.toTimeline();
    }

    private void onSetTcr(CycleState state, List<ControllerCommand> program, int index) {
        ControllerCommand command = program.get(index);
        double time = command.time();
        if (time > 0) {
            Optional<Phase> phase = state.closeSubcycle(time, command.line());
            state.openSubcycle(time, phase);
        } else {
            boolean beforeRep = index + 1 < program.size() && program.get(index + 1).isRep();
            if (index != 0 && !beforeRep) {
                sink.onWarning(new ControllerWarningEvent(ControllerWarningEvent.Kind.MISPLACED_SETTCR_ZERO,
                        command.line(), command.mnemonic(),
                        "SETTCR 0 in the middle of a program continues the running subcycle"));
            }
        }
        state.setTcr(time);
    }

    private void execute(CycleState state, ControllerCommand command) {
        Optional<Mnemonic> mnemonic = MnemonicTable.lookup(command.mnemonic());
        if (mnemonic.isEmpty()) {
            sink.onWarning(new ControllerWarningEvent(ControllerWarningEvent.Kind.UNKNOWN_MNEMONIC,
                    command.line(), command.mnemonic(),
                    "Command " + command.mnemonic() + " is not implemented and is skipped"));
            return;
        }
        mnemonic.get().handler().execute(state, state.tcr() + command.time(), command);
    }
}
