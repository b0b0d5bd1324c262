package com.questrail.radar.controller.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of ControllerObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jControllerObservabilitySink implements ControllerObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jControllerObservabilitySink.class);

    @Override
    public void onWarning(ControllerWarningEvent event) {
        // A second STFIR is routine in real programs.
        if (event.kind() == ControllerWarningEvent.Kind.REDUNDANT_STFIR) {
            log.debug("Controller line {}: {}", event.line(), event.message());
            return;
        }
        log.warn("Controller line {} ({}): {}", event.line(), event.mnemonic(), event.message());
    }

    @Override
    public void onSubcycleClosed(SubcycleClosedEvent event) {
        log.debug("Subcycle {} closed in line {}: [{}, {}] s",
            event.index(),
            event.line(),
            event.interval().begin(),
            event.interval().end());
    }
}
