package com.questrail.radar.controller.observability;

/**
 * Discards every replay event. Used by {@code ControllerInterpreter} when no
 * sink is given.
 */
public final class NullObservabilitySink implements ControllerObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {
    }

    @Override
    public void onWarning(ControllerWarningEvent event) {
    }

    @Override
    public void onSubcycleClosed(SubcycleClosedEvent event) {
    }
}
