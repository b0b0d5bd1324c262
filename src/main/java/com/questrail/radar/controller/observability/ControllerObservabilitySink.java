package com.questrail.radar.controller.observability;

/**
 * Main interface for receiving observability events from the controller
 * interpreter. Implementations can provide logging or collect events for
 * inspection.
 */
public interface ControllerObservabilitySink {
    /**
     * Called when a recoverable anomaly is found (e.g., an unknown mnemonic).
     * @param event the warning details
     */
    void onWarning(ControllerWarningEvent event);

    /**
     * Called when a subcycle has been closed and validated.
     * @param event the closed subcycle
     */
    void onSubcycleClosed(SubcycleClosedEvent event);
}
