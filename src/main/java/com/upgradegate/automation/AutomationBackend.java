package com.upgradegate.automation;

/**
 * The system that actually changes device configuration.
 *
 * <p>Implementations bound their own execution time and report failures as
 * an unsuccessful {@link AutomationResult} with structured detail. A thrown
 * {@link AutomationException} means the backend could not be reached at all.</p>
 */
public interface AutomationBackend {

    AutomationResult run(AutomationRequest request);
}
