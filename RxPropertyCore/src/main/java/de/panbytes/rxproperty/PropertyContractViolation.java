package de.panbytes.rxproperty;

/**
 * Signals that a source broke the promise of delivering a current value synchronously.
 * <p>
 * This is a programming defect at the call site (e.g. lifting a filtering operator without an initial value),
 * not a runtime condition. It is therefore modeled as {@link Error} and is not supposed to be caught.
 */
public class PropertyContractViolation extends Error {

    private static final long serialVersionUID = 1L;

    public PropertyContractViolation(String message) {
        super(message);
    }

    public PropertyContractViolation(String message, Throwable cause) {
        super(message, cause);
    }
}
