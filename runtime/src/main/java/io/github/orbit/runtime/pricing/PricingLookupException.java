package io.github.orbit.runtime.pricing;

/** The pricing catalog could not be queried. A missing size is not an error. */
public class PricingLookupException extends Exception {

    public PricingLookupException(String message) {
        super(message);
    }

    public PricingLookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
