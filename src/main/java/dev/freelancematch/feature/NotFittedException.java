package dev.freelancematch.feature;

/**
 * Thrown when a transform or score is requested before the component has been fitted.
 */
public class NotFittedException extends IllegalStateException {

    public NotFittedException(String message) {
        super(message);
    }
}
