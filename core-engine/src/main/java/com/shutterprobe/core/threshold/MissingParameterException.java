package com.shutterprobe.core.threshold;

/**
 * Thrown when a threshold method is invoked without a parameter it needs,
 * such as the expected event count of the z-score search.
 *
 * <p>
 * This is a caller contract violation and is deliberately distinct from a
 * valid analysis that found no events.
 * </p>
 *
 * @since 1.0.0
 */
public class MissingParameterException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final String parameterName;

    /**
     * @param parameterName name of the missing parameter
     * @param message       detail message
     */
    public MissingParameterException(String parameterName, String message) {
        super(message);
        this.parameterName = parameterName;
    }

    public String getParameterName() {
        return parameterName;
    }
}
