package org.tanzu.azureagent.azure;

/**
 * Raised when a call to the Azure token authority or Resource Manager fails.
 *
 * The message carries the Azure error message when the response had one, so it
 * can be shown to the operator as-is.
 */
public class AzureClientException extends RuntimeException {

    private final int statusCode;

    public AzureClientException(String message) {
        this(message, 0, null);
    }

    public AzureClientException(String message, Throwable cause) {
        this(message, 0, cause);
    }

    public AzureClientException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * @return the HTTP status of the failed call, or 0 if no response was received
     */
    public int getStatusCode() {
        return statusCode;
    }
}
