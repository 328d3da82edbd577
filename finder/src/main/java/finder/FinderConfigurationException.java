package finder;

/** Invalid configuration or input. Raised before any check is started and never retried. */
public class FinderConfigurationException extends RuntimeException {
    public FinderConfigurationException(String message) {
        super(message);
    }

    public FinderConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
