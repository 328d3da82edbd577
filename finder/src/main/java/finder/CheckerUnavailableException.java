package finder;

/** The availability checker could not be acquired at all. Fatal for the worker that needed it. */
public class CheckerUnavailableException extends Exception {
    public CheckerUnavailableException(String message) {
        super(message);
    }

    public CheckerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
