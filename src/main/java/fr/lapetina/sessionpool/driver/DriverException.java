package fr.lapetina.sessionpool.driver;

/**
 * Raised by a {@link SessionDriver} when an interaction with the surface fails outright,
 * as opposed to a control simply not appearing in time.
 */
public class DriverException extends RuntimeException {

    public DriverException(String message) {
        super(message);
    }

    public DriverException(String message, Throwable cause) {
        super(message, cause);
    }
}
