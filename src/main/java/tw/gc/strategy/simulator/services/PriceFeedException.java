package tw.gc.strategy.simulator.services;

/**
 * A price feed could not be read or contains a malformed row.
 */
public class PriceFeedException extends RuntimeException {

    public PriceFeedException(String message) {
        super(message);
    }

    public PriceFeedException(String message, Throwable cause) {
        super(message, cause);
    }
}
