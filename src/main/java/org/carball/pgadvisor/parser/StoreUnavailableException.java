package org.carball.pgadvisor.parser;

/**
 * The backing store of snapshots or catalog data could not be reached.
 */
public class StoreUnavailableException extends Exception {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
