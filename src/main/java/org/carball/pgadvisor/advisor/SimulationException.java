package org.carball.pgadvisor.advisor;

/**
 * The hypothetical index simulator could not evaluate a candidate. Affects that candidate only.
 */
public class SimulationException extends Exception {

    public SimulationException(String message) {
        super(message);
    }

    public SimulationException(String message, Throwable cause) {
        super(message, cause);
    }
}
