package org.carball.pgadvisor.model.index;

public enum SimulationStatus {
    UNTESTED,
    ACCEPTED,
    REJECTED,
    SIMULATION_FAILED;

    public boolean isTerminal() {
        return this != UNTESTED;
    }
}
