package org.carball.pgadvisor.advisor;

import org.carball.pgadvisor.model.index.AccessMethod;
import org.carball.pgadvisor.parser.StoreUnavailableException;

import java.util.Set;

/**
 * Index access methods installed on a server.
 */
@FunctionalInterface
public interface AccessMethodCapabilities {

    Set<AccessMethod> supportedAccessMethods(String server) throws StoreUnavailableException;
}
