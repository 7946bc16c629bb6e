package org.ptnet.index;

import org.ptnet.exceptions.PetriNetException;
import org.ptnet.model.Net;

/**
 * Assigns role identifiers on a net before its places are indexed.
 * Called exactly once per index build.
 */
public interface RolePass {

    void assignRoles(Net net) throws PetriNetException;
}
