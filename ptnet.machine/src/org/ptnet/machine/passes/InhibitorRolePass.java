package org.ptnet.machine.passes;

import org.apache.log4j.Logger;
import org.ptnet.exceptions.PetriNetException;
import org.ptnet.index.RolePass;
import org.ptnet.model.Arc;
import org.ptnet.model.Net;
import org.ptnet.model.Node;
import org.ptnet.model.Place;

/**
 * Treats every inhibitor arc as expressing a role: the id of the place the
 * arc touches becomes the role, set on the arc and recorded once on the net.
 */
public class InhibitorRolePass implements RolePass {

    private static final Logger logger = Logger.getLogger(InhibitorRolePass.class);

    @Override
    public void assignRoles(Net net) throws PetriNetException {
        for (Arc arc : net.getArcs()) {
            if (!arc.isInhibitor()) {
                continue;
            }
            Node source = arc.findSource();
            Node place = source instanceof Place ? source : arc.findTarget();
            arc.setRole(place.getId());
            if (net.addRole(place.getId())) {
                logger.debug("Role " + place.getId() + " recorded for inhibitor arc " + arc.getId());
            }
        }
    }
}
