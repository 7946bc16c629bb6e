package org.ptnet.machine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import org.apache.log4j.Logger;
import org.ptnet.config.PnmlPath;
import org.ptnet.constants.PnmlConstants;
import org.ptnet.exceptions.PetriNetException;
import org.ptnet.exceptions.SchemaViolationException;
import org.ptnet.index.ArcPass;
import org.ptnet.index.NetIndex;
import org.ptnet.index.NetIndexer;
import org.ptnet.index.RolePass;
import org.ptnet.index.Snapshot;
import org.ptnet.machine.passes.IncidentArcPass;
import org.ptnet.machine.passes.InhibitorRolePass;
import org.ptnet.model.Net;
import org.ptnet.pnml.PnmlDecoder;

/**
 * A P/T net opened as a state machine: the first net of a schema file,
 * decoded and indexed.
 *
 * Schema names resolve through {@link PnmlPath} to {@code <base>/<name>.xml}.
 */
public class PTNet {

    private static final Logger logger = Logger.getLogger(PTNet.class);

    private final String name;
    private final Net net;
    private final NetIndexer indexer;
    private NetIndex index;

    public PTNet(String name, Net net, RolePass rolePass, ArcPass arcPass) throws PetriNetException {
        this.name = name;
        this.net = net;
        this.indexer = new NetIndexer(rolePass, arcPass);
        reindex();
    }

    /**
     * Open the schema {@code name} with the default role and arc passes.
     */
    public static PTNet load(String name) throws PetriNetException, IOException {
        return load(name, new InhibitorRolePass(), new IncidentArcPass());
    }

    public static PTNet load(String name, RolePass rolePass, ArcPass arcPass) throws PetriNetException, IOException {
        return load(name, PnmlPath.schemaFile(name), rolePass, arcPass);
    }

    public static PTNet load(String name, Path file, RolePass rolePass, ArcPass arcPass)
            throws PetriNetException, IOException {
        logger.info("Loading P/T net " + name + " from " + file);
        List<Net> nets = new PnmlDecoder().decode(file);
        if (nets.isEmpty()) {
            throw new SchemaViolationException(name, PnmlConstants.PNML, file.getFileName().toString(),
                    PnmlConstants.NET);
        }
        if (nets.size() > 1) {
            logger.debug(file + " holds " + nets.size() + " nets, using " + nets.get(0).getName());
        }
        return new PTNet(name, nets.get(0), rolePass, arcPass);
    }

    /**
     * Rebuild the index from the net.
     */
    public final void reindex() throws PetriNetException {
        index = indexer.buildIndex(net);
    }

    public String getName() {
        return name;
    }

    public Net getNet() {
        return net;
    }

    public NetIndex getIndex() {
        return index;
    }

    public int[] emptyVector() {
        return index.emptyVector();
    }

    public int[] initialVector() {
        return index.initialVector();
    }

    /**
     * Snapshot for the semantics engine: fresh state vector, shared transitions.
     */
    public Snapshot toMachine() {
        return index.snapshot();
    }

    @Override
    public String toString() {
        return "PTNet{" + name + ", places=" + index.getPlaceCount() + ", transitions="
                + index.getTransitionIndex().size() + "}";
    }
}
