package org.ptnet.pnml;

import static org.ptnet.constants.PnmlConstants.*;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;
import org.ptnet.exceptions.PetriNetException;
import org.ptnet.exceptions.SchemaViolationException;
import org.ptnet.model.Arc;
import org.ptnet.model.Net;
import org.ptnet.model.Node;
import org.ptnet.model.Place;
import org.ptnet.model.ReferenceResolver;
import org.ptnet.model.Transition;
import org.ptnet.utils.XmlDocuments;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Decodes PNML documents into {@link Net} instances.
 *
 * <pre>
 * &lt;pnml&gt;
 *   &lt;net id="..."&gt;
 *     &lt;transition id="..."&gt;
 *       &lt;name&gt;&lt;text&gt;...&lt;/text&gt;&lt;graphics&gt;&lt;offset x="0" y="0"/&gt;&lt;/graphics&gt;&lt;/name&gt;
 *       &lt;graphics&gt;&lt;position x="73" y="149"/&gt;&lt;/graphics&gt;
 *     &lt;/transition&gt;
 *     &lt;place id="..."&gt;
 *       ... as transition ...
 *       &lt;initialMarking&gt;&lt;value&gt;TYPE,COUNT&lt;/value&gt;&lt;/initialMarking&gt;
 *     &lt;/place&gt;
 *     &lt;arc id="..." source="..." target="..."&gt;
 *       &lt;type value="normal|inhibitor"/&gt;
 *     &lt;/arc&gt;
 *   &lt;/net&gt;
 * &lt;/pnml&gt;
 * </pre>
 *
 * One net is produced per {@code net} child of the root, in document order;
 * a document whose root is itself a {@code net} yields that single net.
 * Places, transitions and arcs may sit anywhere below their net (for example
 * inside a {@code page}). Unless {@link DecoderOptions#isPreserveSourceLabel()}
 * is set, the label of every place and transition is its id. Arc inscriptions
 * are not read; every arc weighs {@value org.ptnet.constants.PnmlConstants#DEFAULT_INSCRIPTION}.
 *
 * Decoding is all or nothing: the first violation aborts the whole document.
 */
public class PnmlDecoder {

    private static final Logger logger = Logger.getLogger(PnmlDecoder.class);

    static final String OFFSET_FIELD = NAME + "/" + GRAPHICS + "/" + OFFSET;
    static final String POSITION_FIELD = GRAPHICS + "/" + POSITION;

    private final DecoderOptions options;

    public PnmlDecoder() {
        this(DecoderOptions.DEFAULT);
    }

    public PnmlDecoder(DecoderOptions options) {
        this.options = options;
    }

    public List<Net> decode(Path file) throws PetriNetException, IOException {
        logger.debug("Decoding PNML file " + file);
        try (InputStream in = Files.newInputStream(file)) {
            return decode(in);
        }
    }

    public List<Net> decode(byte[] xml) throws PetriNetException, IOException {
        return decode(XmlDocuments.parse(xml));
    }

    public List<Net> decode(InputStream in) throws PetriNetException, IOException {
        return decode(XmlDocuments.parse(in));
    }

    private List<Net> decode(Document doc) throws PetriNetException {
        List<Net> nets = new ArrayList<>();
        Element root = doc.getDocumentElement();
        List<Element> netNodes = NET.equals(XmlDocuments.localName(root))
                ? Collections.singletonList(root)
                : XmlDocuments.children(root, NET);
        for (Element netNode : netNodes) {
            nets.add(decodeNet(netNode, nets.size() + 1));
        }
        logger.debug("Decoded " + nets.size() + " net(s)");
        return Collections.unmodifiableList(nets);
    }

    private Net decodeNet(Element netNode, int ordinal) throws PetriNetException {
        String name = XmlDocuments.attribute(netNode, ATTR_ID);
        if (name == null) {
            throw new SchemaViolationException("#" + ordinal, NET, "#" + ordinal, "@" + ATTR_ID);
        }
        Net net = new Net(name);

        int i = 0;
        for (Element e : XmlDocuments.descendants(netNode, TRANSITION)) {
            Transition transition = new Transition(requireId(net, TRANSITION, e, ++i));
            readNode(net, transition, e);
            net.addTransition(transition);
        }

        i = 0;
        for (Element e : XmlDocuments.descendants(netNode, PLACE)) {
            Place place = new Place(requireId(net, PLACE, e, ++i));
            readNode(net, place, e);
            place.setMarking(readMarking(net, place, e));
            net.addPlace(place);
        }

        i = 0;
        for (Element e : XmlDocuments.descendants(netNode, ARC)) {
            net.addArc(readArc(net, e, ++i));
        }

        for (Arc arc : net.getArcs()) {
            ReferenceResolver.validateArc(arc);
        }

        logger.info("Decoded net " + name + ": " + net.getPlaces().size() + " places, "
                + net.getTransitions().size() + " transitions, " + net.getArcs().size() + " arcs");
        return net;
    }

    private void readNode(Net net, Node node, Element e) throws SchemaViolationException {
        node.setLabel(label(node.getId(), e));

        Element offset = XmlDocuments.path(e, NAME, GRAPHICS, OFFSET);
        if (offset == null) {
            throw new SchemaViolationException(net.getName(), node.getKind(), node.getId(), OFFSET_FIELD);
        }
        node.setOffset(coordinate(net, node, offset, OFFSET_FIELD, ATTR_X),
                coordinate(net, node, offset, OFFSET_FIELD, ATTR_Y));

        Element position = XmlDocuments.path(e, GRAPHICS, POSITION);
        if (position == null) {
            throw new SchemaViolationException(net.getName(), node.getKind(), node.getId(), POSITION_FIELD);
        }
        node.setPosition(coordinate(net, node, position, POSITION_FIELD, ATTR_X),
                coordinate(net, node, position, POSITION_FIELD, ATTR_Y));

        logger.debug("  " + node.getKind() + " " + node.getId() + " at " + node.getPosition());
    }

    /**
     * No {@code initialMarking} means no tokens; once present it must carry a {@code value}.
     */
    private static int readMarking(Net net, Place place, Element e) throws SchemaViolationException {
        Element initialMarking = XmlDocuments.child(e, INITIAL_MARKING);
        if (initialMarking == null) {
            return 0;
        }
        Element value = XmlDocuments.child(initialMarking, VALUE);
        if (value == null) {
            throw new SchemaViolationException(net.getName(), PLACE, place.getId(), MarkingParser.FIELD);
        }
        return MarkingParser.parse(value.getTextContent(), net.getName(), place.getId());
    }

    private String label(String id, Element e) {
        if (!options.isPreserveSourceLabel()) {
            return id;
        }
        String text = XmlDocuments.text(XmlDocuments.path(e, NAME, TEXT));
        return text == null || text.trim().isEmpty() ? id : text.trim();
    }

    private Arc readArc(Net net, Element e, int ordinal) throws SchemaViolationException {
        String id = requireId(net, ARC, e, ordinal);
        String source = requireAttribute(net, ARC, id, e, ATTR_SOURCE);
        String target = requireAttribute(net, ARC, id, e, ATTR_TARGET);
        Arc arc = new Arc(id, source, target);

        Element type = XmlDocuments.child(e, TYPE);
        if (type == null) {
            throw new SchemaViolationException(net.getName(), ARC, id, TYPE);
        }
        arc.setInhibitor(ARC_TYPE_INHIBITOR.equals(type.getAttribute(ATTR_VALUE)));

        logger.debug("  arc " + id + ": " + source + " -> " + target + (arc.isInhibitor() ? " (inhibitor)" : ""));
        return arc;
    }

    private static double coordinate(Net net, Node node, Element point, String field, String axis)
            throws SchemaViolationException {
        String fieldName = field + "@" + axis;
        String text = XmlDocuments.attribute(point, axis);
        if (text == null) {
            throw new SchemaViolationException(net.getName(), node.getKind(), node.getId(), fieldName);
        }
        try {
            return Double.parseDouble(text.trim());
        } catch (NumberFormatException e) {
            throw new SchemaViolationException(net.getName(), node.getKind(), node.getId(), fieldName, text, e);
        }
    }

    private static String requireId(Net net, String kind, Element e, int ordinal) throws SchemaViolationException {
        return requireAttribute(net, kind, "#" + ordinal, e, ATTR_ID);
    }

    private static String requireAttribute(Net net, String kind, String elementId, Element e, String attribute)
            throws SchemaViolationException {
        String value = XmlDocuments.attribute(e, attribute);
        if (value == null || value.isEmpty()) {
            throw new SchemaViolationException(net.getName(), kind, elementId, "@" + attribute);
        }
        return value;
    }
}
