package org.ptnet.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.ptnet.exceptions.DanglingReferenceException;
import org.ptnet.exceptions.SchemaViolationException;

public class NetTest {

    private static Net twoNodeNet() throws Exception {
        Net net = new Net("n");
        Place p = new Place("p");
        p.setLabel("P");
        Transition t = new Transition("t");
        t.setLabel("T");
        net.addPlace(p);
        net.addTransition(t);
        return net;
    }

    @Test
    public void testIdGeneratorIsDeterministicPerSession() {
        IdGenerator ids = new IdGenerator();
        assertEquals("Place1", new Place(ids).getId());
        assertEquals("Place2", new Place(ids).getId());
        assertEquals("Transition1", new Transition(ids).getId());
        assertEquals("Arc1", new Arc(ids, "Place1", "Transition1").getId());

        assertEquals("Place1", new IdGenerator().nextPlaceId());
    }

    @Test
    public void testDefaultsForProgrammaticEntities() {
        Place place = new Place("x");
        assertEquals(Place.DEFAULT_LABEL, place.getLabel());
        assertEquals(0, place.getMarking());
        assertEquals(0.0, place.getPosition().getX());

        Arc arc = new Arc("a", "x", "y");
        assertEquals("1", arc.getInscription());
        assertEquals(1, arc.getWeight());
        assertFalse(arc.isInhibitor());
        assertNull(arc.getRole());
    }

    @Test
    public void testInsertionOrderIsKept() throws Exception {
        Net net = new Net("n");
        for (String id : new String[] {"c", "a", "b"}) {
            net.addPlace(new Place(id));
        }
        assertEquals(List.of("c", "a", "b"), new ArrayList<>(net.getPlaces().keySet()));
    }

    @Test
    public void testNodeIdsAreUniqueAcrossKinds() throws Exception {
        Net net = twoNodeNet();
        SchemaViolationException e = assertThrows(SchemaViolationException.class,
                () -> net.addTransition(new Transition("p")));
        assertEquals("p", e.getElementId());
        assertThrows(SchemaViolationException.class, () -> net.addPlace(new Place("p")));
    }

    @Test
    public void testRolesAreRecordedOnce() {
        Net net = new Net("n");
        assertTrue(net.addRole("admin"));
        assertFalse(net.addRole("admin"));
        assertEquals(List.of("admin"), net.getRoles());
    }

    @Test
    public void testResolverPrefersTransitions() throws Exception {
        Net net = twoNodeNet();
        assertSame(net.getTransition("t"), ReferenceResolver.resolve(net, "t"));
        assertSame(net.getPlace("p"), ReferenceResolver.resolve(net, "p"));

        DanglingReferenceException e = assertThrows(DanglingReferenceException.class,
                () -> ReferenceResolver.resolve(net, "ghost"));
        assertEquals("n", e.getNetId());
        assertEquals("ghost", e.getUnresolvedId());
    }

    @Test
    public void testValidateArcRejectsSameKindEndpoints() throws Exception {
        Net net = twoNodeNet();
        net.addPlace(new Place("q"));
        Arc arc = new Arc("a", "p", "q");
        net.addArc(arc);

        SchemaViolationException e = assertThrows(SchemaViolationException.class,
                () -> ReferenceResolver.validateArc(arc));
        assertEquals("a", e.getElementId());
        assertEquals("endpoints", e.getField());
    }

    @Test
    public void testValidateArcReportsDanglingEndpoint() throws Exception {
        Net net = twoNodeNet();
        Arc arc = new Arc("a", "p", "nowhere");
        net.addArc(arc);

        DanglingReferenceException e = assertThrows(DanglingReferenceException.class,
                () -> ReferenceResolver.validateArc(arc));
        assertEquals("a", e.getArcId());
        assertEquals("nowhere", e.getUnresolvedId());
    }

    @Test
    public void testRendering() throws Exception {
        Net net = twoNodeNet();
        net.addArc(new Arc("a", "p", "t"));

        assertEquals("P-->T", net.getArcs().get(0).toString());
        assertEquals("--- Net: n\nTransitions: T \nPlaces: P \nP-->T\n---", net.toString());
    }

    @Test
    public void testNegativeMarkingRejected() {
        assertThrows(IllegalArgumentException.class, () -> new Place("p").setMarking(-1));
    }
}
