package org.ptnet.machine;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.ptnet.config.PnmlPath;
import org.ptnet.exceptions.IndexingException;
import org.ptnet.exceptions.SchemaViolationException;
import org.ptnet.index.ArcBinding;
import org.ptnet.index.NetIndex;
import org.ptnet.index.Snapshot;
import org.ptnet.index.TransitionEntry;
import org.ptnet.machine.passes.IncidentArcPass;
import org.ptnet.model.Net;

public class PTNetTest {

    @BeforeEach
    public void setUp() {
        PnmlPath.override(Paths.get("examples"));
    }

    @AfterEach
    public void tearDown() {
        PnmlPath.reset();
    }

    @Test
    public void testLoadSwitch() throws Exception {
        PTNet ptnet = PTNet.load("switch");

        assertEquals("switch", ptnet.getName());
        assertEquals("switch", ptnet.getNet().getName());
        assertEquals(0, ptnet.getIndex().offsetOf("p1"));
        assertEquals(1, ptnet.getIndex().offsetOf("p2"));
        assertArrayEquals(new int[] {0, 0}, ptnet.emptyVector());
        assertArrayEquals(new int[] {3, 0}, ptnet.initialVector());
        assertEquals(List.of("p2"), ptnet.getNet().getRoles());

        Snapshot machine = ptnet.toMachine();
        assertArrayEquals(new int[] {3, 0}, machine.getState());
        TransitionEntry t1 = machine.getTransitions().get("t1");
        List<ArcBinding> inhibitors = t1.getArcs(ArcBinding.Direction.OUTPUT);
        assertEquals(1, inhibitors.size());
        assertTrue(inhibitors.get(0).isInhibitor());
        assertEquals("p2", inhibitors.get(0).getPlaceId());
        assertEquals("p2", inhibitors.get(0).getRole());

        ArcBinding input = t1.getArcs(ArcBinding.Direction.INPUT).get(0);
        assertEquals("p1", input.getPlaceId());
        assertEquals(1, input.getWeight());
    }

    @Test
    public void testLoadUsesFirstNet() throws Exception {
        PTNet ptnet = PTNet.load("counter");

        assertEquals("counter", ptnet.getNet().getName());
        assertArrayEquals(new int[] {0, 1}, ptnet.initialVector());
        assertEquals(2, ptnet.toMachine().getTransitions().size());
    }

    @Test
    public void testSnapshotsAreIndependent() throws Exception {
        PTNet ptnet = PTNet.load("switch");

        Snapshot first = ptnet.toMachine();
        Snapshot second = ptnet.toMachine();
        first.getState()[0] = 0;
        assertEquals(3, second.getState()[0]);
        assertSame(first.getTransitions(), second.getTransitions());
    }

    @Test
    public void testReindexReplacesIndex() throws Exception {
        PTNet ptnet = PTNet.load("switch");
        NetIndex before = ptnet.getIndex();

        ptnet.reindex();

        assertNotSame(before, ptnet.getIndex());
        assertEquals(List.of("p2"), ptnet.getNet().getRoles());
        assertArrayEquals(before.initialVector(), ptnet.initialVector());
    }

    @Test
    public void testMissingSchemaFile() {
        assertThrows(NoSuchFileException.class, () -> PTNet.load("does-not-exist"));
    }

    @Test
    public void testFileWithoutNets() throws Exception {
        Path file = Paths.get("target", "no-nets.xml");
        Files.createDirectories(file.getParent());
        Files.write(file, "<pnml/>".getBytes(StandardCharsets.UTF_8));

        assertThrows(SchemaViolationException.class,
                () -> PTNet.load("no-nets", file, net -> { }, new IncidentArcPass()));
    }

    @Test
    public void testFailingPassLeavesNoMachine() {
        IndexingException failure = new IndexingException("refused", "switch");
        IndexingException thrown = assertThrows(IndexingException.class,
                () -> PTNet.load("switch", net -> { throw failure; }, new IncidentArcPass()));
        assertSame(failure, thrown);
    }

    @Test
    public void testBuildFromNetInMemory() throws Exception {
        Net net = new Net("memory");
        PTNet ptnet = new PTNet("memory", net, n -> { }, new IncidentArcPass());

        assertEquals(0, ptnet.emptyVector().length);
        assertTrue(ptnet.toString().contains("places=0"));
    }
}
