package org.ptnet.index;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.Map;

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.junit.jupiter.api.Test;

public class SnapshotJsonTest {

    private static Snapshot snapshot() {
        TransitionEntry t1 = new TransitionEntry("t1", "t1");
        t1.attach(new ArcBinding("a1", "p1", 0, ArcBinding.Direction.INPUT, 1, false, null));
        t1.attach(new ArcBinding("a2", "p2", 1, ArcBinding.Direction.OUTPUT, 1, true, "p2"));
        Map<String, TransitionEntry> transitions = new LinkedHashMap<>();
        transitions.put("t1", t1);
        return new Snapshot(new int[] {3, 0}, transitions);
    }

    @Test
    public void testRendersStateAndTransitions() throws Exception {
        String json = SnapshotJson.toJsonString(snapshot());
        JSONObject parsed = (JSONObject) new JSONParser().parse(json);

        JSONArray state = (JSONArray) parsed.get("state");
        assertEquals(2, state.size());
        assertEquals(3L, state.get(0));
        assertEquals(0L, state.get(1));

        JSONObject t1 = (JSONObject) ((JSONObject) parsed.get("transitions")).get("t1");
        assertEquals("t1", t1.get("label"));
        JSONArray arcs = (JSONArray) t1.get("arcs");
        assertEquals(2, arcs.size());

        JSONObject input = (JSONObject) arcs.get(0);
        assertEquals("INPUT", input.get("direction"));
        assertEquals(Boolean.FALSE, input.get("inhibitor"));
        assertFalse(input.containsKey("role"));

        JSONObject inhibitor = (JSONObject) arcs.get(1);
        assertEquals(Boolean.TRUE, inhibitor.get("inhibitor"));
        assertEquals("p2", inhibitor.get("role"));
        assertEquals(1L, inhibitor.get("offset"));
    }

    @Test
    public void testEmptySnapshot() {
        String json = SnapshotJson.toJsonString(new Snapshot(new int[0], new LinkedHashMap<>()));
        assertTrue(json.contains("\"state\":[]"));
        assertTrue(json.contains("\"transitions\":{}"));
    }
}
