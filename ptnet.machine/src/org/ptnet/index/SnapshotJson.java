package org.ptnet.index;

import java.util.Map;

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;

/**
 * JSON rendering of a snapshot, for engines running outside this process.
 *
 * <pre>
 * {"state":[3,0],
 *  "transitions":{"t1":{"label":"t1","arcs":[{"arc":"a1","place":"p1","offset":0,
 *                       "direction":"INPUT","weight":1,"inhibitor":false}]}}}
 * </pre>
 */
public final class SnapshotJson {

    private SnapshotJson() {
    }

    @SuppressWarnings("unchecked")
    public static JSONObject toJson(Snapshot snapshot) {
        JSONArray state = new JSONArray();
        for (int tokens : snapshot.getState()) {
            state.add(tokens);
        }

        JSONObject transitions = new JSONObject();
        for (Map.Entry<String, TransitionEntry> e : snapshot.getTransitions().entrySet()) {
            JSONArray arcs = new JSONArray();
            for (ArcBinding binding : e.getValue().getArcs()) {
                JSONObject arc = new JSONObject();
                arc.put("arc", binding.getArcId());
                arc.put("place", binding.getPlaceId());
                arc.put("offset", binding.getOffset());
                arc.put("direction", binding.getDirection().name());
                arc.put("weight", binding.getWeight());
                arc.put("inhibitor", binding.isInhibitor());
                if (binding.getRole() != null) {
                    arc.put("role", binding.getRole());
                }
                arcs.add(arc);
            }
            JSONObject transition = new JSONObject();
            transition.put("label", e.getValue().getLabel());
            transition.put("arcs", arcs);
            transitions.put(e.getKey(), transition);
        }

        JSONObject json = new JSONObject();
        json.put("state", state);
        json.put("transitions", transitions);
        return json;
    }

    public static String toJsonString(Snapshot snapshot) {
        return toJson(snapshot).toJSONString();
    }
}
