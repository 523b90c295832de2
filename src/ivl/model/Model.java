package ivl.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A solver model: values of the constants and of the variables at the end
 * of the failing path, plus the captured states in the order the path
 * reached them.
 */
public class Model {

    private final Map<String, Element> values;
    private final List<CapturedState> states;

    public Model(Map<String, Element> values, List<CapturedState> states) {
        this.values = new LinkedHashMap<String, Element>(values);
        this.states = new ArrayList<CapturedState>(states);
    }

    /** Returns the value of a constant or final variable value, or null. */
    public Element tryGet(String name) {
        return values.get(name);
    }

    public Map<String, Element> getValues() {
        return Collections.unmodifiableMap(values);
    }

    /** Returns the captured states in path order. */
    public List<CapturedState> getStates() {
        return Collections.unmodifiableList(states);
    }

    /** Returns the last state captured under the given label, or null. */
    public CapturedState getState(String label) {
        for (int i = states.size() - 1; i >= 0; i--) {
            if (states.get(i).getLabel().equals(label)) {
                return states.get(i);
            }
        }
        return null;
    }
}
