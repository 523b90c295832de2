package ivl.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Values of the program variables at one <b>captureState</b> point. */
public class CapturedState {

    private final String label;
    private final Map<String, Element> values;

    public CapturedState(String label, Map<String, Element> values) {
        this.label = label;
        this.values = new LinkedHashMap<String, Element>(values);
    }

    public String getLabel() {
        return label;
    }

    /** Returns the value of the variable, or null if the state has none. */
    public Element tryGet(String name) {
        return values.get(name);
    }

    public Map<String, Element> getValues() {
        return Collections.unmodifiableMap(values);
    }

    @Override
    public String toString() {
        return "state " + label;
    }
}
