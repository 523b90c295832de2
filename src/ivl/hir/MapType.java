package ivl.hir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** A map type <b>[T1, ..., Tn]R</b>. Arrays of the kernel are maps. */
public final class MapType extends Type {

    private final List<Type> arguments;
    private final Type result;

    public MapType(List<Type> arguments, Type result) {
        this.arguments = Collections.unmodifiableList(new ArrayList<Type>(arguments));
        this.result = result;
    }

    public MapType(Type argument, Type result) {
        this(Collections.singletonList(argument), result);
    }

    @Override
    public boolean isMap() {
        return true;
    }

    public List<Type> getArguments() {
        return arguments;
    }

    public Type getResult() {
        return result;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < arguments.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(arguments.get(i));
        }
        sb.append("]").append(result);
        return sb.toString();
    }
}
