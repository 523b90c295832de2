package ivl.model;

/** A value the solver reports without interpretation, such as a map. */
public class UninterpretedElement extends Element {

    private final String token;

    public UninterpretedElement(String token) {
        this.token = token;
    }

    @Override
    public boolean equals(Object o) {
        return (o instanceof UninterpretedElement) && ((UninterpretedElement)o).token.equals(token);
    }

    @Override
    public int hashCode() {
        return token.hashCode();
    }

    @Override
    public String toString() {
        return token;
    }
}
