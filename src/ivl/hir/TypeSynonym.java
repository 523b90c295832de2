package ivl.hir;

/** <b>type N = T;</b> */
public class TypeSynonym extends Declaration {

    private final String name;
    private final Type body;

    public TypeSynonym(String name, Type body, Attributes attributes) {
        super(attributes);
        this.name = name;
        this.body = body;
    }

    @Override
    public String getName() {
        return name;
    }

    public Type getBody() {
        return body;
    }

    @Override
    public void print(StringBuilder sb) {
        sb.append("type ").append(getAttributes()).append(name).append(" = ").append(body).append(";");
    }
}
