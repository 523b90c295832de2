package ivl.hir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** <b>function {:attrs} f(a: T, ...) : R;</b> with an optional body. */
public class Function extends Declaration {

    private final String name;
    private final List<Formal> params;
    private final Type result_type;
    private Expr body;

    public Function(String name, List<Formal> params, Type result_type, Expr body, Attributes attributes) {
        super(attributes);
        this.name = name;
        this.params = new ArrayList<Formal>(params);
        this.result_type = result_type;
        this.body = body;
    }

    @Override
    public String getName() {
        return name;
    }

    public List<Formal> getParameters() {
        return Collections.unmodifiableList(params);
    }

    public Type getResultType() {
        return result_type;
    }

    public Expr getBody() {
        return body;
    }

    public void setBody(Expr body) {
        this.body = body;
    }

    @Override
    public List<? extends Traversable> getChildren() {
        return (body == null) ? null : Collections.singletonList(body);
    }

    @Override
    public void print(StringBuilder sb) {
        sb.append("function ").append(getAttributes()).append(name).append("(");
        for (int i = 0; i < params.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            params.get(i).print(sb);
        }
        sb.append(") : ").append(result_type);
        if (body == null) {
            sb.append(";");
        } else {
            sb.append(" { ");
            body.print(sb);
            sb.append(" }");
        }
    }
}
