package ivl.hir;

import java.util.ArrayList;
import java.util.List;

/**
 * A procedure signature with its contract. The body, if any, lives in a
 * separate {@link Implementation} with the same name.
 */
public class Procedure extends Declaration {

    private final String name;
    private List<Formal> in_params;
    private List<Formal> out_params;
    private List<Requires> requires;
    private List<Ensures> ensures;
    private List<IdentifierExpr> modifies;

    public Procedure(String name, List<Formal> in_params, List<Formal> out_params,
            List<Requires> requires, List<Ensures> ensures, List<IdentifierExpr> modifies,
            Attributes attributes) {
        super(attributes);
        this.name = name;
        this.in_params = new ArrayList<Formal>(in_params);
        this.out_params = new ArrayList<Formal>(out_params);
        this.requires = new ArrayList<Requires>(requires);
        this.ensures = new ArrayList<Ensures>(ensures);
        this.modifies = new ArrayList<IdentifierExpr>(modifies);
    }

    public Procedure(String name, List<Formal> in_params, List<Formal> out_params, Attributes attributes) {
        this(name, in_params, out_params, new ArrayList<Requires>(), new ArrayList<Ensures>(),
                new ArrayList<IdentifierExpr>(), attributes);
    }

    @Override
    public String getName() {
        return name;
    }

    public List<Formal> getInParams() {
        return in_params;
    }

    public void setInParams(List<Formal> in_params) {
        this.in_params = new ArrayList<Formal>(in_params);
    }

    public List<Formal> getOutParams() {
        return out_params;
    }

    public void setOutParams(List<Formal> out_params) {
        this.out_params = new ArrayList<Formal>(out_params);
    }

    public List<Requires> getRequires() {
        return requires;
    }

    public void setRequires(List<Requires> requires) {
        this.requires = new ArrayList<Requires>(requires);
    }

    public List<Ensures> getEnsures() {
        return ensures;
    }

    public void setEnsures(List<Ensures> ensures) {
        this.ensures = new ArrayList<Ensures>(ensures);
    }

    public List<IdentifierExpr> getModifies() {
        return modifies;
    }

    public void setModifies(List<IdentifierExpr> modifies) {
        this.modifies = new ArrayList<IdentifierExpr>(modifies);
    }

    @Override
    public List<Traversable> getChildren() {
        List<Traversable> ret = new ArrayList<Traversable>();
        ret.addAll(requires);
        ret.addAll(ensures);
        ret.addAll(modifies);
        return ret;
    }

    @Override
    public void print(StringBuilder sb) {
        sb.append("procedure ").append(getAttributes()).append(name);
        IRTools.printSignature(sb, in_params, out_params);
        sb.append(";");
        for (Requires r : requires) {
            sb.append(PrintTools.line_sep).append("  ");
            r.print(sb);
        }
        if (!modifies.isEmpty()) {
            sb.append(PrintTools.line_sep).append("  modifies ");
            IRTools.printList(sb, modifies);
            sb.append(";");
        }
        for (Ensures e : ensures) {
            sb.append(PrintTools.line_sep).append("  ");
            e.print(sb);
        }
    }
}
