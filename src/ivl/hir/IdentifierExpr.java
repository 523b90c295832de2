package ivl.hir;

import java.util.List;

/**
 * A reference to a variable or constant by name. The binding to the
 * declaration is established by name resolution and may be absent in
 * freshly built IR.
 */
public class IdentifierExpr extends Expr {

    private final String name;
    private Variable decl;

    public IdentifierExpr(String name) {
        this(name, null);
    }

    public IdentifierExpr(Variable decl) {
        this(decl.getName(), decl);
    }

    public IdentifierExpr(String name, Variable decl) {
        this.name = name;
        this.decl = decl;
    }

    public String getName() {
        return name;
    }

    public Variable getDecl() {
        return decl;
    }

    public void setDecl(Variable decl) {
        this.decl = decl;
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.IDENTIFIER;
    }

    @Override
    public Type getType() {
        return (decl == null) ? null : decl.getType();
    }

    @Override
    public List<Expr> getChildren() {
        return null;
    }

    @Override
    public IdentifierExpr clone() {
        IdentifierExpr o = new IdentifierExpr(name, decl);
        o.setPosition(getPosition());
        return o;
    }

    @Override
    protected int precedence() {
        return PREC_ATOM;
    }

    @Override
    public void print(StringBuilder sb) {
        sb.append(name);
    }
}
