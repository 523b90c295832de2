package ivl.hir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Application of a declared function, <b>f(a1, ..., an)</b>. */
public class FunctionCallExpr extends Expr {

    private final String name;
    private final List<Expr> args;
    private Function decl;

    public FunctionCallExpr(String name, List<Expr> args) {
        this(name, args, null);
    }

    public FunctionCallExpr(String name, List<Expr> args, Function decl) {
        this.name = name;
        this.args = new ArrayList<Expr>(args);
        this.decl = decl;
    }

    public String getName() {
        return name;
    }

    public List<Expr> getArguments() {
        return Collections.unmodifiableList(args);
    }

    public Function getDecl() {
        return decl;
    }

    public void setDecl(Function decl) {
        this.decl = decl;
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.FUNCTION_CALL;
    }

    @Override
    public Type getType() {
        return (decl == null) ? null : decl.getResultType();
    }

    @Override
    public List<Expr> getChildren() {
        return getArguments();
    }

    @Override
    public FunctionCallExpr clone() {
        List<Expr> copied = new ArrayList<Expr>(args.size());
        for (Expr a : args) {
            copied.add(a.clone());
        }
        FunctionCallExpr o = new FunctionCallExpr(name, copied, decl);
        o.setPosition(getPosition());
        return o;
    }

    @Override
    protected int precedence() {
        return PREC_ATOM;
    }

    @Override
    public void print(StringBuilder sb) {
        sb.append(name).append("(");
        IRTools.printList(sb, args);
        sb.append(")");
    }
}
