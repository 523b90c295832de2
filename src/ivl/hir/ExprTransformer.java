package ivl.hir;

import java.util.ArrayList;
import java.util.List;

/**
 * Rebuilds an expression tree bottom-up. {@link #transform} dispatches on
 * the {@link ExprKind} of the node; subclasses override the hook of the
 * forms they rewrite and let the default rebuild the rest. The input tree
 * is never modified.
 */
public class ExprTransformer {

    public Expr transform(Expr e) {
        Expr ret;
        switch (e.getKind()) {
        case IDENTIFIER:
            ret = transformIdentifier((IdentifierExpr)e);
            break;
        case LITERAL:
            ret = e;
            break;
        case UNARY:
            ret = transformUnary((UnaryExpr)e);
            break;
        case BINARY:
            ret = transformBinary((BinaryExpr)e);
            break;
        case FUNCTION_CALL:
            ret = transformFunctionCall((FunctionCallExpr)e);
            break;
        case MAP_SELECT:
            ret = transformMapSelect((MapSelectExpr)e);
            break;
        case MAP_STORE:
            ret = transformMapStore((MapStoreExpr)e);
            break;
        case IF_THEN_ELSE:
            ret = transformIfThenElse((IfThenElseExpr)e);
            break;
        case OLD:
            ret = new OldExpr(transform(((OldExpr)e).getExpr()));
            break;
        case BV_EXTRACT:
            BvExtractExpr x = (BvExtractExpr)e;
            ret = new BvExtractExpr(transform(x.getBitvector()), x.getEnd(), x.getStart());
            break;
        default:
            throw new IllegalStateException("[ERROR in ExprTransformer] unexpected expression " + e);
        }
        if (ret != e && ret.getPosition() == Position.NONE) {
            ret.setPosition(e.getPosition());
        }
        return ret;
    }

    public List<Expr> transform(List<Expr> exprs) {
        List<Expr> ret = new ArrayList<Expr>(exprs.size());
        for (Expr e : exprs) {
            ret.add(transform(e));
        }
        return ret;
    }

    protected Expr transformIdentifier(IdentifierExpr e) {
        return e.clone();
    }

    protected Expr transformUnary(UnaryExpr e) {
        return new UnaryExpr(e.getOperator(), transform(e.getOperand()));
    }

    protected Expr transformBinary(BinaryExpr e) {
        return new BinaryExpr(e.getOperator(), transform(e.getLHS()), transform(e.getRHS()));
    }

    protected Expr transformFunctionCall(FunctionCallExpr e) {
        return new FunctionCallExpr(e.getName(), transform(e.getArguments()), e.getDecl());
    }

    protected Expr transformMapSelect(MapSelectExpr e) {
        return new MapSelectExpr(transform(e.getMap()), transform(e.getIndexes()));
    }

    protected Expr transformMapStore(MapStoreExpr e) {
        return new MapStoreExpr(transform(e.getMap()), transform(e.getIndexes()), transform(e.getValue()));
    }

    protected Expr transformIfThenElse(IfThenElseExpr e) {
        return new IfThenElseExpr(transform(e.getCondition()), transform(e.getThenExpr()),
                transform(e.getElseExpr()));
    }
}
