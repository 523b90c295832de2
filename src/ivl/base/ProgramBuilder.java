package ivl.base;

import ivl.base.grammars.IVLBaseVisitor;
import ivl.base.grammars.IVLParser;
import ivl.hir.*;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.tree.TerminalNode;

/**
 * Builds the HIR from an IVL parse tree. Type synonyms are expanded at their
 * uses; names are left unbound for {@link NameResolver}.
 */
public class ProgramBuilder extends IVLBaseVisitor<Object> {

    private final String file_name;
    private final Map<String, Type> synonyms = new HashMap<String, Type>();

    public ProgramBuilder(String file_name) {
        this.file_name = file_name;
    }

    private Position pos(ParserRuleContext ctx) {
        return new Position(file_name, ctx.getStart().getLine(),
                ctx.getStart().getCharPositionInLine() + 1);
    }

    private Position pos(TerminalNode node) {
        return new Position(file_name, node.getSymbol().getLine(),
                node.getSymbol().getCharPositionInLine() + 1);
    }

    @Override
    public Program visitProgram(IVLParser.ProgramContext ctx) {
        // synonyms may be used before they are declared
        for (IVLParser.DeclarationContext d : ctx.declaration()) {
            if (d.typeSynonym() != null) {
                IVLParser.TypeSynonymContext ts = d.typeSynonym();
                synonyms.put(ts.ID().getText(), null);
            }
        }
        for (IVLParser.DeclarationContext d : ctx.declaration()) {
            if (d.typeSynonym() != null) {
                IVLParser.TypeSynonymContext ts = d.typeSynonym();
                synonyms.put(ts.ID().getText(), type(ts.type()));
            }
        }
        Program program = new Program();
        for (IVLParser.DeclarationContext d : ctx.declaration()) {
            program.addDeclaration((Declaration)visit(d.getChild(0)));
        }
        return program;
    }

    @Override
    public TypeSynonym visitTypeSynonym(IVLParser.TypeSynonymContext ctx) {
        TypeSynonym ts = new TypeSynonym(ctx.ID().getText(), synonyms.get(ctx.ID().getText()),
                attributes(ctx.attribute()));
        ts.setPosition(pos(ctx));
        return ts;
    }

    @Override
    public Constant visitConstantDecl(IVLParser.ConstantDeclContext ctx) {
        Constant c = new Constant(ctx.ID().getText(), type(ctx.type()), attributes(ctx.attribute()),
                ctx.UNIQUE() != null);
        c.setPosition(pos(ctx.ID()));
        return c;
    }

    @Override
    public GlobalVariable visitGlobalVarDecl(IVLParser.GlobalVarDeclContext ctx) {
        GlobalVariable v = new GlobalVariable(ctx.ID().getText(), type(ctx.type()),
                attributes(ctx.attribute()));
        v.setPosition(pos(ctx.ID()));
        return v;
    }

    @Override
    public Function visitFunctionDecl(IVLParser.FunctionDeclContext ctx) {
        List<Formal> params = new ArrayList<Formal>();
        for (IVLParser.FunctionParamContext p : ctx.functionParam()) {
            String name = (p.ID() == null) ? "" : p.ID().getText();
            params.add(new Formal(name, type(p.type()), true));
        }
        Expr body = (ctx.expr() == null) ? null : expr(ctx.expr());
        Function f = new Function(ctx.ID().getText(), params, type(ctx.type()), body,
                attributes(ctx.attribute()));
        f.setPosition(pos(ctx.ID()));
        return f;
    }

    @Override
    public Axiom visitAxiomDecl(IVLParser.AxiomDeclContext ctx) {
        Axiom a = new Axiom(expr(ctx.expr()), attributes(ctx.attribute()));
        a.setPosition(pos(ctx));
        return a;
    }

    @Override
    public Procedure visitProcedureDecl(IVLParser.ProcedureDeclContext ctx) {
        List<Requires> requires = new ArrayList<Requires>();
        List<Ensures> ensures = new ArrayList<Ensures>();
        List<IdentifierExpr> modifies = new ArrayList<IdentifierExpr>();
        for (IVLParser.SpecificationContext s : ctx.specification()) {
            if (s instanceof IVLParser.RequiresSpecContext) {
                IVLParser.RequiresSpecContext r = (IVLParser.RequiresSpecContext)s;
                Requires req = new Requires(r.FREE() != null, expr(r.expr()), attributes(r.attribute()));
                req.setPosition(pos(r));
                requires.add(req);
            } else if (s instanceof IVLParser.EnsuresSpecContext) {
                IVLParser.EnsuresSpecContext e = (IVLParser.EnsuresSpecContext)s;
                Ensures ens = new Ensures(e.FREE() != null, expr(e.expr()), attributes(e.attribute()));
                ens.setPosition(pos(e));
                ensures.add(ens);
            } else {
                for (TerminalNode id : ((IVLParser.ModifiesSpecContext)s).ID()) {
                    modifies.add(identifier(id));
                }
            }
        }
        Procedure p = new Procedure(ctx.ID().getText(), formals(ctx.ins, true), formals(ctx.outs, false),
                requires, ensures, modifies, attributes(ctx.attribute()));
        p.setPosition(pos(ctx.ID()));
        return p;
    }

    @Override
    public Implementation visitImplementationDecl(IVLParser.ImplementationDeclContext ctx) {
        IVLParser.ImplBodyContext body = ctx.implBody();
        List<LocalVariable> locals = new ArrayList<LocalVariable>();
        for (IVLParser.LocalDeclContext l : body.localDecl()) {
            LocalVariable v = new LocalVariable(l.ID().getText(), type(l.type()), attributes(l.attribute()));
            v.setPosition(pos(l.ID()));
            locals.add(v);
        }
        List<Block> blocks = new ArrayList<Block>();
        for (IVLParser.BlockContext b : body.block()) {
            blocks.add(visitBlock(b));
        }
        Implementation impl = new Implementation(ctx.ID().getText(), formals(ctx.ins, true),
                formals(ctx.outs, false), locals, blocks, attributes(ctx.attribute()));
        impl.setPosition(pos(ctx.ID()));
        return impl;
    }

    @Override
    public Block visitBlock(IVLParser.BlockContext ctx) {
        List<Cmd> cmds = new ArrayList<Cmd>();
        for (IVLParser.CommandContext c : ctx.command()) {
            Cmd cmd = (Cmd)visit(c);
            cmd.setPosition(pos(c));
            cmds.add(cmd);
        }
        TransferCmd transfer = (TransferCmd)visit(ctx.transfer());
        transfer.setPosition(pos(ctx.transfer()));
        return new Block(ctx.ID().getText(), cmds, transfer);
    }

    @Override
    public AssertCmd visitAssertCmd(IVLParser.AssertCmdContext ctx) {
        return new AssertCmd(expr(ctx.expr()), attributes(ctx.attribute()));
    }

    @Override
    public AssumeCmd visitAssumeCmd(IVLParser.AssumeCmdContext ctx) {
        return new AssumeCmd(expr(ctx.expr()), attributes(ctx.attribute()));
    }

    @Override
    public HavocCmd visitHavocCmd(IVLParser.HavocCmdContext ctx) {
        List<IdentifierExpr> vars = new ArrayList<IdentifierExpr>();
        for (TerminalNode id : ctx.ID()) {
            vars.add(identifier(id));
        }
        return new HavocCmd(vars);
    }

    @Override
    public AssignCmd visitAssignCmd(IVLParser.AssignCmdContext ctx) {
        List<AssignLhs> lhss = new ArrayList<AssignLhs>();
        for (IVLParser.LhsContext l : ctx.lhs()) {
            AssignLhs lhs = new SimpleAssignLhs(identifier(l.ID()));
            for (IVLParser.ExprListContext indexes : l.exprList()) {
                lhs = new MapAssignLhs(lhs, exprs(indexes));
            }
            lhss.add(lhs);
        }
        List<Expr> rhss = new ArrayList<Expr>();
        for (IVLParser.ExprContext e : ctx.expr()) {
            rhss.add(expr(e));
        }
        if (lhss.size() != rhss.size()) {
            throw new ParseException("assignment arity mismatch", pos(ctx));
        }
        return new AssignCmd(lhss, rhss);
    }

    @Override
    public CallCmd visitCallCmd(IVLParser.CallCmdContext ctx) {
        List<TerminalNode> ids = ctx.ID();
        List<IdentifierExpr> outs = new ArrayList<IdentifierExpr>();
        for (int i = 0; i < ids.size() - 1; i++) {
            outs.add(identifier(ids.get(i)));
        }
        List<Expr> ins = (ctx.exprList() == null) ? new ArrayList<Expr>() : exprs(ctx.exprList());
        return new CallCmd(ids.get(ids.size() - 1).getText(), ins, outs, attributes(ctx.attribute()));
    }

    @Override
    public GotoCmd visitGotoCmd(IVLParser.GotoCmdContext ctx) {
        List<String> targets = new ArrayList<String>();
        for (TerminalNode id : ctx.ID()) {
            targets.add(id.getText());
        }
        return new GotoCmd(targets);
    }

    @Override
    public ReturnCmd visitReturnCmd(IVLParser.ReturnCmdContext ctx) {
        return new ReturnCmd();
    }

    /* Types */

    private Type type(IVLParser.TypeContext ctx) {
        return (Type)visit(ctx);
    }

    @Override
    public Type visitBoolType(IVLParser.BoolTypeContext ctx) {
        return BasicType.BOOL;
    }

    @Override
    public Type visitIntType(IVLParser.IntTypeContext ctx) {
        return BasicType.INT;
    }

    @Override
    public Type visitBvType(IVLParser.BvTypeContext ctx) {
        return Type.getBvType(Integer.parseInt(ctx.BVTYPE().getText().substring(2)));
    }

    @Override
    public Type visitMapType(IVLParser.MapTypeContext ctx) {
        List<IVLParser.TypeContext> types = ctx.type();
        List<Type> args = new ArrayList<Type>();
        for (int i = 0; i < types.size() - 1; i++) {
            args.add(type(types.get(i)));
        }
        return new MapType(args, type(types.get(types.size() - 1)));
    }

    @Override
    public Type visitNamedType(IVLParser.NamedTypeContext ctx) {
        String name = ctx.ID().getText();
        if (!synonyms.containsKey(name)) {
            throw new ParseException("unknown type " + name, pos(ctx));
        }
        Type t = synonyms.get(name);
        if (t == null) {
            throw new ParseException("type synonym " + name + " cannot be resolved", pos(ctx));
        }
        return t;
    }

    /* Attributes and formals */

    private Attributes attributes(List<IVLParser.AttributeContext> ctxs) {
        Attributes attrs = new Attributes();
        for (IVLParser.AttributeContext a : ctxs) {
            List<Object> params = new ArrayList<Object>();
            for (IVLParser.AttributeParamContext p : a.attributeParam()) {
                if (p.STRING() != null) {
                    params.add(unquote(p.STRING().getText()));
                } else {
                    params.add(expr(p.expr()));
                }
            }
            attrs.add(a.ID().getText(), params.toArray());
        }
        return attrs;
    }

    private List<Formal> formals(IVLParser.FormalsContext ctx, boolean incoming) {
        List<Formal> ret = new ArrayList<Formal>();
        if (ctx == null) {
            return ret;
        }
        for (IVLParser.FormalContext f : ctx.formal()) {
            Formal formal = new Formal(f.ID().getText(), type(f.type()), attributes(f.attribute()), incoming);
            formal.setPosition(pos(f.ID()));
            ret.add(formal);
        }
        return ret;
    }

    private static String unquote(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 1; i < s.length() - 1; i++) {
            char c = s.charAt(i);
            if (c == '\\' && i + 1 < s.length() - 1) {
                i++;
                c = s.charAt(i);
            }
            sb.append(c);
        }
        return sb.toString();
    }

    /* Expressions */

    private IdentifierExpr identifier(TerminalNode id) {
        IdentifierExpr e = new IdentifierExpr(id.getText());
        e.setPosition(pos(id));
        return e;
    }

    private List<Expr> exprs(IVLParser.ExprListContext ctx) {
        List<Expr> ret = new ArrayList<Expr>();
        for (IVLParser.ExprContext e : ctx.expr()) {
            ret.add(expr(e));
        }
        return ret;
    }

    private Expr expr(IVLParser.ExprContext ctx) {
        Expr e = (Expr)visit(ctx);
        if (e.getPosition() == Position.NONE && !(e instanceof LiteralExpr)) {
            e.setPosition(pos(ctx));
        }
        return e;
    }

    @Override
    public Expr visitExtractExpr(IVLParser.ExtractExprContext ctx) {
        return new BvExtractExpr(expr(ctx.expr()), Integer.parseInt(ctx.INT(0).getText()),
                Integer.parseInt(ctx.INT(1).getText()));
    }

    @Override
    public Expr visitStoreExpr(IVLParser.StoreExprContext ctx) {
        return new MapStoreExpr(expr(ctx.expr(0)), exprs(ctx.exprList()), expr(ctx.expr(1)));
    }

    @Override
    public Expr visitSelectExpr(IVLParser.SelectExprContext ctx) {
        return new MapSelectExpr(expr(ctx.expr()), exprs(ctx.exprList()));
    }

    @Override
    public Expr visitUnaryExpr(IVLParser.UnaryExprContext ctx) {
        UnaryOperator op = ctx.op.getText().equals("!") ? UnaryOperator.NOT : UnaryOperator.NEG;
        return new UnaryExpr(op, expr(ctx.expr()));
    }

    private Expr binary(String symbol, IVLParser.ExprContext l, IVLParser.ExprContext r) {
        return new BinaryExpr(BinaryOperator.fromSymbol(symbol), expr(l), expr(r));
    }

    @Override
    public Expr visitMulExpr(IVLParser.MulExprContext ctx) {
        return binary(ctx.op.getText(), ctx.expr(0), ctx.expr(1));
    }

    @Override
    public Expr visitAddExpr(IVLParser.AddExprContext ctx) {
        return binary(ctx.op.getText(), ctx.expr(0), ctx.expr(1));
    }

    @Override
    public Expr visitConcatExpr(IVLParser.ConcatExprContext ctx) {
        return binary("++", ctx.expr(0), ctx.expr(1));
    }

    @Override
    public Expr visitRelExpr(IVLParser.RelExprContext ctx) {
        return binary(ctx.op.getText(), ctx.expr(0), ctx.expr(1));
    }

    @Override
    public Expr visitAndExpr(IVLParser.AndExprContext ctx) {
        return binary("&&", ctx.expr(0), ctx.expr(1));
    }

    @Override
    public Expr visitOrExpr(IVLParser.OrExprContext ctx) {
        return binary("||", ctx.expr(0), ctx.expr(1));
    }

    @Override
    public Expr visitImpliesExpr(IVLParser.ImpliesExprContext ctx) {
        return binary("==>", ctx.expr(0), ctx.expr(1));
    }

    @Override
    public Expr visitIffExpr(IVLParser.IffExprContext ctx) {
        return binary("<==>", ctx.expr(0), ctx.expr(1));
    }

    @Override
    public Expr visitIteExpr(IVLParser.IteExprContext ctx) {
        return new IfThenElseExpr(expr(ctx.expr(0)), expr(ctx.expr(1)), expr(ctx.expr(2)));
    }

    @Override
    public Expr visitOldExpr(IVLParser.OldExprContext ctx) {
        return new OldExpr(expr(ctx.expr()));
    }

    @Override
    public Expr visitCallExpr(IVLParser.CallExprContext ctx) {
        List<Expr> args = (ctx.exprList() == null) ? new ArrayList<Expr>() : exprs(ctx.exprList());
        return new FunctionCallExpr(ctx.ID().getText(), args);
    }

    @Override
    public Expr visitBvLiteral(IVLParser.BvLiteralContext ctx) {
        String text = ctx.BVLIT().getText();
        int idx = text.indexOf("bv");
        return LiteralExpr.bv(new BigInteger(text.substring(0, idx)),
                Integer.parseInt(text.substring(idx + 2)));
    }

    @Override
    public Expr visitIntLiteral(IVLParser.IntLiteralContext ctx) {
        return LiteralExpr.integer(new BigInteger(ctx.INT().getText()));
    }

    @Override
    public Expr visitBoolLiteral(IVLParser.BoolLiteralContext ctx) {
        return LiteralExpr.bool(ctx.getText().equals("true"));
    }

    @Override
    public Expr visitIdentExpr(IVLParser.IdentExprContext ctx) {
        return identifier(ctx.ID());
    }

    @Override
    public Expr visitParenExpr(IVLParser.ParenExprContext ctx) {
        return expr(ctx.expr());
    }
}
