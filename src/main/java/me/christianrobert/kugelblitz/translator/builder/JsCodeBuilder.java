package me.christianrobert.kugelblitz.translator.builder;

import me.christianrobert.kugelblitz.translator.ast.Assign;
import me.christianrobert.kugelblitz.translator.ast.Attribute;
import me.christianrobert.kugelblitz.translator.ast.BinOp;
import me.christianrobert.kugelblitz.translator.ast.BoolOp;
import me.christianrobert.kugelblitz.translator.ast.Call;
import me.christianrobert.kugelblitz.translator.ast.ClassDef;
import me.christianrobert.kugelblitz.translator.ast.Compare;
import me.christianrobert.kugelblitz.translator.ast.Expr;
import me.christianrobert.kugelblitz.translator.ast.FunctionDef;
import me.christianrobert.kugelblitz.translator.ast.If;
import me.christianrobert.kugelblitz.translator.ast.IfExp;
import me.christianrobert.kugelblitz.translator.ast.Lambda;
import me.christianrobert.kugelblitz.translator.ast.Module;
import me.christianrobert.kugelblitz.translator.ast.Name;
import me.christianrobert.kugelblitz.translator.ast.NodeKind;
import me.christianrobert.kugelblitz.translator.ast.Num;
import me.christianrobert.kugelblitz.translator.ast.OperatorNode;
import me.christianrobert.kugelblitz.translator.ast.Return;
import me.christianrobert.kugelblitz.translator.ast.SyntaxNode;
import me.christianrobert.kugelblitz.translator.ast.Tuple;
import me.christianrobert.kugelblitz.translator.ast.UnaryOp;
import me.christianrobert.kugelblitz.translator.context.TranslationContext;
import me.christianrobert.kugelblitz.translator.context.UnsupportedNodeKindException;

/**
 * Node dispatcher: routes every syntax tree node to the static rule for its kind.
 *
 * <p>Architecture: one static {@code Visit*} helper per node kind. Each helper
 * builds its fragment from fixed syntax and the fragments of its children, which it
 * obtains by calling {@link #visit(SyntaxNode, TranslationContext)} again.</p>
 *
 * <p>The builder holds no state. Everything that depends on the position in the
 * tree travels in the {@link TranslationContext}, so one instance can serve any
 * number of concurrent translations.</p>
 */
public class JsCodeBuilder {

    // no logging is desired, this would create an overkill of logs

    /**
     * Translates a node in the given context.
     *
     * @param node node to translate
     * @param context context of the enclosing function
     * @return output fragment for the node
     * @throws UnsupportedNodeKindException if no rule exists for the node
     */
    public String visit(SyntaxNode node, TranslationContext context) {
        if (node == null) {
            throw new UnsupportedNodeKindException("Cannot translate a missing node", null);
        }
        NodeKind kind = node.getKind();
        if (kind == null) {
            throw new UnsupportedNodeKindException(
                "Node reports no kind: " + node.getClass().getSimpleName(), node.toString());
        }

        switch (kind) {
            // Declarations
            case MODULE:
                return VisitModule.v((Module) node, context, this);
            case FUNCTION_DEF:
                return VisitFunctionDef.v((FunctionDef) node, context, this);
            case CLASS_DEF:
                return VisitClassDef.v((ClassDef) node, context, this);

            // Statements
            case ASSIGN:
                return VisitAssign.v((Assign) node, context, this);
            case RETURN:
                return VisitReturn.v((Return) node, context, this);
            case IF:
                return VisitIf.v((If) node, context, this);
            case EXPR:
                return visit(((Expr) node).getValue(), context);

            // Expressions
            case NAME:
                return VisitName.v((Name) node, context);
            case NUM:
                return ((Num) node).getLiteral();
            case TUPLE:
                return VisitTuple.v((Tuple) node, context);
            case BOOL_OP:
                return VisitBoolOp.v((BoolOp) node, context, this);
            case BIN_OP:
                return VisitBinOp.v((BinOp) node, context, this);
            case UNARY_OP:
                return VisitUnaryOp.v((UnaryOp) node, context, this);
            case COMPARE:
                return VisitCompare.v((Compare) node, context, this);
            case ATTRIBUTE:
                return VisitAttribute.v((Attribute) node, context, this);
            case CALL:
                return VisitCall.v((Call) node, context, this);
            case IF_EXP:
                return VisitIfExp.v((IfExp) node, context, this);
            case LAMBDA:
                return VisitLambda.v((Lambda) node, context, this);

            // Operator leaves
            case OPERATOR:
                return OperatorLexicon.symbolFor((OperatorNode) node);

            default:
                throw new UnsupportedNodeKindException("No translation rule for node kind: " + kind, node.toString());
        }
    }

    /**
     * Translates a node at top level, outside of any function.
     */
    public String visit(SyntaxNode node) {
        return visit(node, TranslationContext.defaults());
    }
}
