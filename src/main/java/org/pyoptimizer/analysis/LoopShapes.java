package org.pyoptimizer.analysis;

import org.pyoptimizer.astnode.*;

import java.util.List;

/**
 * Structural tests on loops shared by the analyzer and the rewrite rules.
 * <p>
 * A counted loop is {@code for <name> in range(<1 to 3 positional arguments>)}
 * without {@code async}.
 */
public class LoopShapes {

    private LoopShapes() {
    }

    public static boolean isCall(Node node, String functionName) {
        return node instanceof CallNode call
                && call.function instanceof IdentifierNode function
                && function.name.equals(functionName);
    }

    private static boolean hasPlainArguments(CallNode call) {
        for (Node argument : call.arguments) {
            if (argument instanceof StarredNode || argument instanceof KeywordArgumentNode) {
                return false;
            }
        }
        return true;
    }

    /**
     * The {@code range(...)} call of a counted loop, or null for any other loop.
     */
    public static CallNode rangeCall(ForNode loop) {
        if (loop.isAsync || !(loop.target instanceof IdentifierNode) || !isCall(loop.iterable, "range")) {
            return null;
        }
        CallNode call = (CallNode) loop.iterable;
        if (call.arguments.isEmpty() || call.arguments.size() > 3 || !hasPlainArguments(call)) {
            return null;
        }
        return call;
    }

    public static boolean isCountedLoop(Node node) {
        return node instanceof ForNode loop && rangeCall(loop) != null;
    }

    public static String loopVariable(ForNode loop) {
        return loop.target instanceof IdentifierNode identifier ? identifier.name : null;
    }

    /**
     * For {@code range(len(X))} and {@code range(0, len(X))}, returns X; otherwise null.
     */
    public static Node lengthSource(ForNode loop) {
        CallNode range = rangeCall(loop);
        if (range == null) {
            return null;
        }
        List<Node> arguments = range.arguments;
        Node lengthCall;
        if (arguments.size() == 1) {
            lengthCall = arguments.get(0);
        } else if (arguments.size() == 2 && arguments.get(0) instanceof NumberNode start
                && "0".equals(start.value)) {
            lengthCall = arguments.get(1);
        } else {
            return null;
        }
        if (isCall(lengthCall, "len") && ((CallNode) lengthCall).arguments.size() == 1
                && hasPlainArguments((CallNode) lengthCall)) {
            return ((CallNode) lengthCall).arguments.get(0);
        }
        return null;
    }

    /**
     * The only statement of the loop body when it is itself a counted loop, else null.
     */
    public static ForNode perfectlyNestedInner(ForNode outer) {
        if (outer.body.elements.size() == 1 && isCountedLoop(outer.body.elements.get(0))) {
            return (ForNode) outer.body.elements.get(0);
        }
        return null;
    }

    /**
     * The body of the scope holding the node: the enclosing function body, or the
     * module body.
     */
    public static BlockNode scopeBody(TreeIndex index, ModuleNode module, Node node) {
        FunctionDefNode function = index.enclosingFunction(node);
        return function != null ? function.body : module.body;
    }

    /**
     * True when the statement sits directly in a class body.
     */
    public static boolean isInClassBody(TreeIndex index, Node statement) {
        return index.ownerOf(statement) instanceof ClassDefNode;
    }
}
