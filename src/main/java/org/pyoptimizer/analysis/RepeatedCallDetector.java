package org.pyoptimizer.analysis;

import org.pyoptimizer.astnode.*;
import org.pyoptimizer.astvisitor.NameUsageVisitor;
import org.pyoptimizer.astvisitor.TraversingVisitor;
import org.pyoptimizer.astvisitor.UnparseVisitor;
import org.pyoptimizer.model.Anchor;
import org.pyoptimizer.model.Evidence;
import org.pyoptimizer.model.Finding;
import org.pyoptimizer.model.FindingKind;

import java.util.*;

/**
 * Finds calls repeated with the same arguments inside one scope.
 * <p>
 * The module body and every function body are separate scopes. Statements are walked
 * in order while a generation number is kept per name; any store to a name, or any
 * in-place modification of the object it holds, starts a new generation. Two call
 * sites are the same computation when callee and arguments match and every name
 * involved is still in the same generation. Loops bump every name they store both
 * on entry and on exit, so a store anywhere in a loop separates calls before, inside
 * and after it.
 */
public class RepeatedCallDetector {
    private static final Set<String> EXCLUDED_FUNCTIONS = Set.of(
            "print", "input", "open", "next", "iter", "exec", "eval", "compile", "setattr", "delattr",
            "getattr", "globals", "locals", "vars", "breakpoint", "help", "exit", "quit", "__import__",
            "super", "list", "dict", "set", "bytearray", "object", "range", "enumerate", "zip", "map",
            "filter", "reversed");
    private static final Set<String> EXCLUDED_MODULES = Set.of(
            "random", "time", "os", "sys", "io", "subprocess", "secrets", "uuid", "datetime", "socket",
            "shutil", "threading", "logging");

    private final Set<String> importedModules = new HashSet<>();
    private final Set<String> classNames = new HashSet<>();
    private final Map<String, Integer> generations = new HashMap<>();
    private final Map<String, List<CallNode>> sites = new LinkedHashMap<>();

    private RepeatedCallDetector(ModuleNode module) {
        Set<String> patched = new HashSet<>();
        new TraversingVisitor() {
            @Override
            public void visit(ImportNode node) {
                for (ImportAlias alias : node.names) {
                    String topLevel = alias.name().split("\\.")[0];
                    if (!EXCLUDED_MODULES.contains(topLevel)) {
                        importedModules.add(alias.boundName());
                    }
                }
            }

            @Override
            public void visit(ClassDefNode node) {
                classNames.add(node.name);
                visitChildren(node);
            }

            // Modules patched at runtime are not fixed callees.
            @Override
            public void visit(AssignNode node) {
                node.targets.forEach(target -> patched.add(NameUsageVisitor.rootName(target)));
                visitChildren(node);
            }

            @Override
            public void visit(AugAssignNode node) {
                patched.add(NameUsageVisitor.rootName(node.target));
                visitChildren(node);
            }

            @Override
            public void visit(DeleteNode node) {
                node.targets.forEach(target -> patched.add(NameUsageVisitor.rootName(target)));
            }
        }.visit(module);
        importedModules.removeAll(patched);
    }

    /**
     * Reports every repeated call of the module, one finding per distinct call, in
     * order of first appearance per scope.
     */
    public static List<Finding> detect(ModuleNode module) {
        RepeatedCallDetector detector = new RepeatedCallDetector(module);
        List<Finding> findings = new ArrayList<>();
        for (BlockNode scope : scopes(module)) {
            findings.addAll(detector.detectInScope(scope));
        }
        return findings;
    }

    private static List<BlockNode> scopes(ModuleNode module) {
        List<BlockNode> scopes = new ArrayList<>();
        scopes.add(module.body);
        new TraversingVisitor() {
            @Override
            public void visit(FunctionDefNode node) {
                scopes.add(node.body);
                visitChildren(node);
            }
        }.visit(module);
        return scopes;
    }

    private List<Finding> detectInScope(BlockNode scope) {
        generations.clear();
        sites.clear();
        walk(scope);
        List<Finding> findings = new ArrayList<>();
        for (List<CallNode> calls : sites.values()) {
            if (calls.size() < 2) {
                continue;
            }
            CallNode first = calls.get(0);
            List<Integer> lines = new ArrayList<>();
            for (CallNode call : calls) {
                lines.add(call.getSpan().startLine());
            }
            Map<String, Object> evidence = new LinkedHashMap<>();
            evidence.put(Evidence.CALLEE, UnparseVisitor.unparse(first.function));
            evidence.put(Evidence.SIGNATURE, UnparseVisitor.unparse(first));
            evidence.put(Evidence.CALL_SITE_LINES, lines);
            findings.add(new Finding(FindingKind.REPEATED_COMPUTATION, Anchor.of(first), evidence));
        }
        return findings;
    }

    private void walk(BlockNode block) {
        if (block == null) {
            return;
        }
        for (Node statement : block.elements) {
            walkStatement(statement);
        }
    }

    private void walkStatement(Node statement) {
        if (statement instanceof ForNode loop) {
            bumpAll(loop);
            collect(loop.iterable);
            walk(loop.body);
            walk(loop.elseBlock);
            bumpAll(loop);
        } else if (statement instanceof WhileNode loop) {
            bumpAll(loop);
            collect(loop.condition);
            walk(loop.body);
            walk(loop.elseBlock);
            bumpAll(loop);
        } else if (statement instanceof IfNode branch) {
            collect(branch.condition);
            walk(branch.thenBlock);
            walk(branch.elseBlock);
        } else if (statement instanceof WithNode with) {
            for (WithItem item : with.items) {
                collect(item.context());
                bumpStores(item.target());
            }
            walk(with.body);
        } else if (statement instanceof TryNode tryNode) {
            walk(tryNode.body);
            for (ExceptHandler handler : tryNode.handlers) {
                if (handler.name() != null) {
                    bump(handler.name());
                }
                walk(handler.body());
            }
            walk(tryNode.elseBlock);
            walk(tryNode.finallyBlock);
        } else if (statement instanceof FunctionDefNode || statement instanceof ClassDefNode) {
            // Bodies are scopes of their own; only the bound name changes here.
            bumpAll(statement);
        } else {
            collect(statement);
            bumpAll(statement);
        }
    }

    private void bumpAll(Node node) {
        NameUsageVisitor usage = NameUsageVisitor.scan(node);
        usage.getStored().forEach(this::bump);
        for (String name : usage.getMutated()) {
            // Calling a function of an imported module does not change the module.
            if (!importedModules.contains(name)) {
                bump(name);
            }
        }
    }

    private void bumpStores(Node target) {
        if (target != null) {
            NameUsageVisitor usage = NameUsageVisitor.scan(target);
            usage.getLoaded().forEach(this::bump);
        }
    }

    private void bump(String name) {
        generations.merge(name, 1, Integer::sum);
    }

    private int generation(String name) {
        return generations.getOrDefault(name, 0);
    }

    private void collect(Node expression) {
        CallCollector collector = new CallCollector();
        expression.accept(collector);
        for (CallNode call : collector.calls) {
            String key = key(call, collector.walrusTargets);
            if (key != null) {
                sites.computeIfAbsent(key, k -> new ArrayList<>()).add(call);
            }
        }
    }

    /**
     * The identity of a call as a computation, or null when the call is not a candidate.
     */
    private String key(CallNode call, Set<String> walrusTargets) {
        List<String> names = new ArrayList<>();
        String callee = callee(call.function, names);
        if (callee == null) {
            return null;
        }
        StringBuilder key = new StringBuilder(callee).append('(');
        for (Node argument : call.arguments) {
            Node value = argument;
            if (argument instanceof KeywordArgumentNode keyword) {
                key.append(keyword.name).append('=');
                value = keyword.value;
            }
            if (value instanceof IdentifierNode identifier) {
                names.add(identifier.name);
                key.append(identifier.name);
            } else if (isLiteral(value)) {
                key.append(UnparseVisitor.unparse(value));
            } else {
                return null;
            }
            key.append(',');
        }
        key.append(')');
        for (String name : names) {
            if (walrusTargets.contains(name)) {
                return null;
            }
            key.append(' ').append(name).append('#').append(generation(name));
        }
        return key.toString();
    }

    private String callee(Node function, List<String> names) {
        if (function instanceof IdentifierNode identifier) {
            if (EXCLUDED_FUNCTIONS.contains(identifier.name) || classNames.contains(identifier.name)) {
                return null;
            }
            names.add(identifier.name);
            return identifier.name;
        }
        if (function instanceof AttributeNode attribute) {
            StringBuilder path = new StringBuilder(attribute.attribute);
            Node current = attribute.value;
            while (current instanceof AttributeNode inner) {
                path.insert(0, inner.attribute + ".");
                current = inner.value;
            }
            if (current instanceof IdentifierNode root && importedModules.contains(root.name)) {
                names.add(root.name);
                return root.name + "." + path;
            }
        }
        return null;
    }

    private static boolean isLiteral(Node node) {
        return node instanceof NumberNode
                || node instanceof ConstantNode
                || node instanceof StringNode string && !string.isFormatted();
    }

    /**
     * Collects the calls of an expression outside lambdas and comprehensions, and the
     * names bound by assignment expressions.
     */
    private static class CallCollector extends TraversingVisitor {
        final List<CallNode> calls = new ArrayList<>();
        final Set<String> walrusTargets = new HashSet<>();

        @Override
        public void visit(CallNode node) {
            calls.add(node);
            visitChildren(node);
        }

        @Override
        public void visit(NamedExpressionNode node) {
            walrusTargets.add(node.target.name);
            visitChildren(node);
        }

        // Not evaluated where they appear.
        @Override
        public void visit(LambdaNode node) {
        }

        @Override
        public void visit(ComprehensionNode node) {
        }
    }
}
