package com.treeq.predicate;

import com.treeq.error.QueryCallbackException;
import com.treeq.tree.SyntaxNode;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Pure, re-evaluable test over a node. Instances form an expression tree through
 * {@link #and}, {@link #or} and {@link #not}; both binary combinators short-circuit.
 */
public sealed interface NodePredicate {
    boolean matches(SyntaxNode node);

    default NodePredicate and(NodePredicate other) {
        return new And(this, other);
    }

    default NodePredicate or(NodePredicate other) {
        return new Or(this, other);
    }

    default NodePredicate not() {
        return new Not(this);
    }

    static NodePredicate any() {
        return new Any();
    }

    static NodePredicate type(String typeName) {
        return new TypeIs(typeName);
    }

    static NodePredicate text(String text) {
        return new TextEquals(text);
    }

    static NodePredicate textContains(String fragment) {
        return new TextContains(fragment);
    }

    static NodePredicate kind(String tag) {
        return new KindIs(tag);
    }

    static NodePredicate capability(String capability) {
        return new HasCapability(capability);
    }

    static NodePredicate named() {
        return new Named();
    }

    static NodePredicate field(String fieldName) {
        return new FieldIs(fieldName);
    }

    static NodePredicate of(String description, Predicate<SyntaxNode> test) {
        return new Custom(description, test);
    }

    static NodePredicate of(Predicate<SyntaxNode> test) {
        return new Custom("custom", test);
    }

    record Any() implements NodePredicate {
        @Override
        public boolean matches(SyntaxNode node) {
            return true;
        }
    }

    record TypeIs(String typeName) implements NodePredicate {
        @Override
        public boolean matches(SyntaxNode node) {
            return node.type().equals(typeName);
        }
    }

    record TextEquals(String text) implements NodePredicate {
        @Override
        public boolean matches(SyntaxNode node) {
            return node.text().equals(text);
        }
    }

    record TextContains(String fragment) implements NodePredicate {
        @Override
        public boolean matches(SyntaxNode node) {
            return node.text().contains(fragment);
        }
    }

    record KindIs(String tag) implements NodePredicate {
        @Override
        public boolean matches(SyntaxNode node) {
            return node.kind().tag().equals(tag);
        }
    }

    record HasCapability(String capability) implements NodePredicate {
        @Override
        public boolean matches(SyntaxNode node) {
            return node.kind().has(capability);
        }
    }

    record Named() implements NodePredicate {
        @Override
        public boolean matches(SyntaxNode node) {
            return node.named();
        }
    }

    record FieldIs(String fieldName) implements NodePredicate {
        @Override
        public boolean matches(SyntaxNode node) {
            return node.fieldName().map(fieldName::equals).orElse(false);
        }
    }

    // Caller code; failures are reported with the node that triggered them
    record Custom(String description, Predicate<SyntaxNode> test) implements NodePredicate {
        public Custom {
            Objects.requireNonNull(test, "test");
        }

        @Override
        public boolean matches(SyntaxNode node) {
            try {
                return test.test(node);
            } catch (QueryCallbackException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new QueryCallbackException("Predicate '" + description + "'", node, e);
            }
        }
    }

    record And(NodePredicate left, NodePredicate right) implements NodePredicate {
        @Override
        public boolean matches(SyntaxNode node) {
            return left.matches(node) && right.matches(node);
        }
    }

    record Or(NodePredicate left, NodePredicate right) implements NodePredicate {
        @Override
        public boolean matches(SyntaxNode node) {
            return left.matches(node) || right.matches(node);
        }
    }

    record Not(NodePredicate inner) implements NodePredicate {
        @Override
        public boolean matches(SyntaxNode node) {
            return !inner.matches(node);
        }
    }
}
