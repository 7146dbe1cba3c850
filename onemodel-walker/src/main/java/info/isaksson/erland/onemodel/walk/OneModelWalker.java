package info.isaksson.erland.onemodel.walk;

import info.isaksson.erland.onemodel.ast.AccessNameNode;
import info.isaksson.erland.onemodel.ast.AssignNameNode;
import info.isaksson.erland.onemodel.ast.DocstringNode;
import info.isaksson.erland.onemodel.ast.DottedNameNode;
import info.isaksson.erland.onemodel.ast.FloatNode;
import info.isaksson.erland.onemodel.ast.IntegerNode;
import info.isaksson.erland.onemodel.ast.ObjectNode;
import info.isaksson.erland.onemodel.ast.ParameterNode;
import info.isaksson.erland.onemodel.ast.ReactionNode;
import info.isaksson.erland.onemodel.ast.RuleNode;
import info.isaksson.erland.onemodel.ast.SequenceNode;
import info.isaksson.erland.onemodel.ast.SpeciesNode;
import info.isaksson.erland.onemodel.ast.StringNode;
import info.isaksson.erland.onemodel.ast.SyntaxNode;
import info.isaksson.erland.onemodel.ast.SyntaxNodeVisitor;
import info.isaksson.erland.onemodel.error.RedeclarationException;
import info.isaksson.erland.onemodel.error.UndefinedNamespaceException;
import info.isaksson.erland.onemodel.model.ModelWarning;
import info.isaksson.erland.onemodel.model.ObjectKind;
import info.isaksson.erland.onemodel.model.OmObject;
import info.isaksson.erland.onemodel.model.OmParameter;
import info.isaksson.erland.onemodel.model.OmReaction;
import info.isaksson.erland.onemodel.model.OmRule;
import info.isaksson.erland.onemodel.model.OmSpecies;
import info.isaksson.erland.onemodel.model.OneModel;
import info.isaksson.erland.onemodel.model.Value;
import info.isaksson.erland.onemodel.model.ValueKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Single top-down pass that evaluates a syntax tree into the namespace tree of a {@link OneModel}.
 *
 * <p>Declarations bind into the tree and evaluate to {@link Value#NONE}; literals, lists and reads
 * evaluate to values. A binding that replaces an existing one at the same path is reported as a
 * {@link ModelWarning#REDECLARATION} warning, or rejected when the context asks for it.</p>
 */
public final class OneModelWalker implements SyntaxNodeVisitor<Value> {

    private static final Logger log = LoggerFactory.getLogger(OneModelWalker.class);

    private final WalkContext ctx;

    public OneModelWalker(WalkContext ctx) {
        this.ctx = Objects.requireNonNull(ctx, "ctx must not be null");
    }

    /** Walk {@code root} into a fresh model named {@code modelName}. */
    public static OneModel build(SyntaxNode root, String modelName) {
        WalkContext ctx = new WalkContext(modelName);
        new OneModelWalker(ctx).walk(root);
        return ctx.getModel();
    }

    public WalkContext getContext() {
        return ctx;
    }

    public Value walk(SyntaxNode node) {
        if (node == null) return Value.NONE;
        return node.accept(this);
    }

    /** Location a dotted name designates: the namespace to bind into and the leaf name. */
    public static final class Target {
        public final OmObject namespace;
        public final String name;

        Target(OmObject namespace, String name) {
            this.namespace = namespace;
            this.name = name;
        }
    }

    /**
     * Descend from the model root through every qualifier.
     *
     * @throws UndefinedNamespaceException when a qualifier is not bound
     */
    public Target resolve(DottedNameNode dotted) {
        OmObject ns = ctx.getModel().root();
        for (String qualifier : dotted.qualifiers) {
            OmObject next = ns.get(qualifier);
            if (next == null) {
                throw new UndefinedNamespaceException(dotted.toString(), qualifier);
            }
            ns = next;
        }
        return new Target(ns, dotted.name);
    }

    @Override
    public Value visitSequence(SequenceNode node) {
        List<Value> out = new ArrayList<>(node.items.size());
        for (SyntaxNode item : node.items) {
            out.add(walk(item));
        }
        return Value.list(out);
    }

    @Override
    public Value visitParameter(ParameterNode node) {
        Target t = resolve(node.name);
        OmParameter p = new OmParameter();
        applyDeclarationValue(p, node.value);
        applyDocumentation(p, node.documentation);
        declare(t, p);
        return Value.NONE;
    }

    @Override
    public Value visitSpecies(SpeciesNode node) {
        Target t = resolve(node.name);
        OmSpecies s = new OmSpecies();
        applyDeclarationValue(s, node.value);
        applyDocumentation(s, node.documentation);
        declare(t, s);
        return Value.NONE;
    }

    @Override
    public Value visitReaction(ReactionNode node) {
        Target t = node.name != null
                ? resolve(node.name)
                : new Target(ctx.getModel().root(), ctx.nextReactionName());
        declare(t, new OmReaction());
        return Value.NONE;
    }

    @Override
    public Value visitRule(RuleNode node) {
        Target t = node.name != null
                ? resolve(node.name)
                : new Target(ctx.getModel().root(), ctx.nextRuleName());
        declare(t, new OmRule(node.ruleType, node.variable, node.expression));
        return Value.NONE;
    }

    @Override
    public Value visitObject(ObjectNode node) {
        return Value.object(new OmObject());
    }

    @Override
    public Value visitAssignName(AssignNameNode node) {
        Target t = resolve(node.name);
        Value value = walk(node.value);
        OmObject existing = t.namespace.get(t.name);
        if (existing != null) {
            checkRedeclaration(existing);
        }
        t.namespace.assign(t.name, value);
        log.debug("assigned {} = {}", node.name, value);
        return Value.NONE;
    }

    @Override
    public Value visitAccessName(AccessNameNode node) {
        Target t = resolve(node.name);
        return unwrap(t.namespace.read(t.name));
    }

    /** A bare dotted name in value position reads like {@link AccessNameNode}. */
    @Override
    public Value visitDottedName(DottedNameNode node) {
        Target t = resolve(node);
        return unwrap(t.namespace.read(t.name));
    }

    @Override
    public Value visitFloat(FloatNode node) {
        try {
            return Value.number(Double.parseDouble(node.value.trim()));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("invalid float literal: " + node.value, ex);
        }
    }

    @Override
    public Value visitInteger(IntegerNode node) {
        try {
            return Value.integer(Long.parseLong(node.value.trim()));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("invalid integer literal: " + node.value, ex);
        }
    }

    @Override
    public Value visitString(StringNode node) {
        return Value.string(node.value);
    }

    @Override
    public Value visitDocstring(DocstringNode node) {
        return Value.string(stripLines(node.value));
    }

    static String stripLines(String text) {
        String[] lines = text.split("\n", -1);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) sb.append('\n');
            sb.append(lines[i].strip());
        }
        return sb.toString();
    }

    private void applyDeclarationValue(OmObject entity, SyntaxNode valueNode) {
        Value v = walk(valueNode);
        if (!v.isNone()) {
            entity.assign("value", v);
        }
    }

    private void applyDocumentation(OmObject entity, SyntaxNode docNode) {
        Value v = walk(docNode);
        if (!v.isNone()) {
            entity.assign(OmObject.DOC_ATTRIBUTE, v);
        }
    }

    private void declare(Target t, OmObject entity) {
        OmObject existing = t.namespace.get(t.name);
        if (existing != null) {
            checkRedeclaration(existing);
        }
        t.namespace.put(t.name, entity);
        log.debug("declared {} {}", entity.kind(), entity.pathString());
    }

    private void checkRedeclaration(OmObject existing) {
        String path = existing.pathString();
        if (ctx.isFailOnRedeclaration()) {
            throw new RedeclarationException(path);
        }
        ctx.getWarnings().warn(ModelWarning.REDECLARATION,
                "'" + path + "' redeclared; previous " + existing.kind() + " replaced",
                "path", path);
    }

    /** Generic objects created from {@code name = literal} read back as the literal. */
    private static Value unwrap(Value v) {
        if (v.kind == ValueKind.OBJECT) {
            OmObject o = v.asObject();
            if (o.kind() == ObjectKind.GENERIC && !o.getLiteral().isNone() && o.children().isEmpty()) {
                return o.getLiteral();
            }
        }
        return v;
    }
}
