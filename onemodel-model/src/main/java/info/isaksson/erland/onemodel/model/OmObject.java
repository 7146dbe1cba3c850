package info.isaksson.erland.onemodel.model;

import info.isaksson.erland.onemodel.error.InvalidAssignmentException;
import info.isaksson.erland.onemodel.error.UndefinedNameException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A namespace node of the OneModel object tree.
 *
 * <p>Children are kept in insertion order; that order is the emission order of every exporter.
 * A child is owned by exactly one parent: binding an object that already has a parent binds a
 * deep copy instead.</p>
 *
 * <p>Typed entities ({@link OmParameter}, {@link OmSpecies}, {@link OmReaction}, {@link OmRule})
 * extend this class and intercept their attribute names in {@link #assignAttribute} and
 * {@link #readAttribute}; every other name addresses a child.</p>
 */
public class OmObject {

    /** Attribute name under which documentation strings are assigned. */
    public static final String DOC_ATTRIBUTE = "__doc__";

    private String name;
    private OmObject parent;
    private final Map<String, OmObject> children = new LinkedHashMap<>();

    /** Optional literal carried by generic objects created from {@code name = literal}. */
    private Value literal = Value.NONE;
    private String documentation;

    public OmObject() {
    }

    public OmObject(Value literal) {
        this.literal = literal == null ? Value.NONE : literal;
    }

    public ObjectKind kind() {
        return ObjectKind.GENERIC;
    }

    /** Name within the parent; {@code null} for the root and for detached objects. */
    public String getName() {
        return name;
    }

    public OmObject getParent() {
        return parent;
    }

    public boolean isRoot() {
        return parent == null;
    }

    public Value getLiteral() {
        return literal;
    }

    public void setLiteral(Value literal) {
        this.literal = literal == null ? Value.NONE : literal;
    }

    public String getDocumentation() {
        return documentation;
    }

    public void setDocumentation(String documentation) {
        this.documentation = documentation;
    }

    public Collection<OmObject> children() {
        return Collections.unmodifiableCollection(children.values());
    }

    public List<String> childNames() {
        return List.copyOf(children.keySet());
    }

    public boolean contains(String childName) {
        return children.containsKey(childName);
    }

    /** Child lookup; {@code null} when absent. */
    public OmObject get(String childName) {
        return children.get(childName);
    }

    /**
     * Bind {@code child} under {@code childName}, replacing any previous binding at that exact name.
     *
     * @return the replaced child, or {@code null}
     */
    public OmObject put(String childName, OmObject child) {
        Objects.requireNonNull(childName, "childName must not be null");
        Objects.requireNonNull(child, "child must not be null");
        if (childName.isBlank()) {
            throw new IllegalArgumentException("child name must not be blank");
        }
        OmObject bound = child.parent != null || child == this ? child.copy() : child;
        bound.name = childName;
        bound.parent = this;
        OmObject previous = children.put(childName, bound);
        if (previous != null && previous != bound) {
            previous.parent = null;
        }
        return previous;
    }

    /**
     * Assign {@code value} to {@code name}: an attribute when this kind defines one with that name,
     * a child otherwise.
     *
     * @return the child replaced by this assignment, or {@code null} (also for attributes)
     */
    public OmObject assign(String name, Value value) {
        Objects.requireNonNull(value, "value must not be null");
        if (DOC_ATTRIBUTE.equals(name)) {
            documentation = requireText(name, value);
            return null;
        }
        if (assignAttribute(name, value)) {
            return null;
        }
        switch (value.kind) {
            case OBJECT:
                return put(name, value.asObject());
            case NUMBER:
            case STRING:
            case LIST:
                return put(name, new OmObject(value));
            case NONE:
            default:
                throw new InvalidAssignmentException(pathString(), name, "a value", value.describe());
        }
    }

    /**
     * Read {@code name}: an attribute when this kind defines one, a child otherwise.
     *
     * @throws UndefinedNameException when neither exists
     */
    public Value read(String name) {
        if (DOC_ATTRIBUTE.equals(name)) {
            return documentation == null ? Value.NONE : Value.string(documentation);
        }
        Value attr = readAttribute(name);
        if (attr != null) {
            return attr;
        }
        OmObject child = children.get(name);
        if (child == null) {
            throw new UndefinedNameException(pathString(), name);
        }
        return Value.object(child);
    }

    /** Hook for typed entities. Return {@code true} when {@code name} is one of their attributes. */
    protected boolean assignAttribute(String name, Value value) {
        return false;
    }

    /** Hook for typed entities. Return {@code null} when {@code name} is not one of their attributes. */
    protected Value readAttribute(String name) {
        return null;
    }

    /** Names from the first child of the root down to this object. Empty for the root. */
    public List<String> path() {
        List<String> out = new ArrayList<>();
        OmObject cur = this;
        while (cur != null && cur.parent != null) {
            out.add(0, cur.name);
            cur = cur.parent;
        }
        return out;
    }

    /** Dotted path for messages; {@code <root>} for the root. */
    public String pathString() {
        List<String> p = path();
        if (p.isEmpty()) {
            return name == null ? "<root>" : name;
        }
        return String.join(".", p);
    }

    /** Deep copy without parent and name. */
    public OmObject copy() {
        OmObject out = newInstance();
        copyInto(out);
        return out;
    }

    /** Fresh, empty instance of the same kind. */
    protected OmObject newInstance() {
        return new OmObject();
    }

    /** Copy attributes and children into {@code target}. Subclasses call super first. */
    protected void copyInto(OmObject target) {
        target.literal = literal;
        target.documentation = documentation;
        for (Map.Entry<String, OmObject> e : children.entrySet()) {
            target.put(e.getKey(), e.getValue().copy());
        }
    }

    protected final String requireText(String attribute, Value value) {
        if (value.kind != ValueKind.STRING) {
            throw new InvalidAssignmentException(pathString(), attribute, "a string", value.describe());
        }
        return value.asText();
    }

    protected final double requireNumber(String attribute, Value value) {
        if (value.kind != ValueKind.NUMBER) {
            throw new InvalidAssignmentException(pathString(), attribute, "a number", value.describe());
        }
        return value.asNumber();
    }

    @Override
    public String toString() {
        return kind() + "(" + pathString() + ")";
    }
}
