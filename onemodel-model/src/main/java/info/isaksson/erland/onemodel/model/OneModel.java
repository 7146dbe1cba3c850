package info.isaksson.erland.onemodel.model;

import info.isaksson.erland.onemodel.error.UndefinedNameException;
import info.isaksson.erland.onemodel.error.UndefinedNamespaceException;

import java.util.Objects;

/**
 * Root of a compiled OneModel description.
 *
 * <p>Holds the top-level namespace. Names declared directly in {@link #root()} flatten to
 * themselves; everything below is prefixed with its ancestor scope names.</p>
 */
public final class OneModel {

    public static final String DEFAULT_NAME = "main";

    private final OmObject root = new OmObject();
    private final String name;

    public OneModel() {
        this(DEFAULT_NAME);
    }

    public OneModel(String name) {
        this.name = name == null || name.isBlank() ? DEFAULT_NAME : name;
    }

    public String getName() {
        return name;
    }

    public OmObject root() {
        return root;
    }

    /**
     * Look up an object by dotted path ({@code foo.bar.B}).
     *
     * @throws UndefinedNamespaceException when an intermediate scope is missing
     * @throws UndefinedNameException      when the last segment is missing
     */
    public OmObject lookup(String dottedPath) {
        Objects.requireNonNull(dottedPath, "dottedPath must not be null");
        String[] parts = dottedPath.split("\\.");
        OmObject ns = root;
        for (int i = 0; i < parts.length - 1; i++) {
            OmObject next = ns.get(parts[i]);
            if (next == null) {
                throw new UndefinedNamespaceException(dottedPath, parts[i]);
            }
            ns = next;
        }
        OmObject leaf = ns.get(parts[parts.length - 1]);
        if (leaf == null) {
            throw new UndefinedNameException(ns.pathString(), parts[parts.length - 1]);
        }
        return leaf;
    }
}
