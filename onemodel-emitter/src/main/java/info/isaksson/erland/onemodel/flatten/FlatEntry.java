package info.isaksson.erland.onemodel.flatten;

import info.isaksson.erland.onemodel.model.OmObject;

import java.util.Objects;

/** An entity of the namespace tree together with its flattened, model-wide unique id. */
public final class FlatEntry<T extends OmObject> {

    public final String id;
    public final T entity;

    public FlatEntry(String id, T entity) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.entity = Objects.requireNonNull(entity, "entity must not be null");
    }

    /** Documentation of the entity, or an empty string. */
    public String documentation() {
        String doc = entity.getDocumentation();
        return doc == null ? "" : doc;
    }

    @Override
    public String toString() {
        return id;
    }
}
