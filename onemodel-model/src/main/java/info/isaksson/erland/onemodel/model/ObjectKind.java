package info.isaksson.erland.onemodel.model;

/** Closed set of namespace node kinds. Exporters switch over this tag. */
public enum ObjectKind {
    GENERIC,
    PARAMETER,
    SPECIES,
    REACTION,
    RULE
}
