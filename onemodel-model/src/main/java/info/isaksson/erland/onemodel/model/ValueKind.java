package info.isaksson.erland.onemodel.model;

public enum ValueKind {
    NONE,
    NUMBER,
    STRING,
    LIST,
    OBJECT
}
