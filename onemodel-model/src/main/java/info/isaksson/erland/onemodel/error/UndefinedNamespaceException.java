package info.isaksson.erland.onemodel.error;

/** A dotted-name qualifier does not name an existing namespace. */
public class UndefinedNamespaceException extends OneModelException {

    public UndefinedNamespaceException(String path, String qualifier) {
        super("UndefinedNamespaceError",
                "Undefined namespace '" + qualifier + "' in '" + path + "'",
                ctx("path", path, "qualifier", qualifier));
    }
}
