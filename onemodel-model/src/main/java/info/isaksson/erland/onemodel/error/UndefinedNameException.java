package info.isaksson.erland.onemodel.error;

/** Read of a name that is not bound in the addressed namespace. */
public class UndefinedNameException extends OneModelException {

    public UndefinedNameException(String namespace, String name) {
        super("UndefinedNameError",
                "Undefined name '" + name + "' in namespace '" + namespace + "'",
                ctx("namespace", namespace, "name", name));
    }
}
