package info.isaksson.erland.onemodel.error;

/**
 * A name used by a reaction or rule is not defined in its scope or in any enclosing scope.
 */
public class UnresolvedReferenceException extends OneModelException {

    public UnresolvedReferenceException(String owner, String role, String name) {
        super("UnresolvedReferenceError",
                "Cannot resolve " + role + " '" + name + "' referenced from '" + owner + "'",
                ctx("owner", owner, "role", role, "name", name));
    }
}
