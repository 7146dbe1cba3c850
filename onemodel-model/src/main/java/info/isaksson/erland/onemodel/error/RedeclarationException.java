package info.isaksson.erland.onemodel.error;

/** Raised instead of the REDECLARATION warning when the caller asks for strict declarations. */
public class RedeclarationException extends OneModelException {

    public RedeclarationException(String path) {
        super("DuplicateOrOverwriteWarning",
                "Name '" + path + "' is declared more than once",
                ctx("path", path));
    }
}
