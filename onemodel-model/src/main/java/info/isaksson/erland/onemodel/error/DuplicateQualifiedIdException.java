package info.isaksson.erland.onemodel.error;

/** Two entities flatten to the same qualified id (e.g. {@code a__b} at root and {@code a.b}). */
public class DuplicateQualifiedIdException extends OneModelException {

    public DuplicateQualifiedIdException(String id, String firstPath, String secondPath) {
        super("DuplicateQualifiedIdError",
                "Qualified id '" + id + "' is produced by both '" + firstPath + "' and '" + secondPath + "'",
                ctx("id", id, "first", firstPath, "second", secondPath));
    }
}
