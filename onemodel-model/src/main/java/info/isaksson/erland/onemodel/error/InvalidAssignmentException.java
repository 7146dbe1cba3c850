package info.isaksson.erland.onemodel.error;

/** An attribute of a typed entity received a value of the wrong kind. */
public class InvalidAssignmentException extends OneModelException {

    public InvalidAssignmentException(String path, String attribute, String expected, String actual) {
        super("InvalidAssignmentError",
                "Attribute '" + attribute + "' of '" + path + "' expects " + expected + " but got " + actual,
                ctx("path", path, "attribute", attribute, "expected", expected));
    }
}
