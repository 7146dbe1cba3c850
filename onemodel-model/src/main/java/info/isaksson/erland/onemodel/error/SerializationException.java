package info.isaksson.erland.onemodel.error;

/** An expression contains something the MathML or Matlab rendering cannot classify. */
public class SerializationException extends OneModelException {

    public SerializationException(String expression, String reason) {
        super("SerializationError",
                "Cannot translate expression '" + expression + "': " + reason,
                ctx("expression", expression, "reason", reason));
    }

    public SerializationException(String owner, String expression, String reason) {
        super("SerializationError",
                "Cannot translate expression '" + expression + "' of '" + owner + "': " + reason,
                ctx("owner", owner, "expression", expression, "reason", reason));
    }
}
