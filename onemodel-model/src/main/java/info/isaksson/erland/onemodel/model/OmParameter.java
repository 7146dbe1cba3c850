package info.isaksson.erland.onemodel.model;

/** A constant model parameter (SBML {@code parameter constant="true"}). */
public class OmParameter extends OmObject {

    /** Every parameter is a rate constant in this domain. */
    public static final String UNITS = "per_second";

    private double value;

    public OmParameter() {
    }

    public OmParameter(double value) {
        this.value = value;
    }

    @Override
    public ObjectKind kind() {
        return ObjectKind.PARAMETER;
    }

    public double getValue() {
        return value;
    }

    public void setValue(double value) {
        this.value = value;
    }

    public String getUnits() {
        return UNITS;
    }

    @Override
    protected boolean assignAttribute(String name, Value v) {
        if ("value".equals(name)) {
            value = requireNumber(name, v);
            return true;
        }
        return false;
    }

    @Override
    protected Value readAttribute(String name) {
        switch (name) {
            case "value":
                return Value.number(value);
            case "units":
                return Value.string(UNITS);
            default:
                return null;
        }
    }

    @Override
    protected OmObject newInstance() {
        return new OmParameter();
    }

    @Override
    protected void copyInto(OmObject target) {
        super.copyInto(target);
        ((OmParameter) target).value = value;
    }
}
