package info.isaksson.erland.onemodel.model;

/** A dynamic species; its initial value is the SBML initial concentration. */
public class OmSpecies extends OmObject {

    private double initialValue;

    public OmSpecies() {
    }

    public OmSpecies(double initialValue) {
        this.initialValue = initialValue;
    }

    @Override
    public ObjectKind kind() {
        return ObjectKind.SPECIES;
    }

    public double getInitialValue() {
        return initialValue;
    }

    public void setInitialValue(double initialValue) {
        this.initialValue = initialValue;
    }

    @Override
    protected boolean assignAttribute(String name, Value v) {
        if ("value".equals(name) || "initial_value".equals(name)) {
            initialValue = requireNumber(name, v);
            return true;
        }
        return false;
    }

    @Override
    protected Value readAttribute(String name) {
        if ("value".equals(name) || "initial_value".equals(name)) {
            return Value.number(initialValue);
        }
        return null;
    }

    @Override
    protected OmObject newInstance() {
        return new OmSpecies();
    }

    @Override
    protected void copyInto(OmObject target) {
        super.copyInto(target);
        ((OmSpecies) target).initialValue = initialValue;
    }
}
