package info.isaksson.erland.onemodel.ir;

/** How a state variable's equation is used by the numerical backend. */
public enum StateType {
    /** Integrated: the equation is the time derivative. */
    ODE,
    /** Implicit constraint {@code 0 = -state + equation}, solved jointly with the ODEs. */
    ALGEBRAIC,
    /** Computed directly from parameters and other states; not part of the solver state vector. */
    SUBSTITUTION;

    /** ODE and ALGEBRAIC states occupy a slot of the solver state vector. */
    public boolean isIndexed() {
        return this == ODE || this == ALGEBRAIC;
    }
}
