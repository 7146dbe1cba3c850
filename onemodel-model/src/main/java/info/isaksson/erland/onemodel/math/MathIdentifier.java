package info.isaksson.erland.onemodel.math;

import java.util.Objects;

public final class MathIdentifier extends MathExpr {

    public final String name;

    public MathIdentifier(String name) {
        this.name = Objects.requireNonNull(name, "name must not be null");
    }

    @Override
    public <R> R accept(MathVisitor<R> visitor) {
        return visitor.visitIdentifier(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof MathIdentifier && ((MathIdentifier) o).name.equals(name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }
}
