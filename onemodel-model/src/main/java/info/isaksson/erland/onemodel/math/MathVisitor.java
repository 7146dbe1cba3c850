package info.isaksson.erland.onemodel.math;

public interface MathVisitor<R> {

    R visitNumber(MathNumber node);

    R visitIdentifier(MathIdentifier node);

    R visitUnary(MathUnary node);

    R visitBinary(MathBinary node);

    R visitGroup(MathGroup node);

    R visitCall(MathCall node);
}
