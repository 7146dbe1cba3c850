package info.isaksson.erland.onemodel.ir;

import java.util.List;
import java.util.Map;

/**
 * Read-only view of an already-resolved model, as consumed by the numerical code generators.
 *
 * <p>All sequences are in declaration order; generated code follows that order exactly.</p>
 */
public interface ModelAccessor {

    String getModelName();

    List<DaeParameter> getParameters();

    List<DaeState> getStates();

    /** Option name to default value, in declaration order. */
    Map<String, Object> getOptions();
}
