package info.isaksson.erland.onemodel.matlab;

/** Layout of the generated Matlab code. */
public enum MatlabStyle {
    /** {@code <name>_param.m}, {@code <name>_ode.m}, {@code <name>_states.m} and a driver script. */
    FUNCTIONS,
    /** One {@code classdef <name>} file and an example script. */
    CLASS
}
