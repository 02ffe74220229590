package com.vmcaps.hardware;

/**
 * Instruction set features a guest CPU model may implement.
 */
public enum InstructionFeature {
    /** Vector Multimedia Extension. Every supported CPU model has it. */
    ALTIVEC,
    /** Vector Scalar Extension. */
    VSX,
    /** Decimal Floating Point. */
    DFP,
    /** Hardware Transactional Memory. */
    HTM
}
