package com.vmcaps.caps;

import com.vmcaps.compat.CompatLevel;
import com.vmcaps.hardware.DfpApplier;
import com.vmcaps.hardware.HtmApplier;
import com.vmcaps.hardware.VsxApplier;

/**
 * The capabilities every machine of this platform exposes.
 */
public final class StandardCapabilities {

    public static final int HTM = 0;
    public static final int VSX = 1;
    public static final int DFP = 2;

    public static final CompatLevel COMPAT_2_06 = CompatLevel.of(2, 6);
    public static final CompatLevel COMPAT_2_07 = CompatLevel.of(2, 7);

    private static final CapabilityRegistry REGISTRY = CapabilityRegistry.builder()
        .register("htm", "Allow Hardware Transactional Memory (HTM)", COMPAT_2_07, new HtmApplier())
        .register("vsx", "Allow Vector Scalar Extensions (VSX)", COMPAT_2_06, new VsxApplier())
        .register("dfp", "Allow Decimal Floating Point (DFP)", COMPAT_2_06, new DfpApplier())
        .build();

    private StandardCapabilities() {
    }

    /**
     * Gets the process-wide registry of standard capabilities.
     */
    public static CapabilityRegistry registry() {
        return REGISTRY;
    }

    /**
     * Baseline for current machine types: transactional memory off, vector and decimal
     * floating point on.
     */
    public static CapabilitySet defaultBaseline() {
        return CapabilitySet.of(CapabilityLevel.OFF, CapabilityLevel.ON, CapabilityLevel.ON);
    }
}
