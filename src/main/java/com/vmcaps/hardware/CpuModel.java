package com.vmcaps.hardware;

import com.vmcaps.compat.CompatLevel;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Guest CPU model: its native compatibility level and the instruction features it implements.
 */
public record CpuModel(
    String name,
    CompatLevel nativeCompat,
    Set<InstructionFeature> features
) {

    public CpuModel {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(nativeCompat, "nativeCompat");
        features = Set.copyOf(features);
    }

    public boolean has(InstructionFeature feature) {
        return features.contains(feature);
    }

    public static CpuModel power7() {
        return new CpuModel("POWER7", CompatLevel.of(2, 6),
            EnumSet.of(InstructionFeature.ALTIVEC, InstructionFeature.VSX, InstructionFeature.DFP));
    }

    public static CpuModel power8() {
        return new CpuModel("POWER8", CompatLevel.of(2, 7),
            EnumSet.of(InstructionFeature.ALTIVEC, InstructionFeature.VSX, InstructionFeature.DFP, InstructionFeature.HTM));
    }

    public static CpuModel power9() {
        return new CpuModel("POWER9", CompatLevel.of(3, 0),
            EnumSet.of(InstructionFeature.ALTIVEC, InstructionFeature.VSX, InstructionFeature.DFP, InstructionFeature.HTM));
    }
}
