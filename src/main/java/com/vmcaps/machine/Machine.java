package com.vmcaps.machine;

import com.vmcaps.caps.CapabilityRegistry;
import com.vmcaps.compat.CompatLevel;
import com.vmcaps.compat.CpuCompatibility;
import com.vmcaps.hardware.CpuModel;
import com.vmcaps.hardware.ExecutionBackend;
import com.vmcaps.lifecycle.PhaseController;

import java.util.Objects;

/**
 * A virtual machine instance as seen by capability handling.
 *
 * Owns its {@link MachineCapabilityState} and {@link PhaseController} exclusively.
 * Instances are driven from one thread at a time.
 */
public class Machine {

    private final String id;
    private final MachineClass machineClass;
    private final CpuModel cpu;
    private final ExecutionBackend backend;
    private final CompatLevel maxCpuCompat;
    private final CpuCompatibility cpuCompatibility;
    private final MachineCapabilityState capabilityState;
    private final PhaseController phaseController;

    private Machine(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id");
        this.machineClass = Objects.requireNonNull(builder.machineClass, "machineClass");
        this.cpu = Objects.requireNonNull(builder.cpu, "cpu");
        this.backend = Objects.requireNonNull(builder.backend, "backend");
        this.maxCpuCompat = builder.maxCpuCompat;
        this.cpuCompatibility = Objects.requireNonNull(builder.cpuCompatibility, "cpuCompatibility");
        this.capabilityState = new MachineCapabilityState(machineClass.registry().size());
        this.phaseController = new PhaseController(id);
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public String getId() {
        return id;
    }

    public MachineClass getMachineClass() {
        return machineClass;
    }

    public CapabilityRegistry getRegistry() {
        return machineClass.registry();
    }

    public CpuModel getCpu() {
        return cpu;
    }

    public ExecutionBackend getBackend() {
        return backend;
    }

    /**
     * Operator-supplied compatibility ceiling, or null when unrestricted.
     */
    public CompatLevel getMaxCpuCompat() {
        return maxCpuCompat;
    }

    /**
     * Compatibility level the guest CPU runs at under the configured ceiling.
     */
    public CompatLevel compatLevel() {
        return cpuCompatibility.compatLevel(cpu, maxCpuCompat);
    }

    public MachineCapabilityState getCapabilityState() {
        return capabilityState;
    }

    public PhaseController getPhaseController() {
        return phaseController;
    }

    @Override
    public String toString() {
        return "Machine{" + id + ", " + machineClass.name() + ", " + cpu.name() + ", " + backend.kind() + "}";
    }

    public static final class Builder {
        private final String id;
        private MachineClass machineClass = MachineClass.pseries();
        private CpuModel cpu = CpuModel.power8();
        private ExecutionBackend backend = ExecutionBackend.tcg();
        private CompatLevel maxCpuCompat;
        private CpuCompatibility cpuCompatibility = CpuCompatibility.capped();

        private Builder(String id) {
            this.id = id;
        }

        public Builder machineClass(MachineClass machineClass) {
            this.machineClass = machineClass;
            return this;
        }

        public Builder cpu(CpuModel cpu) {
            this.cpu = cpu;
            return this;
        }

        public Builder backend(ExecutionBackend backend) {
            this.backend = backend;
            return this;
        }

        public Builder maxCpuCompat(CompatLevel maxCpuCompat) {
            this.maxCpuCompat = maxCpuCompat;
            return this;
        }

        public Builder cpuCompatibility(CpuCompatibility cpuCompatibility) {
            this.cpuCompatibility = cpuCompatibility;
            return this;
        }

        public Machine build() {
            return new Machine(this);
        }
    }
}
