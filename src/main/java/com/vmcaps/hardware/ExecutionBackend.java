package com.vmcaps.hardware;

/**
 * The engine that actually executes guest instructions.
 */
public interface ExecutionBackend {

    enum Kind {
        /** Software emulation. */
        TCG,
        /** Hardware-assisted virtualization. */
        KVM
    }

    Kind kind();

    /**
     * Whether the backend can give the guest hardware transactional memory.
     */
    boolean supportsTransactionalMemory();

    static ExecutionBackend tcg() {
        return new Simple(Kind.TCG, false);
    }

    static ExecutionBackend kvm(boolean hostHasTransactionalMemory) {
        return new Simple(Kind.KVM, hostHasTransactionalMemory);
    }

    record Simple(Kind kind, boolean supportsTransactionalMemory) implements ExecutionBackend {
    }
}
