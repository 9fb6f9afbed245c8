package io.netloom.topology.resolved;

/**
 * Hypervisor settings carried for the provisioning collaborator; nothing in generation reads them.
 */
public record VirtualBoxSettings(String paravirtProvider, String chipset, boolean ioapic, boolean hpet) {
    public static final VirtualBoxSettings DEFAULTS = new VirtualBoxSettings("kvm", "ich9", true, true);
}
