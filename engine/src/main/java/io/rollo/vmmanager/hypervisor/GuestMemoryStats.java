package io.rollo.vmmanager.hypervisor;

/**
 * Guest memory as reported by the balloon driver, in KiB. Negative values mean not reported.
 *
 * @param availableKib memory visible to the guest
 * @param unusedKib memory the guest leaves unused
 * @param rssKib resident set of the hypervisor process backing the guest
 */
public record GuestMemoryStats(long availableKib, long unusedKib, long rssKib) {

    private static final GuestMemoryStats NONE = new GuestMemoryStats(-1, -1, -1);

    public static GuestMemoryStats none() {
        return NONE;
    }

    /**
     * Check if the guest reported enough to derive its own usage.
     *
     * @return true when available and unused memory are both known
     */
    public boolean hasGuestUsage() {
        return availableKib > 0 && unusedKib >= 0;
    }
}
