package com.memsim.bus;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/** Named, permissioned range [start, start + size) of the physical space. */
public final class MemoryRegion {
    private final long start;
    private final long size;
    private final Set<Permission> permissions;
    private final String name;

    public MemoryRegion(long start, long size, Set<Permission> permissions, String name) {
        this.start = start;
        this.size = size;
        this.permissions = Collections.unmodifiableSet(
                permissions == null || permissions.isEmpty() ? EnumSet.noneOf(Permission.class)
                        : EnumSet.copyOf(permissions));
        this.name = Objects.requireNonNull(name, "name");
    }

    public long getStart() {
        return start;
    }

    public long getSize() {
        return size;
    }

    /** Inclusive last address. */
    public long getEnd() {
        return start + size - 1;
    }

    public Set<Permission> getPermissions() {
        return permissions;
    }

    public String getName() {
        return name;
    }

    public boolean contains(long address) {
        return address >= start && address <= getEnd();
    }

    public boolean overlaps(long otherStart, long otherSize) {
        return otherStart < start + size && start < otherStart + otherSize;
    }

    public boolean allows(Set<Permission> needed) {
        return permissions.containsAll(needed);
    }

    @Override
    public String toString() {
        return String.format("%s: 0x%X - 0x%X (size=0x%X, perms=%s)", name, start, getEnd(), size,
                Permission.format(permissions));
    }
}
