package com.memsim.config;

import java.util.Collections;
import java.util.Set;

import com.memsim.bus.Permission;
import com.memsim.memory.InvalidConfigurationException;

/** One configured region: region.NAME=start,size,perms. */
public final class RegionSpec {
    private final String name;
    private final long start;
    private final long size;
    private final Set<Permission> permissions;

    public RegionSpec(String name, long start, long size, Set<Permission> permissions) {
        this.name = name;
        this.start = start;
        this.size = size;
        this.permissions = Collections.unmodifiableSet(permissions);
    }

    /**
     * Parse the value part of a region entry.
     *
     * @param name  region name (the part after "region.")
     * @param value "start,size,perms", start/size hex (0x) or decimal, size may
     *              carry a KB/MB suffix
     */
    public static RegionSpec parse(String name, String value) {
        if (value == null)
            throw new InvalidConfigurationException("Region " + name + " has no value");
        String[] parts = value.split(",");
        if (parts.length != 3)
            throw new InvalidConfigurationException(
                    "Region " + name + " must be start,size,perms (got \"" + value + "\")");
        long start = ConfigUtils.parseLong(parts[0], "region." + name + " start");
        long size = ConfigUtils.parseSize(parts[1], "region." + name + " size");
        return new RegionSpec(name, start, size, Permission.parse(parts[2]));
    }

    public String getName() {
        return name;
    }

    public long getStart() {
        return start;
    }

    public long getSize() {
        return size;
    }

    public Set<Permission> getPermissions() {
        return permissions;
    }

    @Override
    public String toString() {
        return String.format("%s=0x%X,0x%X,%s", name, start, size, Permission.format(permissions));
    }
}
