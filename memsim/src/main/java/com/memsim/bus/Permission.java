package com.memsim.bus;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

import com.memsim.memory.InvalidConfigurationException;

/** Access rights of a memory region. */
public enum Permission {
    READ('R'), WRITE('W'), EXECUTE('X');

    private final char symbol;

    Permission(char symbol) {
        this.symbol = symbol;
    }

    public char getSymbol() {
        return symbol;
    }

    /**
     * Parse a permission string such as "RW" or "rx" ("-" or empty = none).
     */
    public static EnumSet<Permission> parse(String text) {
        EnumSet<Permission> out = EnumSet.noneOf(Permission.class);
        if (text == null)
            return out;
        for (char c : text.trim().toUpperCase(Locale.ROOT).toCharArray()) {
            switch (c) {
                case 'R' -> out.add(READ);
                case 'W' -> out.add(WRITE);
                case 'X' -> out.add(EXECUTE);
                case '-' -> {
                }
                default -> throw new InvalidConfigurationException("Unknown permission '" + c + "' in \"" + text + "\"");
            }
        }
        return out;
    }

    /** "RWX"-style rendering, "-" for no rights. */
    public static String format(Collection<Permission> perms) {
        if (perms == null || perms.isEmpty())
            return "-";
        StringBuilder sb = new StringBuilder();
        for (Permission p : values()) {
            if (perms.contains(p))
                sb.append(p.symbol);
        }
        return sb.toString();
    }

    public static Set<Permission> of(Permission first, Permission... rest) {
        return EnumSet.of(first, rest);
    }
}
