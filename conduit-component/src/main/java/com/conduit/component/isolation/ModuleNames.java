package com.conduit.component.isolation;

import java.util.Collection;

/**
 * Module name matching. A module name is a package or class name; an entry covers a name if it is equal
 * to it or a dot-segment prefix of it.
 */
public final class ModuleNames {

    private ModuleNames() {
    }

    public static boolean covers(String entry, String moduleName) {
        if (entry == null || moduleName == null) return false;
        if (!moduleName.startsWith(entry)) return false;
        return moduleName.length() == entry.length() || moduleName.charAt(entry.length()) == '.';
    }

    public static boolean coveredByAny(Collection<String> entries, String moduleName) {
        for (String entry : entries) {
            if (covers(entry, moduleName)) return true;
        }
        return false;
    }

    /** Package part of a class name; empty for the default package. */
    public static String packageOf(String className) {
        int dot = className.lastIndexOf('.');
        return dot < 0 ? "" : className.substring(0, dot);
    }
}
