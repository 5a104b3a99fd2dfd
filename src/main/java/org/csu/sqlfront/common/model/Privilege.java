package org.csu.sqlfront.common.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * 可以通过 GRANT 授予的权限类型。ALL 覆盖同一张表上的所有权限。
 */
public enum Privilege {
    SELECT,
    INSERT,
    UPDATE,
    DELETE,
    ALL;

    public static Optional<Privilege> fromName(String name) {
        String normalized = name.toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(p -> p.name().equals(normalized))
                .findFirst();
    }

    public boolean covers(Privilege other) {
        return this == ALL || this == other;
    }
}
