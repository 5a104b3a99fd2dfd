package org.csu.sqlfront.catalog;

import org.csu.sqlfront.common.model.Privilege;

import java.util.Locale;
import java.util.Optional;

/**
 * 记录在用户名下的一条授权 (表, 权限名)。
 * 权限名按原样 (大写) 保存，不在 {@link Privilege} 中的名字也会被记录。
 */
public record GrantEntry(String tableName, String privilegeName) {

    public GrantEntry {
        privilegeName = privilegeName.toUpperCase(Locale.ROOT);
    }

    public GrantEntry(String tableName, Privilege privilege) {
        this(tableName, privilege.name());
    }

    /**
     * @return 对应的已知权限，名字不是已知权限时为空
     */
    public Optional<Privilege> privilege() {
        return Privilege.fromName(privilegeName);
    }

    /**
     * 本条授权是否包含指定权限 (ALL 包含全部)；未知权限名不包含任何权限。
     */
    public boolean covers(Privilege requested) {
        return privilege().map(p -> p.covers(requested)).orElse(false);
    }

    @Override
    public String toString() {
        return privilegeName + " ON " + tableName;
    }
}
