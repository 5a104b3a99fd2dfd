package org.csu.sqlfront.catalog;

import org.csu.sqlfront.common.model.Privilege;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 一次编译过程中的用户与权限表: 用户名 -> {密码, 授权集合}。
 * 这里只做记录，不对任何访问做权限控制。
 */
public class UserTable {

    private final Map<String, UserInfo> users = new LinkedHashMap<>();

    public boolean contains(String username) {
        return users.containsKey(key(username));
    }

    public Optional<UserInfo> find(String username) {
        return Optional.ofNullable(users.get(key(username)));
    }

    public UserInfo register(String username, String password) {
        if (contains(username)) {
            throw new IllegalStateException("User '" + username + "' is already registered");
        }
        UserInfo userInfo = new UserInfo(username, password);
        users.put(key(username), userInfo);
        return userInfo;
    }

    /**
     * 查询某个用户在某张表上是否被授予了指定权限 (ALL 视为拥有全部权限)。
     */
    public boolean hasPrivilege(String username, String tableName, Privilege privilege) {
        return find(username)
                .map(user -> user.getGrants().stream()
                        .anyMatch(grant -> grant.tableName().equalsIgnoreCase(tableName)
                                && grant.covers(privilege)))
                .orElse(false);
    }

    public Collection<UserInfo> getUsers() {
        return Collections.unmodifiableCollection(users.values());
    }

    public int size() {
        return users.size();
    }

    private static String key(String username) {
        return username.toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return users.values().toString();
    }
}
