package org.csu.sqlfront.catalog;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

@Getter
public class UserInfo {
    private final String username;
    private final String password;
    private final Set<GrantEntry> grants = new LinkedHashSet<>();

    public UserInfo(String username, String password) {
        this.username = username;
        this.password = password;
    }

    /**
     * @return 如果这条授权之前不存在并已加入则为 true，重复授权返回 false
     */
    public boolean addGrant(GrantEntry grant) {
        return grants.add(grant);
    }

    public Set<GrantEntry> getGrants() {
        return Collections.unmodifiableSet(grants);
    }

    @Override
    public String toString() {
        return "UserInfo[username=" + username + ", password=***, grants=" + grants + "]";
    }
}
