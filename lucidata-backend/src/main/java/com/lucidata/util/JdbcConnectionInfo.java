package com.lucidata.util;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

@Data
@Builder
public class JdbcConnectionInfo {
    private String url;
    private String username;
    private String password;
    /**
     * Extra driver properties taken from the DSN query string, e.g. {@code sslmode}.
     */
    private Map<String, String> properties;

    @Override
    public String toString() {
        return "JdbcConnectionInfo(url=" + url + ", username=" + username + ")";
    }
}
