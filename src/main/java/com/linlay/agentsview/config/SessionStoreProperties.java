package com.linlay.agentsview.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "agentsview.store")
public class SessionStoreProperties {

    private String sqliteFile = "agentsview.db";

    public String getSqliteFile() {
        return sqliteFile;
    }

    public void setSqliteFile(String sqliteFile) {
        this.sqliteFile = sqliteFile;
    }
}
