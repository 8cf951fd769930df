package com.khoipd8.teacherdashboard.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "dashboard")
@Data
public class DashboardProperties {

    /** Zone used to decide what "today" is; blank means the JVM default. */
    private String zoneId;

    /** Worker threads used to fetch the tables of one request in parallel. */
    private int fetchPoolSize = 8;
}
