package com.example.commitnotifier.config;

import net.javacrumbs.shedlock.core.LockProvider;
import net.javacrumbs.shedlock.provider.jdbctemplate.JdbcTemplateLockProvider;
import net.javacrumbs.shedlock.spring.annotation.EnableSchedulerLock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import javax.sql.DataSource;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * ShedLock configuration for distributed scheduler locking.
 * <p>
 * The same lock provider backs two things:
 * - the notification cycle lock, acquired and released explicitly by
 *   {@link com.example.commitnotifier.service.lock.ShedLockSchedulerLock}
 * - the @SchedulerLock annotation on the ledger retention job
 * <p>
 * Lock rows live in the shedlock table created by Flyway.
 */
@Configuration
@EnableSchedulerLock(defaultLockAtMostFor = "10m")
public class ShedLockConfig {

    /**
     * JDBC-based lock provider using PostgreSQL time, so instance clock skew
     * does not affect lock expiry.
     */
    @Bean
    public LockProvider lockProvider(DataSource dataSource) {
        return new JdbcTemplateLockProvider(
                JdbcTemplateLockProvider.Configuration.builder()
                        .withJdbcTemplate(new JdbcTemplate(dataSource))
                        .withTableName("shedlock")
                        .usingDbTime()
                        .build()
        );
    }

    /**
     * Keeps the notification cycle lock alive while a cycle runs. Separate from
     * the notification scheduler pool so a busy pool never delays an extension.
     */
    @Bean(name = "lockKeepAliveExecutor", destroyMethod = "shutdownNow")
    public ScheduledExecutorService lockKeepAliveExecutor() {
        return Executors.newSingleThreadScheduledExecutor(new CustomizableThreadFactory("lock-keepalive-"));
    }
}
