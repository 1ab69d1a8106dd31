package com.rateview.config.jpa;

import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * JPA 설정.
 * <p>
 * 엔티티는 domain 패키지에서, Spring Data 리포지토리는 infrastructure 패키지에서 스캔합니다.
 * </p>
 */
@Configuration
@EnableTransactionManagement
@EntityScan(basePackages = "com.rateview.domain")
@EnableJpaRepositories(basePackages = "com.rateview.infrastructure")
public class JpaConfig {
}
