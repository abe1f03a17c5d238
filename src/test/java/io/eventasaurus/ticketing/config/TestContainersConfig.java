package io.eventasaurus.ticketing.config;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.test.context.DynamicPropertyRegistrar;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.MySQLContainer;
import org.testcontainers.utility.DockerImageName;

/**
 * TestContainers 설정
 *
 * 통합 테스트에서 사용할 MySQL과 Redis 컨테이너를 설정합니다.
 * 컨테이너는 JVM 당 한 번만 기동되고 모든 테스트 컨텍스트가 공유합니다.
 */
@TestConfiguration(proxyBeanMethods = false)
public class TestContainersConfig {

    private static final MySQLContainer<?> mysql;
    private static final GenericContainer<?> redis;

    static {
        // MySQL Container
        mysql = new MySQLContainer<>("mysql:8.0")
                .withDatabaseName("test_ticketing")
                .withUsername("test")
                .withPassword("test")
                .withCommand(
                        "--character-set-server=utf8mb4",
                        "--collation-server=utf8mb4_unicode_ci"
                );
        mysql.start();

        // Redis Container
        redis = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
                .withExposedPorts(6379);
        redis.start();
    }

    /**
     * 컨테이너 접속 정보를 datasource / redis 설정으로 등록
     */
    @Bean
    public DynamicPropertyRegistrar containerProperties() {
        return registry -> {
            registry.add("spring.datasource.url", mysql::getJdbcUrl);
            registry.add("spring.datasource.username", mysql::getUsername);
            registry.add("spring.datasource.password", mysql::getPassword);
            registry.add("spring.data.redis.host", redis::getHost);
            registry.add("spring.data.redis.port", redis::getFirstMappedPort);
        };
    }
}
