package io.github.hongjungwan.redlog.starter;

import ch.qos.logback.classic.LoggerContext;
import io.github.hongjungwan.redlog.api.Logger;
import io.github.hongjungwan.redlog.api.config.RedlogConfig;
import io.github.hongjungwan.redlog.api.theme.Themes;
import io.github.hongjungwan.redlog.core.bridge.RedlogAppender;
import io.github.hongjungwan.redlog.core.internal.LogRegistry;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

/**
 * redlog Spring Boot 자동 설정.
 */
@AutoConfiguration
@EnableConfigurationProperties(RedlogProperties.class)
@ConditionalOnProperty(prefix = "redlog", name = "enabled", havingValue = "true", matchIfMissing = true)
@Import(RedlogAutoConfiguration.LogbackBridgeConfiguration.class)
@Slf4j
public class RedlogAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public RedlogConfig redlogConfig(RedlogProperties properties) {
        String theme = properties.getTheme();
        return RedlogConfig.builder()
                .level(properties.getLevel())
                .theme(theme == null || theme.isBlank() ? null : Themes.byName(theme))
                .colorMode(properties.getColor())
                .formatter(properties.getFormatter())
                .output(properties.getOutput())
                .filePath(properties.getFilePath())
                .formatErrorPolicy(properties.getFormatErrorPolicy())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public LogRegistry logRegistry() {
        return LogRegistry.getInstance();
    }

    @Bean
    @ConditionalOnMissingBean
    public Logger redlogLogger(LogRegistry registry, @Value("${spring.application.name:app}") String name) {
        return registry.getLogger(name);
    }

    @Bean
    public RedlogLifecycle redlogLifecycle(LogRegistry registry, RedlogConfig config) {
        return new RedlogLifecycle(registry, config);
    }

    /**
     * 컨텍스트 시작 시 설정을 적용하고 종료 시 Sink를 플러시하는 SmartLifecycle 구현체.
     */
    static class RedlogLifecycle implements SmartLifecycle {

        private final LogRegistry registry;
        private final RedlogConfig config;
        private volatile boolean running = false;

        RedlogLifecycle(LogRegistry registry, RedlogConfig config) {
            this.registry = registry;
            this.config = config;
        }

        @Override
        public void start() {
            try {
                registry.configure(config);
            } catch (RuntimeException e) {
                log.error("Failed to apply redlog configuration", e);
                throw new IllegalStateException("redlog initialization failed", e);
            }

            running = true;
            log.info("redlog configured: level={}, theme={}, output={}",
                    config.getLevel(), registry.getTheme().getName(), config.getOutput());
        }

        @Override
        public void stop() {
            try {
                registry.getSink().flush();
            } catch (RuntimeException e) {
                log.warn("Failed to flush redlog sink on shutdown: {}", e.getMessage());
            }
            running = false;
        }

        @Override
        public boolean isRunning() {
            return running;
        }

        @Override
        public int getPhase() {
            return Integer.MIN_VALUE + 100;
        }
    }

    /**
     * SLF4J/Logback 브리지 설정.
     * redlog.bridge.enabled=true 이고 Logback이 클래스패스에 있을 때 활성화 (기본값: false)
     */
    @Configuration
    @ConditionalOnClass(name = "ch.qos.logback.classic.LoggerContext")
    @ConditionalOnProperty(prefix = "redlog.bridge", name = "enabled", havingValue = "true")
    static class LogbackBridgeConfiguration {

        @Bean
        public LogbackBridgeLifecycle logbackBridgeLifecycle(LogRegistry registry, RedlogProperties properties) {
            RedlogAppender appender = new RedlogAppender(registry);
            appender.setIncludeMdc(properties.getBridge().isIncludeMdc());
            return new LogbackBridgeLifecycle(appender);
        }
    }

    /**
     * 루트 Logback 로거에 {@link RedlogAppender}를 연결/해제.
     */
    static class LogbackBridgeLifecycle implements SmartLifecycle {

        private static final String APPENDER_NAME = "REDLOG";

        private final RedlogAppender appender;
        private volatile boolean running = false;

        LogbackBridgeLifecycle(RedlogAppender appender) {
            this.appender = appender;
        }

        @Override
        public void start() {
            if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext)) {
                log.warn("Logback is not the active SLF4J binding; redlog bridge disabled");
                return;
            }
            LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
            appender.setContext(context);
            appender.setName(APPENDER_NAME);
            appender.start();
            context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).addAppender(appender);
            running = true;
            log.info("redlog Logback bridge attached");
        }

        @Override
        public void stop() {
            if (LoggerFactory.getILoggerFactory() instanceof LoggerContext) {
                ((LoggerContext) LoggerFactory.getILoggerFactory())
                        .getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).detachAppender(appender);
            }
            appender.stop();
            running = false;
        }

        @Override
        public boolean isRunning() {
            return running;
        }

        /** 설정 적용 이후에 연결 */
        @Override
        public int getPhase() {
            return Integer.MIN_VALUE + 200;
        }

        RedlogAppender getAppender() {
            return appender;
        }
    }
}
