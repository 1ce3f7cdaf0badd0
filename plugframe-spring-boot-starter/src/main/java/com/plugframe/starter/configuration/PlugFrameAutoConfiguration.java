package com.plugframe.starter.configuration;

import com.plugframe.core.config.PlugFrameConfig;
import com.plugframe.core.event.EventBus;
import com.plugframe.core.loader.DirectoryArtifactSource;
import com.plugframe.core.persistence.InMemoryPersistenceBackend;
import com.plugframe.core.persistence.JsonFilePersistenceBackend;
import com.plugframe.core.plugin.PluginManager;
import com.plugframe.core.spi.ArtifactSource;
import com.plugframe.core.spi.PersistenceBackend;
import com.plugframe.starter.config.PlugFrameProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.util.StringUtils;

import java.io.File;
import java.nio.file.Paths;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * PlugFrame 自动配置
 * <p>
 * 组件（事件总线、持久化后端、制品来源）均可由宿主覆盖，PluginManager 依赖注入进来的组件。
 */
@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(PlugFrameProperties.class)
@ConditionalOnProperty(prefix = "plugframe", name = "enabled", havingValue = "true", matchIfMissing = true)
public class PlugFrameAutoConfiguration {

    private final AtomicBoolean bootstrapDone = new AtomicBoolean(false);

    @Bean
    @ConditionalOnMissingBean
    public EventBus eventBus() {
        return new EventBus();
    }

    @Bean
    @ConditionalOnMissingBean
    public PlugFrameConfig plugFrameConfig(PlugFrameProperties properties) {
        PlugFrameProperties.Runtime rtProps = properties.getRuntime();
        return PlugFrameConfig.builder()
                .callbackTimeoutMs(rtProps.getCallbackTimeout().toMillis())
                .lockWaitMs(rtProps.getLockWait().toMillis())
                .reaperIntervalSeconds((int) rtProps.getReaperInterval().getSeconds())
                .forceCleanupDelaySeconds((int) rtProps.getForceCleanupDelay().getSeconds())
                .pluginHome(properties.getPluginHome())
                .registryFile(properties.getRegistryFile())
                .configDir(properties.getConfigDir())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public PersistenceBackend persistenceBackend(PlugFrameConfig config) {
        if (!StringUtils.hasText(config.getRegistryFile())) {
            log.info("No plugframe.registry-file configured, registry is kept in memory only");
            return new InMemoryPersistenceBackend();
        }
        return new JsonFilePersistenceBackend(Paths.get(config.getRegistryFile()));
    }

    @Bean
    @ConditionalOnMissingBean
    public ArtifactSource artifactSource(PlugFrameConfig config) {
        return new DirectoryArtifactSource(new File(config.getPluginHome()));
    }

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public PluginManager pluginManager(PlugFrameConfig config,
                                       PersistenceBackend persistenceBackend,
                                       ArtifactSource artifactSource,
                                       EventBus eventBus) {
        return new PluginManager(config, persistenceBackend, artifactSource, eventBus);
    }

    @Bean
    @ConditionalOnProperty(prefix = "plugframe", name = "bootstrap-on-startup", havingValue = "true",
            matchIfMissing = true)
    public ApplicationRunner plugFrameBootstrapRunner(PluginManager pluginManager) {
        return args -> {
            if (!bootstrapDone.compareAndSet(false, true)) {
                return;
            }
            log.info("[PlugFrame] Restoring plugins from registry...");
            pluginManager.bootstrap();
        };
    }
}
