package com.plugframe.dashboard.config;

import com.plugframe.core.plugin.PluginManager;
import com.plugframe.dashboard.controller.PluginController;
import com.plugframe.dashboard.converter.PluginInfoConverter;
import com.plugframe.starter.configuration.PlugFrameAutoConfiguration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.context.annotation.Bean;

@Slf4j
@AutoConfiguration(after = PlugFrameAutoConfiguration.class)
@ConditionalOnWebApplication
@ConditionalOnBean(PluginManager.class)
@ConditionalOnProperty(prefix = "plugframe.dashboard", name = "enabled", havingValue = "true", matchIfMissing = false)
public class DashboardAutoConfiguration {

    public DashboardAutoConfiguration() {
        log.info("[PlugFrame] Dashboard initializing...");
    }

    @Bean
    public PluginInfoConverter pluginInfoConverter() {
        return new PluginInfoConverter();
    }

    @Bean
    public PluginController pluginController(PluginManager pluginManager, PluginInfoConverter pluginInfoConverter) {
        return new PluginController(pluginManager, pluginInfoConverter);
    }
}
