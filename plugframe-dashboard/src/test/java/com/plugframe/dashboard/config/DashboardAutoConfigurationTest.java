package com.plugframe.dashboard.config;

import com.plugframe.dashboard.controller.PluginController;
import com.plugframe.starter.configuration.PlugFrameAutoConfiguration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.WebApplicationContextRunner;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DashboardAutoConfiguration 单元测试")
class DashboardAutoConfigurationTest {

    @TempDir
    Path tempDir;

    private WebApplicationContextRunner runner() {
        return new WebApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(PlugFrameAutoConfiguration.class,
                        DashboardAutoConfiguration.class))
                .withPropertyValues("plugframe.plugin-home=" + tempDir, "plugframe.bootstrap-on-startup=false");
    }

    @Test
    @DisplayName("默认不暴露管理接口")
    void disabledByDefault() {
        runner().run(context -> assertThat(context).doesNotHaveBean(PluginController.class));
    }

    @Test
    @DisplayName("开启后注册 PluginController")
    void enabled() {
        runner().withPropertyValues("plugframe.dashboard.enabled=true")
                .run(context -> assertThat(context).hasSingleBean(PluginController.class));
    }

    @Test
    @DisplayName("PlugFrame 关闭时即使开启 dashboard 也不注册")
    void requiresPluginManager() {
        runner().withPropertyValues("plugframe.enabled=false", "plugframe.dashboard.enabled=true")
                .run(context -> assertThat(context).doesNotHaveBean(PluginController.class));
    }
}
