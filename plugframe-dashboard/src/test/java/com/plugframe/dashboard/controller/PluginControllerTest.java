package com.plugframe.dashboard.controller;

import com.plugframe.api.exception.CycleDetectedException;
import com.plugframe.api.exception.DependencyViolationException;
import com.plugframe.api.exception.DuplicatePluginException;
import com.plugframe.api.exception.ErrorKind;
import com.plugframe.api.exception.PluginBusyException;
import com.plugframe.api.exception.PluginLoadException;
import com.plugframe.api.exception.PluginNotFoundException;
import com.plugframe.api.exception.RollbackFailedException;
import com.plugframe.core.config.PlugFrameConfig;
import com.plugframe.core.enums.PluginStatus;
import com.plugframe.core.lifecycle.ReloadResult;
import com.plugframe.core.plugin.PluginManager;
import com.plugframe.core.registry.PluginRecord;
import com.plugframe.dashboard.converter.PluginInfoConverter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("PluginController 单元测试")
class PluginControllerTest {

    @Mock
    private PluginManager pluginManager;

    @TempDir
    Path pluginHome;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders
                .standaloneSetup(new PluginController(pluginManager, new PluginInfoConverter()))
                .build();
        when(pluginManager.getConfig()).thenReturn(PlugFrameConfig.builder()
                .pluginHome(pluginHome.toString())
                .build());
    }

    private static PluginRecord record(String name, String version, String... dependencies) {
        PluginRecord.PluginRecordBuilder builder = PluginRecord.builder()
                .name(name)
                .version(version)
                .status(PluginStatus.ACTIVE)
                .capability("increment");
        for (String dependency : dependencies) {
            builder.dependency(dependency);
        }
        return builder.build();
    }

    @Nested
    @DisplayName("查询")
    class QueryTests {

        @Test
        @DisplayName("列表：按注册表顺序返回，total 为总数")
        void listAll() throws Exception {
            when(pluginManager.list()).thenReturn(List.of(record("b", "1.0"), record("a", "1.0", "b")));

            mockMvc.perform(get("/plugframe/plugins"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.success").value(true))
                    .andExpect(jsonPath("$.data.total").value(2))
                    .andExpect(jsonPath("$.data.plugins[0].name").value("b"))
                    .andExpect(jsonPath("$.data.plugins[1].dependencies[0]").value("b"))
                    .andExpect(jsonPath("$.data.plugins[1].status").value("ACTIVE"));
        }

        @Test
        @DisplayName("列表：分页参数透传")
        void listPage() throws Exception {
            when(pluginManager.list()).thenReturn(List.of(record("a", "1.0"), record("b", "1.0"), record("c", "1.0")));
            when(pluginManager.list(1, 1)).thenReturn(List.of(record("b", "1.0")));

            mockMvc.perform(get("/plugframe/plugins").param("offset", "1").param("limit", "1"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.total").value(3))
                    .andExpect(jsonPath("$.data.plugins.length()").value(1))
                    .andExpect(jsonPath("$.data.plugins[0].name").value("b"));
        }

        @Test
        @DisplayName("列表：只给 offset 时 limit 不设上限")
        void listWithOffsetOnly() throws Exception {
            when(pluginManager.list()).thenReturn(List.of(record("a", "1.0"), record("b", "1.0")));
            when(pluginManager.list(1, Integer.MAX_VALUE)).thenReturn(List.of(record("b", "1.0")));

            mockMvc.perform(get("/plugframe/plugins").param("offset", "1"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.total").value(2))
                    .andExpect(jsonPath("$.data.plugins.length()").value(1))
                    .andExpect(jsonPath("$.data.plugins[0].name").value("b"));
            verify(pluginManager).list(1, Integer.MAX_VALUE);
        }

        @Test
        @DisplayName("查询不存在的插件返回 404")
        void getMissing() throws Exception {
            when(pluginManager.get("ghost")).thenThrow(new PluginNotFoundException("ghost"));

            mockMvc.perform(get("/plugframe/plugins/ghost"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.success").value(false))
                    .andExpect(jsonPath("$.errorKind").value("NOT_FOUND"));
        }

        @Test
        @DisplayName("查询单个插件")
        void getOne() throws Exception {
            when(pluginManager.get("a")).thenReturn(record("a", "1.2"));

            mockMvc.perform(get("/plugframe/plugins/a"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.version").value("1.2"))
                    .andExpect(jsonPath("$.data.capabilities[0]").value("increment"));
        }
    }

    @Nested
    @DisplayName("安装")
    class InstallTests {

        @Test
        @DisplayName("按名称和版本安装")
        void installByReference() throws Exception {
            when(pluginManager.install("a", "1.0")).thenReturn(record("a", "1.0"));

            mockMvc.perform(post("/plugframe/plugins/install")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"name\":\"a\",\"version\":\"1.0\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.name").value("a"));
        }

        @Test
        @DisplayName("名称为空返回 400，不调用管理器")
        void blankName() throws Exception {
            mockMvc.perform(post("/plugframe/plugins/install")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"name\":\" \"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.errorKind").value("INVALID_ARGUMENT"));
            verify(pluginManager, never()).install(any(String.class), any());
        }

        @Test
        @DisplayName("名称冲突返回 409，依赖成环返回 400")
        void conflicts() throws Exception {
            when(pluginManager.install("a", null)).thenThrow(new DuplicatePluginException("a"));
            when(pluginManager.install("c", null)).thenThrow(new CycleDetectedException(List.of("c", "d", "c")));

            mockMvc.perform(post("/plugframe/plugins/install")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"name\":\"a\"}"))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.errorKind").value("DUPLICATE_NAME"));
            mockMvc.perform(post("/plugframe/plugins/install")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"name\":\"c\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.errorKind").value("CYCLE_DETECTED"));
        }

        @Test
        @DisplayName("上传 JAR 保存到插件目录后安装")
        void upload() throws Exception {
            when(pluginManager.install(any(File.class))).thenReturn(record("up", "1.0"));
            MockMultipartFile jar = new MockMultipartFile("file", "up-1.0.jar", "application/java-archive",
                    new byte[]{1, 2, 3});

            mockMvc.perform(multipart("/plugframe/plugins/install/upload").file(jar))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.name").value("up"));

            Path saved = pluginHome.resolve("up-1.0.jar");
            assertTrue(Files.exists(saved));
            verify(pluginManager).install(saved.toFile());
        }

        @Test
        @DisplayName("上传非 JAR 文件被拒绝")
        void uploadRejectsNonJar() throws Exception {
            MockMultipartFile text = new MockMultipartFile("file", "notes.txt", "text/plain", new byte[]{1});

            mockMvc.perform(multipart("/plugframe/plugins/install/upload").file(text))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.errorKind").value("INVALID_ARGUMENT"));
            verify(pluginManager, never()).install(any(File.class));
        }
    }

    @Nested
    @DisplayName("重载")
    class ReloadTests {

        @Test
        @DisplayName("成功返回新版本与待复核依赖方")
        void reloadSucceeds() throws Exception {
            when(pluginManager.get("b")).thenReturn(record("b", "1.0"));
            when(pluginManager.reload("b", "2.0"))
                    .thenReturn(ReloadResult.succeeded(record("b", "2.0"), List.of("a")));

            mockMvc.perform(post("/plugframe/plugins/b/reload")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"version\":\"2.0\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.outcome").value("SUCCEEDED"))
                    .andExpect(jsonPath("$.data.plugin.version").value("2.0"))
                    .andExpect(jsonPath("$.data.needsRevalidation[0]").value("a"));
        }

        @Test
        @DisplayName("回滚属于软失败：返回原版本与错误类型")
        void reloadRolledBack() throws Exception {
            when(pluginManager.get("b")).thenReturn(record("b", "1.0"));
            when(pluginManager.reload("b", "2.0")).thenReturn(ReloadResult.rolledBack(record("b", "1.0"), "2.0",
                    ErrorKind.LOAD_FAILURE, new PluginLoadException("b", "onLoad failed")));

            mockMvc.perform(post("/plugframe/plugins/b/reload")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"version\":\"2.0\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.success").value(false))
                    .andExpect(jsonPath("$.errorKind").value("LOAD_FAILURE"))
                    .andExpect(jsonPath("$.data.outcome").value("ROLLED_BACK"))
                    .andExpect(jsonPath("$.data.attemptedVersion").value("2.0"))
                    .andExpect(jsonPath("$.data.plugin.version").value("1.0"));
        }

        @Test
        @DisplayName("不带请求体时重载到最新版本")
        void reloadLatest() throws Exception {
            when(pluginManager.get("b")).thenReturn(record("b", "1.0"));
            when(pluginManager.reload(eq("b"), (String) isNull()))
                    .thenReturn(ReloadResult.succeeded(record("b", "3.0"), Collections.emptyList()));

            mockMvc.perform(post("/plugframe/plugins/b/reload"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.plugin.version").value("3.0"));
        }

        @Test
        @DisplayName("插件不存在时返回 404，不解析制品")
        void reloadMissing() throws Exception {
            when(pluginManager.get("ghost")).thenThrow(new PluginNotFoundException("ghost"));

            mockMvc.perform(post("/plugframe/plugins/ghost/reload"))
                    .andExpect(status().isNotFound());
            verify(pluginManager, never()).reload(any(String.class), any(String.class));
        }

        @Test
        @DisplayName("忙碌返回 409，回滚失败返回 500")
        void busyAndFatal() throws Exception {
            when(pluginManager.get(any(String.class))).thenReturn(record("b", "1.0"));
            when(pluginManager.reload("b", "2.0")).thenThrow(new PluginBusyException("b"));
            when(pluginManager.reload("b", "3.0")).thenThrow(new RollbackFailedException("b",
                    new PluginLoadException("b", "new broken"), new PluginLoadException("b", "old broken")));

            mockMvc.perform(post("/plugframe/plugins/b/reload")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"version\":\"2.0\"}"))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.errorKind").value("BUSY"));
            mockMvc.perform(post("/plugframe/plugins/b/reload")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"version\":\"3.0\"}"))
                    .andExpect(status().isInternalServerError())
                    .andExpect(jsonPath("$.errorKind").value("ROLLBACK_FAILURE"));
        }
    }

    @Nested
    @DisplayName("卸载")
    class UninstallTests {

        @Test
        @DisplayName("卸载成功返回被移除的记录")
        void uninstall() throws Exception {
            when(pluginManager.uninstall("a")).thenReturn(record("a", "1.0"));

            mockMvc.perform(delete("/plugframe/plugins/a"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.name").value("a"));
        }

        @Test
        @DisplayName("仍被依赖时返回 409")
        void blockedByDependents() throws Exception {
            when(pluginManager.uninstall("b")).thenThrow(new DependencyViolationException("b", List.of("a")));

            mockMvc.perform(delete("/plugframe/plugins/b"))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.errorKind").value("DEPENDENCY_VIOLATION"));
        }

        @Test
        @DisplayName("未知异常返回 500 且没有错误类型")
        void unexpectedError() throws Exception {
            when(pluginManager.uninstall("a")).thenThrow(new IllegalStateException("boom"));

            mockMvc.perform(delete("/plugframe/plugins/a"))
                    .andExpect(status().isInternalServerError())
                    .andExpect(jsonPath("$.errorKind").doesNotExist());
        }
    }

    @Test
    @DisplayName("错误类型到 HTTP 状态码的映射覆盖全部枚举")
    void statusMapping() {
        for (ErrorKind kind : ErrorKind.values()) {
            HttpStatus status = PluginController.statusOf(kind);
            assertTrue(status.isError(), kind.name());
        }
        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, PluginController.statusOf(ErrorKind.UNAVAILABLE));
    }
}
