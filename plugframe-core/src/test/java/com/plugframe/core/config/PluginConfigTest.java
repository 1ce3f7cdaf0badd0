package com.plugframe.core.config;

import com.plugframe.api.config.ConfigFieldDefinition;
import com.plugframe.api.config.PluginDefinition;
import com.plugframe.api.exception.ErrorKind;
import com.plugframe.api.exception.InvalidArgumentException;
import com.plugframe.api.exception.PluginConfigException;
import com.plugframe.api.exception.PluginNotFoundException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("插件配置测试")
class PluginConfigTest {

    @TempDir
    Path dir;

    private void write(String fileName, String content) throws Exception {
        Files.write(dir.resolve(fileName), content.getBytes(StandardCharsets.UTF_8));
    }

    private static PluginConfigSchema mailerSchema() {
        return PluginConfigSchema.of(
                ConfigField.builder().name("host").required(true).build(),
                ConfigField.builder().name("port").type(ConfigFieldType.INTEGER).defaultValue(25)
                        .validator(v -> ((Number) v).intValue() > 0).build(),
                ConfigField.builder().name("ratio").type(ConfigFieldType.FLOAT).build(),
                ConfigField.builder().name("tags").type(ConfigFieldType.LIST).build());
    }

    @Nested
    @DisplayName("schema 校验")
    class SchemaTests {

        @Test
        @DisplayName("缺少必填字段、类型不符、自定义校验失败都报告错误")
        void validateReportsAllErrors() {
            List<String> errors = mailerSchema().validate(Map.of("port", -1, "ratio", "high", "tags", List.of()));

            assertEquals(List.of(
                    "Required field 'host' is missing",
                    "Field 'port' has invalid value: -1",
                    "Field 'ratio' has invalid value: high"), errors);
        }

        @Test
        @DisplayName("FLOAT 接受整数，INTEGER 不接受小数，未声明的键不检查")
        void typeMatching() {
            assertTrue(mailerSchema().validate(Map.of("host", "mx", "ratio", 2, "extra", new Object())).isEmpty());
            assertFalse(mailerSchema().validate(Map.of("host", "mx", "port", 2.5)).isEmpty());
        }

        @Test
        @DisplayName("只收集非 null 的默认值")
        void defaults() {
            assertEquals(Map.of("port", 25), mailerSchema().defaults());
            assertTrue(PluginConfigSchema.empty().defaults().isEmpty());
        }

        @Test
        @DisplayName("从清单声明构造：min/max/pattern/allowed 组合成校验")
        void fromDefinitions() {
            ConfigFieldDefinition port = ConfigFieldDefinition.of("port", "integer");
            port.setMin(1.0);
            port.setMax(65535.0);
            ConfigFieldDefinition host = ConfigFieldDefinition.of("host", "string");
            host.setPattern("[a-z.]+");
            host.setMax(10.0);
            ConfigFieldDefinition mode = ConfigFieldDefinition.of("mode", "STRING");
            mode.setAllowed(new ArrayList<>(List.of("plain", "tls")));
            ConfigFieldDefinition retries = ConfigFieldDefinition.of("retries", "integer");
            retries.setAllowed(new ArrayList<>(List.of(1, 3)));
            PluginConfigSchema schema = PluginConfigSchema.fromDefinitions(List.of(port, host, mode, retries));

            assertTrue(schema.validate(Map.of("port", 8080, "host", "mx.local", "mode", "tls", "retries", 3L))
                    .isEmpty());
            assertEquals(4, schema.validate(Map.of("port", 0, "host", "MX", "mode", "ssl", "retries", 2)).size());
            assertFalse(schema.validate(Map.of("host", "a.very.long.host")).isEmpty());
        }

        @Test
        @DisplayName("类型名大小写不敏感，map 等同 dict，未知类型非法")
        void fieldTypeParsing() {
            assertEquals(ConfigFieldType.DICT, ConfigFieldType.of("Map"));
            assertEquals(ConfigFieldType.BOOLEAN, ConfigFieldType.of("BOOLEAN"));
            assertEquals(ConfigFieldType.STRING, ConfigFieldType.of(null));
            assertThrows(InvalidArgumentException.class, () -> ConfigFieldType.of("date"));
        }
    }

    @Nested
    @DisplayName("加载")
    class LoadTests {

        @Test
        @DisplayName("没有配置文件时只有默认值")
        void defaultsOnly() {
            PluginConfig config = new PluginConfig("mailer", mailerSchema(), dir);

            assertEquals(Map.of("port", 25), config.asMap());
            assertEquals(List.of("Required field 'host' is missing"), config.validate());
            assertEquals("fallback", config.get("host", "fallback"));
        }

        @Test
        @DisplayName("JSON 优先于 YAML，文件中的值覆盖默认值")
        void jsonWins() throws Exception {
            write("mailer.json", "{\"host\": \"json.local\"}");
            write("mailer.yaml", "host: yaml.local\nport: 2525\n");

            PluginConfig config = new PluginConfig("mailer", mailerSchema(), dir);

            assertEquals("json.local", config.get("host"));
            assertEquals(25, config.get("port"));
            assertTrue(config.validate().isEmpty());
        }

        @Test
        @DisplayName("读取 YAML 配置")
        void yaml() throws Exception {
            write("mailer.yaml", "host: yaml.local\nport: 2525\ntags: [a, b]\n");

            PluginConfig config = new PluginConfig("mailer", mailerSchema(), dir);

            assertEquals(2525, config.get("port"));
            assertEquals(List.of("a", "b"), config.get("tags"));
            assertTrue(config.validate().isEmpty());
        }

        @Test
        @DisplayName("文件无法解析或根节点不是映射")
        void unreadable() throws Exception {
            write("broken.json", "{not json");
            write("listy.yaml", "- a\n- b\n");

            PluginConfigException broken = assertThrows(PluginConfigException.class,
                    () -> new PluginConfig("broken", PluginConfigSchema.empty(), dir));
            assertEquals(ErrorKind.INVALID_CONFIG, broken.getKind());
            assertEquals("broken", broken.getPluginName());
            assertThrows(PluginConfigException.class, () -> new PluginConfig("listy", PluginConfigSchema.empty(), dir));
        }
    }

    @Nested
    @DisplayName("修改、热重载与保存")
    class UpdateTests {

        @Test
        @DisplayName("声明字段的非法值被拒绝，未声明的键直接写入")
        void set() {
            PluginConfig config = new PluginConfig("mailer", mailerSchema(), dir);

            config.set("host", "mx.local");
            config.set("anything", List.of(1));
            PluginConfigException e = assertThrows(PluginConfigException.class, () -> config.set("port", "25"));

            assertEquals(1, e.getErrors().size());
            assertEquals(25, config.get("port"));
            assertEquals("mx.local", config.get("host"));
            assertEquals(List.of(1), config.get("anything"));
        }

        @Test
        @DisplayName("热重载读取新文件；新文件非法时保留原值")
        void reload() throws Exception {
            write("mailer.json", "{\"host\": \"one.local\"}");
            PluginConfig config = new PluginConfig("mailer", mailerSchema(), dir);

            write("mailer.json", "{\"host\": \"two.local\", \"port\": 587}");
            config.reload();
            assertEquals("two.local", config.get("host"));
            assertEquals(587, config.get("port"));

            write("mailer.json", "{\"port\": 0}");
            PluginConfigException e = assertThrows(PluginConfigException.class, config::reload);
            assertEquals(2, e.getErrors().size());
            assertEquals("two.local", config.get("host"));
            assertEquals(587, config.get("port"));
        }

        @Test
        @DisplayName("保存为 JSON 或 YAML 后可以重新读取")
        void save() throws Exception {
            Path nested = dir.resolve("nested");
            PluginConfig config = new PluginConfig("mailer", mailerSchema(), nested);
            config.set("host", "saved.local");

            Path json = config.save(ConfigFormat.JSON);
            assertEquals(nested.resolve("mailer.json"), json);
            assertEquals("saved.local", new PluginConfig("mailer", mailerSchema(), nested).get("host"));

            Files.delete(json);
            config.set("port", 2525);
            Path yaml = config.save(ConfigFormat.YAML);
            assertTrue(Files.readString(yaml).contains("port: 2525"));
            PluginConfig reread = new PluginConfig("mailer", mailerSchema(), nested);
            assertEquals(2525, reread.get("port"));
            assertEquals("saved.local", reread.get("host"));
        }
    }

    @Nested
    @DisplayName("配置表")
    class StoreTests {

        private PluginDefinition definition(String name, ConfigFieldDefinition... fields) {
            PluginDefinition definition = PluginDefinition.of(name, "1.0");
            definition.setConfigSchema(new ArrayList<>(List.of(fields)));
            return definition;
        }

        @Test
        @DisplayName("prepare 校验但不替换当前配置，activate 后才可查询")
        void prepareThenActivate() throws Exception {
            PluginConfigStore store = new PluginConfigStore(dir);
            ConfigFieldDefinition host = ConfigFieldDefinition.of("host", "string");
            host.setRequired(true);

            assertThrows(PluginConfigException.class, () -> store.prepare(definition("mailer", host)));

            write("mailer.yaml", "host: mx.local\n");
            PluginConfig prepared = store.prepare(definition("mailer", host));
            assertFalse(store.find("mailer").isPresent());

            store.activate(prepared);
            assertSame(prepared, store.get("mailer"));
            store.remove("mailer");
            assertThrows(PluginNotFoundException.class, () -> store.get("mailer"));
            assertTrue(Files.exists(dir.resolve("mailer.yaml")));
        }

        @Test
        @DisplayName("宿主注册的 schema 优先于清单声明")
        void hostSchemaWins() {
            PluginConfigStore store = new PluginConfigStore(dir);
            store.registerSchema("mailer", PluginConfigSchema.of(
                    ConfigField.builder().name("host").required(true).defaultValue("localhost")
                            .validator(v -> ((String) v).startsWith("local")).build()));
            ConfigFieldDefinition other = ConfigFieldDefinition.of("other", "string");
            other.setRequired(true);

            PluginConfig config = store.prepare(definition("mailer", other));

            assertEquals(Collections.singletonMap("host", "localhost"), config.asMap());
            assertEquals(1, config.getSchema().getFields().size());
        }
    }
}
