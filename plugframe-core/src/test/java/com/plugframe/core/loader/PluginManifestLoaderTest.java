package com.plugframe.core.loader;

import com.plugframe.api.config.ConfigFieldDefinition;
import com.plugframe.api.config.PluginDefinition;
import com.plugframe.api.exception.PluginLoadException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.FileOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.jar.JarEntry;
import java.util.jar.JarOutputStream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("插件清单与目录制品来源测试")
class PluginManifestLoaderTest {

    @TempDir
    Path home;

    private static String manifest(String name, String version) {
        return "name: " + name + "\n"
                + "version: '" + version + "'\n"
                + "mainClass: com.example." + name + ".Main\n";
    }

    private File pluginDir(String dirName, String yaml) throws Exception {
        Path dir = Files.createDirectories(home.resolve(dirName));
        Files.write(dir.resolve(PluginManifestLoader.MANIFEST_NAME), yaml.getBytes(StandardCharsets.UTF_8));
        return dir.toFile();
    }

    private File pluginJar(String fileName, String yaml) throws Exception {
        File jar = home.resolve(fileName).toFile();
        try (JarOutputStream out = new JarOutputStream(new FileOutputStream(jar))) {
            if (yaml != null) {
                out.putNextEntry(new JarEntry(PluginManifestLoader.MANIFEST_NAME));
                out.write(yaml.getBytes(StandardCharsets.UTF_8));
                out.closeEntry();
            }
        }
        return jar;
    }

    @Nested
    @DisplayName("清单解析")
    class ManifestTests {

        @Test
        @DisplayName("解析目录中的完整清单，忽略未知字段")
        void parseDirectory() throws Exception {
            File dir = pluginDir("greeter", manifest("greeter", "1.2.0")
                    + "description: Says hello\n"
                    + "author: Alice\n"
                    + "tags: [demo, text]\n"
                    + "dependencies:\n"
                    + "  - storage>=1.0\n"
                    + "requiredCapabilities:\n"
                    + "  storage: [read, write]\n"
                    + "futureField: ignored\n");

            PluginDefinition definition = PluginManifestLoader.requireDefinition(dir);

            assertEquals("greeter", definition.getName());
            assertEquals("1.2.0", definition.getVersion());
            assertEquals("com.example.greeter.Main", definition.getMainClass());
            assertEquals(List.of("storage>=1.0"), definition.getDependencies());
            assertEquals(List.of("read", "write"), definition.getRequiredCapabilities().get("storage"));
            assertEquals(List.of("demo", "text"), definition.getTags());
        }

        @Test
        @DisplayName("解析配置 schema 声明")
        void parseConfigSchema() throws Exception {
            File dir = pluginDir("mailer", manifest("mailer", "1.0")
                    + "configSchema:\n"
                    + "  - name: host\n"
                    + "    required: true\n"
                    + "    pattern: '[a-z.]+'\n"
                    + "  - name: port\n"
                    + "    type: integer\n"
                    + "    defaultValue: 25\n"
                    + "    min: 1\n"
                    + "    max: 65535\n"
                    + "  - name: mode\n"
                    + "    allowed: [plain, tls]\n");

            PluginDefinition definition = PluginManifestLoader.requireDefinition(dir);

            List<ConfigFieldDefinition> schema = definition.getConfigSchema();
            assertEquals(3, schema.size());
            assertEquals("host", schema.get(0).getName());
            assertEquals("string", schema.get(0).getType());
            assertTrue(schema.get(0).isRequired());
            assertEquals("integer", schema.get(1).getType());
            assertEquals(25, schema.get(1).getDefaultValue());
            assertEquals(1.0, schema.get(1).getMin());
            assertEquals(List.of("plain", "tls"), schema.get(2).getAllowed());
        }

        @Test
        @DisplayName("解析 Jar 包中的清单")
        void parseJar() throws Exception {
            File jar = pluginJar("store-2.0.jar", manifest("store", "2.0"));

            PluginDefinition definition = PluginManifestLoader.parseDefinition(jar);

            assertNotNull(definition);
            assertEquals("store", definition.getName());
        }

        @Test
        @DisplayName("没有清单或清单非法时")
        void missingOrInvalid() throws Exception {
            File empty = Files.createDirectories(home.resolve("empty")).toFile();
            File bareJar = pluginJar("bare.jar", null);
            File badName = pluginDir("bad", manifest("bad name!", "1.0"));

            assertNull(PluginManifestLoader.parseDefinition(empty));
            assertNull(PluginManifestLoader.parseDefinition(bareJar));
            assertNull(PluginManifestLoader.parseDefinition(badName));
            assertThrows(PluginLoadException.class, () -> PluginManifestLoader.requireDefinition(empty));
            assertThrows(PluginLoadException.class, () -> PluginManifestLoader.requireDefinition(badName));
        }

        @Test
        @DisplayName("拒绝任意类型标签")
        void rejectsGlobalTags() throws Exception {
            File dir = pluginDir("evil", "!!java.io.File\nname: evil\n");

            assertNull(PluginManifestLoader.parseDefinition(dir));
        }
    }

    @Nested
    @DisplayName("目录制品来源")
    class DirectorySourceTests {

        @Test
        @DisplayName("扫描插件目录，按名称与版本解析")
        void resolveByVersion() throws Exception {
            pluginDir("counter-1", manifest("counter", "1.0"));
            pluginDir("counter-2", manifest("counter", "1.10"));
            pluginJar("counter-3.jar", manifest("counter", "1.9"));
            Files.write(home.resolve("README.txt"), "not a plugin".getBytes(StandardCharsets.UTF_8));
            DirectoryArtifactSource source = new DirectoryArtifactSource(home.toFile());

            assertEquals(3, source.available().size());
            assertEquals("1.10", source.resolve("counter", null).getVersion());
            assertEquals("1.9", source.resolve("counter", "1.9.0").getVersion());
            assertFalse(source.resolve("counter", "1.0").isEmbedded());
            assertThrows(PluginLoadException.class, () -> source.resolve("counter", "7.0"));
            assertThrows(PluginLoadException.class, () -> source.resolve("other", null));
        }

        @Test
        @DisplayName("缺少入口类的清单被跳过")
        void skipsManifestWithoutMainClass() throws Exception {
            pluginDir("nomain", "name: nomain\nversion: '1.0'\n");

            assertTrue(new DirectoryArtifactSource(home.toFile()).available().isEmpty());
        }

        @Test
        @DisplayName("插件目录不存在时为空")
        void missingHome() {
            assertTrue(new DirectoryArtifactSource(home.resolve("nope").toFile()).available().isEmpty());
        }
    }
}
