package com.plugframe.core.util;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.introspector.PropertyUtils;

/**
 * YAML 工具类
 * <p>
 * SnakeYAML 2.x 默认禁止 !! 全局标签，这里只放行 com.plugframe.* 下的类型；
 * 清单中出现未知字段时忽略，保证新版本清单能被旧版本框架读取。
 */
public final class YamlUtils {

    private static final String TRUSTED_PACKAGE = "com.plugframe.";

    private YamlUtils() {
    }

    /**
     * 创建把根节点映射为 type 的 Yaml 实例
     */
    public static Yaml createLoaderYaml(Class<?> type) {
        LoaderOptions loaderOptions = new LoaderOptions();
        loaderOptions.setTagInspector(tag -> tag.getClassName() != null
                && tag.getClassName().startsWith(TRUSTED_PACKAGE));

        PropertyUtils propertyUtils = new PropertyUtils();
        propertyUtils.setSkipMissingProperties(true);

        Constructor constructor = new Constructor(type, loaderOptions);
        constructor.setPropertyUtils(propertyUtils);
        return new Yaml(constructor);
    }
}
