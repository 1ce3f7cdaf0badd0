package com.plugframe.core.classloader;

import com.plugframe.core.exception.ClassLoaderException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URL;
import java.net.URLClassLoader;
import java.util.Collection;
import java.util.Collections;
import java.util.Enumeration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 单个插件版本的类加载器
 * <p>
 * 每次加载源文件制品都会新建一个实例，同一插件的两个版本互不可见，
 * 静态状态随旧版本的加载器一起被回收。
 * <ul>
 *     <li>插件自身的类和资源优先（Child-First）</li>
 *     <li>插件契约、JDK 与日志门面总是交给宿主加载器，保证 Plugin 接口只有一份</li>
 *     <li>关闭后拒绝加载类，资源查询返回空</li>
 * </ul>
 */
@Slf4j
public class PluginClassLoader extends URLClassLoader {

    private static final List<String> HOST_PACKAGES = List.of(
            "java.", "javax.", "jakarta.", "jdk.", "sun.", "com.sun.", "org.w3c.", "org.xml.",
            "com.plugframe.api.",
            "lombok.",
            "org.slf4j.",
            "org.apache.logging.log4j.",
            "ch.qos.logback."
    );

    private static final List<String> extraHostPackages = new CopyOnWriteArrayList<>();

    @Getter
    private final String pluginName;

    @Getter
    private final String version;

    private final AtomicBoolean closed = new AtomicBoolean();
    private final AtomicInteger definedClasses = new AtomicInteger();

    public PluginClassLoader(String pluginName, String version, URL[] urls, ClassLoader parent) {
        super(pluginName + "@" + version, urls, parent);
        this.pluginName = pluginName;
        this.version = version;
        log.debug("[{}] Class loader for version {} created over {} URL(s)", pluginName, version, urls.length);
    }

    /**
     * 追加总是由宿主提供的包前缀，对之后的所有插件加载器生效
     */
    public static void addParentDelegatePackages(Collection<String> packages) {
        if (packages == null || packages.isEmpty()) {
            return;
        }
        extraHostPackages.addAll(packages);
        log.info("Host-provided packages extended with {}", packages);
    }

    public static void removeParentDelegatePackages(Collection<String> packages) {
        if (packages != null) {
            extraHostPackages.removeAll(packages);
        }
    }

    @Override
    protected Class<?> loadClass(String className, boolean resolve) throws ClassNotFoundException {
        if (closed.get()) {
            throw new ClassLoaderException(pluginName, className, String.format(
                    "Class loader of %s@%s is closed, cannot load %s", pluginName, version, className));
        }
        synchronized (getClassLoadingLock(className)) {
            Class<?> loaded = findLoadedClass(className);
            if (loaded == null && isHostProvided(className)) {
                loaded = fromHost(className);
            }
            if (loaded == null) {
                loaded = fromPlugin(className);
            }
            if (loaded == null) {
                // 插件里没有，最后再问一次宿主，找不到时由父类抛出
                return super.loadClass(className, resolve);
            }
            if (resolve) {
                resolveClass(loaded);
            }
            return loaded;
        }
    }

    private Class<?> fromHost(String className) {
        try {
            return getParent().loadClass(className);
        } catch (ClassNotFoundException e) {
            return null;
        }
    }

    private Class<?> fromPlugin(String className) {
        try {
            Class<?> defined = findClass(className);
            definedClasses.incrementAndGet();
            return defined;
        } catch (ClassNotFoundException e) {
            return null;
        }
    }

    @Override
    public URL getResource(String resourceName) {
        if (closed.get()) {
            log.warn("[{}] Resource {} requested from closed class loader of version {}",
                    pluginName, resourceName, version);
            return null;
        }
        URL own = findResource(resourceName);
        return own != null ? own : super.getResource(resourceName);
    }

    @Override
    public Enumeration<URL> getResources(String resourceName) throws IOException {
        if (closed.get()) {
            return Collections.emptyEnumeration();
        }
        Set<URL> merged = new LinkedHashSet<>(Collections.list(findResources(resourceName)));
        if (getParent() != null) {
            merged.addAll(Collections.list(getParent().getResources(resourceName)));
        }
        return Collections.enumeration(merged);
    }

    @Override
    public void close() throws IOException {
        if (!closed.compareAndSet(false, true)) {
            log.debug("[{}] Class loader of version {} already closed", pluginName, version);
            return;
        }
        try {
            super.close();
        } catch (IOException e) {
            log.error("[{}] Failed to release jar handles of version {}", pluginName, version, e);
            throw e;
        }
        log.info("[{}] Class loader of version {} closed ({} plugin classes defined)",
                pluginName, version, definedClasses.get());
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * 由本加载器（而非宿主）定义的类数量
     */
    public int getDefinedClassCount() {
        return definedClasses.get();
    }

    private static boolean isHostProvided(String className) {
        return HOST_PACKAGES.stream().anyMatch(className::startsWith)
                || extraHostPackages.stream().anyMatch(className::startsWith);
    }

    @Override
    public String toString() {
        return String.format("PluginClassLoader[%s@%s, %s, urls=%d, defined=%d]",
                pluginName, version, closed.get() ? "closed" : "open", getURLs().length, definedClasses.get());
    }
}
