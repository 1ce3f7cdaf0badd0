package com.plugframe.core.loader;

import com.plugframe.api.config.PluginDefinition;
import com.plugframe.api.exception.PluginLoadException;
import com.plugframe.api.exception.PluginUnloadException;
import com.plugframe.api.plugin.Plugin;
import com.plugframe.api.plugin.StateBlob;
import com.plugframe.core.spi.PluginLoaderFactory;
import lombok.extern.slf4j.Slf4j;

import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * 隔离加载器
 * <p>
 * 源文件制品每次加载都创建新的 PluginClassLoader 并反射实例化 mainClass；
 * 内嵌制品每次加载调用一次工厂。所有插件回调经 {@link PluginCallExecutor} 限时执行。
 */
@Slf4j
public class IsolatedPluginLoader implements PluginLoader {

    private final PluginLoaderFactory loaderFactory;
    private final PluginCallExecutor callExecutor;
    private final ClassLoader hostClassLoader;

    public IsolatedPluginLoader(PluginLoaderFactory loaderFactory, PluginCallExecutor callExecutor) {
        this(loaderFactory, callExecutor, IsolatedPluginLoader.class.getClassLoader());
    }

    public IsolatedPluginLoader(PluginLoaderFactory loaderFactory, PluginCallExecutor callExecutor,
                                ClassLoader hostClassLoader) {
        this.loaderFactory = loaderFactory;
        this.callExecutor = callExecutor;
        this.hostClassLoader = hostClassLoader;
    }

    @Override
    public PluginHandle load(PluginArtifact artifact, StateBlob state) {
        String name = artifact.getName();
        StateBlob blob = state != null ? state : StateBlob.empty();
        ClassLoader classLoader = null;
        try {
            if (!artifact.isEmbedded()) {
                classLoader = loaderFactory.create(name, artifact.getVersion(), artifact.getSource(),
                        hostClassLoader);
            }
            final ClassLoader pluginClassLoader = classLoader;

            Plugin plugin = callExecutor.call(name, "instantiate", pluginClassLoader,
                    () -> instantiate(artifact, pluginClassLoader));
            if (plugin == null) {
                throw new PluginLoadException(name, "Plugin factory returned null for " + artifact);
            }

            callExecutor.call(name, "onLoad", pluginClassLoader, () -> {
                plugin.onLoad(blob);
                return null;
            });

            Set<String> capabilities = callExecutor.call(name, "capabilities", pluginClassLoader,
                    plugin::capabilities);
            if (capabilities == null) {
                throw new PluginLoadException(name, "Plugin [" + name + "] returned null capabilities");
            }

            PluginHandle handle = new PluginHandle(artifact, plugin, pluginClassLoader, capabilities);
            log.info("[{}] Loaded version {} (state: {}), capabilities={}", name, artifact.getVersion(), blob,
                    capabilities);
            return handle;
        } catch (Exception e) {
            closeQuietly(name, classLoader);
            throw asLoadException(name, artifact, e);
        } catch (LinkageError e) {
            // NoClassDefFoundError / ExceptionInInitializerError 等
            closeQuietly(name, classLoader);
            throw new PluginLoadException(name, "Failed to link plugin [" + name + "]: " + e, e);
        }
    }

    @Override
    public StateBlob unload(PluginHandle handle) {
        if (!handle.markUnloaded()) {
            throw new IllegalStateException("Handle already unloaded: " + handle);
        }
        String name = handle.getPluginName();
        Plugin plugin = handle.getPlugin();
        try {
            StateBlob blob = callExecutor.call(name, "onUnload", handle.getClassLoader(), plugin::onUnload);
            StateBlob result = blob != null ? blob : StateBlob.empty();
            log.info("[{}] Unloaded version {} (exported state: {})", name, handle.getVersion(), result);
            return result;
        } catch (TimeoutException e) {
            throw new PluginUnloadException(name, "onUnload of [" + name + "] timed out", e);
        } catch (Exception e) {
            throw new PluginUnloadException(name, "onUnload of [" + name + "] failed: " + e.getMessage(), e);
        }
    }

    @Override
    public Set<String> capabilities(PluginHandle handle) {
        return handle.getCapabilities();
    }

    @Override
    public void discard(PluginHandle handle) {
        handle.markUnloaded();
        handle.markRetired();
        handle.close();
        log.debug("[{}] Discarded handle of version {}", handle.getPluginName(), handle.getVersion());
    }

    private Plugin instantiate(PluginArtifact artifact, ClassLoader classLoader) throws Exception {
        if (artifact.isEmbedded()) {
            return artifact.getFactory().get();
        }
        PluginDefinition definition = artifact.getDefinition();
        Class<?> mainClass = Class.forName(definition.getMainClass(), true, classLoader);
        if (!Plugin.class.isAssignableFrom(mainClass)) {
            throw new PluginLoadException(artifact.getName(),
                    "Main class " + mainClass.getName() + " does not implement " + Plugin.class.getName());
        }
        return (Plugin) mainClass.getDeclaredConstructor().newInstance();
    }

    private PluginLoadException asLoadException(String name, PluginArtifact artifact, Exception e) {
        if (e instanceof PluginLoadException) {
            return (PluginLoadException) e;
        }
        if (e instanceof TimeoutException) {
            return new PluginLoadException(name, "Loading [" + name + "] timed out: " + e.getMessage(), e);
        }
        String reason = e.getMessage() != null ? e.getMessage() : e.toString();
        return new PluginLoadException(name,
                "Failed to load [" + name + "] version " + artifact.getVersion() + ": " + reason, e);
    }

    private void closeQuietly(String name, ClassLoader classLoader) {
        if (classLoader instanceof AutoCloseable) {
            try {
                ((AutoCloseable) classLoader).close();
            } catch (Exception e) {
                log.warn("[{}] Failed to close class loader after load failure", name, e);
            }
        }
    }
}
