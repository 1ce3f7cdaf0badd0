package com.plugframe.core.lifecycle;

import com.plugframe.api.exception.ErrorKind;
import com.plugframe.api.exception.PluginLoadException;
import com.plugframe.api.exception.PluginUnloadException;
import com.plugframe.api.exception.RollbackFailedException;
import com.plugframe.api.plugin.StateBlob;
import com.plugframe.core.config.PluginConfigStore;
import com.plugframe.core.enums.PluginStatus;
import com.plugframe.core.enums.ReloadPhase;
import com.plugframe.core.event.EventBus;
import com.plugframe.core.loader.HandleReaper;
import com.plugframe.core.loader.HandleTable;
import com.plugframe.core.loader.PluginArtifact;
import com.plugframe.core.loader.PluginHandle;
import com.plugframe.core.loader.PluginLoader;
import com.plugframe.core.persistence.InMemoryPersistenceBackend;
import com.plugframe.core.registry.DefaultPluginRegistry;
import com.plugframe.core.resolver.DependencyResolver;
import com.plugframe.core.testing.CounterPlugin;
import com.plugframe.core.testing.TestArtifacts;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.nio.file.Paths;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("LifecycleCoordinator 单元测试")
class LifecycleCoordinatorTest {

    @Mock
    private PluginLoader loader;

    private DefaultPluginRegistry registry;
    private HandleTable handles;
    private HandleReaper reaper;
    private PluginLockTable locks;
    private LifecycleCoordinator coordinator;

    private PluginArtifact v1;
    private PluginArtifact v2;
    private PluginHandle h1;
    private PluginHandle h2;

    @BeforeEach
    void setUp() {
        registry = new DefaultPluginRegistry(new InMemoryPersistenceBackend());
        handles = new HandleTable();
        reaper = new HandleReaper(60, 60);
        locks = new PluginLockTable(0);
        coordinator = new LifecycleCoordinator(registry, new DependencyResolver(registry), loader, handles,
                reaper, new EventBus(), locks, null, new PluginConfigStore(Paths.get("target", "no-plugin-config")));

        v1 = TestArtifacts.counter("a", "1.0");
        v2 = TestArtifacts.counter("a", "2.0");
        h1 = handle(v1, "increment");
        h2 = handle(v2, "increment");
        when(loader.capabilities(any())).thenAnswer(inv -> ((PluginHandle) inv.getArgument(0)).getCapabilities());
        when(loader.load(eq(v1), any())).thenReturn(h1);
        coordinator.install(v1);
    }

    @AfterEach
    void tearDown() {
        reaper.close();
    }

    private static PluginHandle handle(PluginArtifact artifact, String... capabilities) {
        return new PluginHandle(artifact, new CounterPlugin(), null, Set.of(capabilities));
    }

    @Nested
    @DisplayName("成功路径")
    class SuccessTests {

        @Test
        @DisplayName("卸载后锁表不再保留该插件的条目")
        void uninstallForgetsLock() {
            coordinator.uninstall("a");

            assertFalse(registry.contains("a"));
            assertEquals(0, locks.size());
            assertFalse(locks.isLocked("a"));
        }

        @Test
        @DisplayName("按 卸载 -> 加载 的顺序执行并提交")
        void reloadCommits() {
            StateBlob exported = StateBlob.ofUtf8(1, "exported");
            when(loader.unload(h1)).thenReturn(exported);
            when(loader.load(v2, exported)).thenReturn(h2);
            ReloadOperation operation = new ReloadOperation("a", "2.0");

            ReloadResult result = coordinator.reload("a", v2, operation);

            assertTrue(result.isSucceeded());
            assertEquals(ReloadPhase.COMMITTED, operation.getPhase());
            assertSame(h2, handles.current("a"));
            assertTrue(h1.isRetired());
            assertEquals(exported, registry.get("a").getStateBlob());
            assertEquals(0, registry.openSnapshotCount());
            InOrder order = inOrder(loader);
            order.verify(loader).unload(h1);
            order.verify(loader).load(v2, exported);
        }
    }

    @Nested
    @DisplayName("失败路径")
    class FailureTests {

        @Test
        @DisplayName("加载新版本期间依赖被移除：提交前复核失败并回滚")
        void dependencyRemovedBeforeCommit() {
            PluginArtifact c = TestArtifacts.counter("c", "1.0");
            when(loader.load(eq(c), any())).thenReturn(handle(c, "increment"));
            coordinator.install(c);
            PluginArtifact v2WithC = TestArtifacts.counter("a", "2.0", "c");
            PluginHandle h2WithC = handle(v2WithC, "increment");
            PluginHandle recovered = handle(v1, "increment");
            when(loader.unload(h1)).thenReturn(StateBlob.empty());
            when(loader.load(v2WithC, StateBlob.empty())).thenAnswer(inv -> {
                registry.remove("c");
                return h2WithC;
            });
            when(loader.load(v1, StateBlob.empty())).thenReturn(recovered);
            ReloadOperation operation = new ReloadOperation("a", "2.0");

            ReloadResult result = coordinator.reload("a", v2WithC, operation);

            assertTrue(result.isRolledBack());
            assertEquals(ErrorKind.LOAD_FAILURE, result.getErrorKind());
            assertEquals(ReloadPhase.ROLLED_BACK, operation.getPhase());
            verify(loader).discard(h2WithC);
            assertEquals("1.0", registry.get("a").getVersion());
            assertEquals(PluginStatus.ACTIVE, registry.get("a").getStatus());
            assertSame(recovered, handles.current("a"));
            assertEquals(0, registry.openSnapshotCount());
        }

        @Test
        @DisplayName("重复卸载属于编程错误：直接抛出，不回滚")
        void doubleUnloadPropagates() {
            when(loader.unload(h1)).thenThrow(new IllegalStateException("Handle already unloaded"));

            assertThrows(IllegalStateException.class, () -> coordinator.reload("a", v2));

            assertEquals(PluginStatus.ACTIVE, registry.get("a").getStatus());
            assertEquals(0, registry.openSnapshotCount());
            verify(loader, never()).load(eq(v2), any());
        }

        @Test
        @DisplayName("onUnload 失败后用原状态重新加载旧版本")
        void unloadFailureRollsBack() {
            PluginHandle recovered = handle(v1, "increment");
            when(loader.unload(h1)).thenThrow(new PluginUnloadException("a", "onUnload failed", null));
            when(loader.load(v1, StateBlob.empty())).thenReturn(recovered);
            ReloadOperation operation = new ReloadOperation("a", "2.0");

            ReloadResult result = coordinator.reload("a", v2, operation);

            assertTrue(result.isRolledBack());
            assertEquals(ErrorKind.UNLOAD_FAILURE, result.getErrorKind());
            assertEquals(ReloadPhase.ROLLED_BACK, operation.getPhase());
            assertSame(recovered, handles.current("a"));
            assertEquals("1.0", registry.get("a").getVersion());
            assertNull(registry.get("a").getPreviousVersionHandle());
        }

        @Test
        @DisplayName("能力不足时丢弃新句柄再回滚")
        void capabilityMismatchDiscardsNewHandle() {
            PluginArtifact dependent = TestArtifacts.requiring("b", "1.0", "a", "export");
            when(loader.load(argThatName("b"), any())).thenReturn(handle(dependent, "increment"));
            coordinator.install(dependent);
            PluginHandle recovered = handle(v1, "increment");
            when(loader.unload(h1)).thenReturn(StateBlob.empty());
            when(loader.load(v2, StateBlob.empty())).thenReturn(h2);
            when(loader.load(v1, StateBlob.empty())).thenReturn(recovered);

            ReloadResult result = coordinator.reload("a", v2);

            assertTrue(result.isRolledBack());
            assertEquals(ErrorKind.LOAD_FAILURE, result.getErrorKind());
            verify(loader).discard(h2);
            assertSame(recovered, handles.current("a"));
        }

        @Test
        @DisplayName("回滚失败：标记 FAILED，抛出致命异常")
        void rollbackFailure() {
            when(loader.unload(h1)).thenReturn(StateBlob.empty());
            when(loader.load(v2, StateBlob.empty())).thenThrow(new PluginLoadException("a", "new version broken"));
            when(loader.load(v1, StateBlob.empty())).thenThrow(new PluginLoadException("a", "old version gone"));
            ReloadOperation operation = new ReloadOperation("a", "2.0");

            RollbackFailedException e = assertThrows(RollbackFailedException.class,
                    () -> coordinator.reload("a", v2, operation));

            assertEquals("new version broken", e.getOriginalFailure().getMessage());
            assertEquals(ReloadPhase.FAILED, operation.getPhase());
            assertEquals(PluginStatus.FAILED, registry.get("a").getStatus());
            assertEquals("old version gone", registry.get("a").getFailureReason());
            assertNull(handles.current("a"));
            assertEquals(0, registry.openSnapshotCount());
            assertThrows(RollbackFailedException.class, operation::await);
        }
    }

    private static PluginArtifact argThatName(String name) {
        return argThat(artifact -> artifact != null && name.equals(artifact.getName()));
    }
}
