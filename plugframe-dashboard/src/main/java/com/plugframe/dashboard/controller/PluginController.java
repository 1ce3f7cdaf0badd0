package com.plugframe.dashboard.controller;

import com.plugframe.api.exception.ErrorKind;
import com.plugframe.api.exception.InvalidArgumentException;
import com.plugframe.api.exception.PlugFrameException;
import com.plugframe.core.lifecycle.ReloadResult;
import com.plugframe.core.plugin.PluginManager;
import com.plugframe.core.registry.PluginRecord;
import com.plugframe.dashboard.converter.PluginInfoConverter;
import com.plugframe.dashboard.dto.ApiResponse;
import com.plugframe.dashboard.dto.PluginInfoDTO;
import com.plugframe.dashboard.dto.PluginListDTO;
import com.plugframe.dashboard.dto.ReloadResultDTO;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.File;
import java.io.IOException;
import java.nio.file.Paths;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 插件管理接口
 * <p>
 * 所有响应都是 {@link ApiResponse}；失败时 HTTP 状态码由错误类型决定。
 */
@Slf4j
@RestController
@RequestMapping("/plugframe/plugins")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class PluginController {

    private final PluginManager pluginManager;

    private final PluginInfoConverter converter;

    @GetMapping
    public ResponseEntity<ApiResponse<PluginListDTO>> listPlugins(
            @RequestParam(required = false) Integer offset,
            @RequestParam(required = false) Integer limit) {
        try {
            List<PluginRecord> all = pluginManager.list();
            List<PluginRecord> page = offset == null && limit == null
                    ? all
                    : pluginManager.list(offset != null ? offset : 0, limit != null ? limit : Integer.MAX_VALUE);
            PluginListDTO body = PluginListDTO.builder()
                    .plugins(page.stream().map(converter::toDTO).collect(Collectors.toList()))
                    .total(all.size())
                    .build();
            return ResponseEntity.ok(ApiResponse.ok(body));
        } catch (Exception e) {
            return failure("list plugins", null, e);
        }
    }

    @GetMapping("/{name}")
    public ResponseEntity<ApiResponse<PluginInfoDTO>> getPlugin(@PathVariable String name) {
        try {
            return ResponseEntity.ok(ApiResponse.ok(converter.toDTO(pluginManager.get(name))));
        } catch (Exception e) {
            return failure("get plugin", name, e);
        }
    }

    /**
     * 按名称和版本从制品来源安装，version 为空时安装最新版本
     */
    @PostMapping("/install")
    public ResponseEntity<ApiResponse<PluginInfoDTO>> install(@RequestBody PluginInstallRequest request) {
        String name = request != null ? request.getName() : null;
        try {
            if (name == null || name.trim().isEmpty()) {
                throw new InvalidArgumentException("name", "Plugin name must not be blank");
            }
            PluginRecord record = pluginManager.install(name, request.getVersion());
            return ResponseEntity.ok(ApiResponse.ok("安装成功", converter.toDTO(record)));
        } catch (Exception e) {
            return failure("install", name, e);
        }
    }

    /**
     * 上传 JAR 包到插件目录并安装
     */
    @PostMapping("/install/upload")
    public ResponseEntity<ApiResponse<PluginInfoDTO>> upload(@RequestParam("file") MultipartFile file) {
        try {
            if (file.isEmpty()) {
                throw new InvalidArgumentException("file", "文件为空");
            }
            String originalFilename = file.getOriginalFilename();
            if (originalFilename == null || !originalFilename.endsWith(".jar")) {
                throw new InvalidArgumentException("file", "文件必须是 JAR 包");
            }

            // 只保留文件名，防止路径穿越
            String fileName = Paths.get(originalFilename).getFileName().toString();
            File pluginDir = new File(pluginManager.getConfig().getPluginHome());
            if (!pluginDir.exists() && !pluginDir.mkdirs()) {
                throw new IOException("Cannot create plugin home: " + pluginDir.getAbsolutePath());
            }
            File targetFile = new File(pluginDir, fileName);
            file.transferTo(targetFile.getAbsoluteFile());
            log.info("Saved uploaded plugin to {}", targetFile.getAbsolutePath());

            PluginRecord record = pluginManager.install(targetFile);
            return ResponseEntity.ok(ApiResponse.ok("安装成功", converter.toDTO(record)));
        } catch (Exception e) {
            return failure("upload", file.getOriginalFilename(), e);
        }
    }

    /**
     * 热重载到指定版本，version 为空时重载到最新版本
     * <p>
     * 回滚成功属于软失败：返回 400，data 中是回滚后的插件信息
     */
    @PostMapping("/{name}/reload")
    public ResponseEntity<ApiResponse<ReloadResultDTO>> reload(
            @PathVariable String name,
            @RequestBody(required = false) PluginReloadRequest request) {
        try {
            pluginManager.get(name);
            ReloadResult result = pluginManager.reload(name, request != null ? request.getVersion() : null);
            ReloadResultDTO body = converter.toDTO(result);
            if (result.isSucceeded()) {
                return ResponseEntity.ok(ApiResponse.ok("重载成功", body));
            }
            String reason = result.getCause() != null ? result.getCause().getMessage() : result.getErrorKind().name();
            log.warn("[{}] Reload to {} rolled back: {}", name, result.getAttemptedVersion(), reason);
            return ResponseEntity.status(statusOf(result.getErrorKind()))
                    .body(ApiResponse.error(result.getErrorKind(), "重载失败，已回滚: " + reason, body));
        } catch (Exception e) {
            return failure("reload", name, e);
        }
    }

    @DeleteMapping("/{name}")
    public ResponseEntity<ApiResponse<PluginInfoDTO>> uninstall(@PathVariable String name) {
        try {
            PluginRecord removed = pluginManager.uninstall(name);
            return ResponseEntity.ok(ApiResponse.ok("卸载成功", converter.toDTO(removed)));
        } catch (Exception e) {
            return failure("uninstall", name, e);
        }
    }

    private <T> ResponseEntity<ApiResponse<T>> failure(String action, String name, Exception e) {
        if (e instanceof PlugFrameException) {
            ErrorKind kind = ((PlugFrameException) e).getKind();
            if (kind.isFatal()) {
                log.error("[{}] {} failed: {}", name, action, e.getMessage(), e);
            } else {
                log.warn("[{}] {} failed: {}", name, action, e.getMessage());
            }
            return ResponseEntity.status(statusOf(kind)).body(ApiResponse.error(kind, e.getMessage()));
        }
        log.error("[{}] {} failed", name, action, e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error(null, action + " failed: " + e.getMessage()));
    }

    static HttpStatus statusOf(ErrorKind kind) {
        switch (kind) {
            case NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case DUPLICATE_NAME:
            case DEPENDENCY_VIOLATION:
            case BUSY:
            case INVALID_STATE:
            case CANCELLED:
                return HttpStatus.CONFLICT;
            case CYCLE_DETECTED:
            case MISSING_DEPENDENCY:
            case LOAD_FAILURE:
            case UNLOAD_FAILURE:
            case INVALID_ARGUMENT:
            case INVALID_CONFIG:
                return HttpStatus.BAD_REQUEST;
            case UNAVAILABLE:
                return HttpStatus.SERVICE_UNAVAILABLE;
            case ROLLBACK_FAILURE:
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }

    @Data
    public static class PluginInstallRequest {
        private String name;
        private String version;
    }

    @Data
    public static class PluginReloadRequest {
        private String version;
    }
}
