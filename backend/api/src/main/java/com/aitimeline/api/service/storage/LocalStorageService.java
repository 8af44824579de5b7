package com.aitimeline.api.service.storage;

import com.aitimeline.common.exception.ApiException;
import com.aitimeline.common.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 로컬 파일 시스템 기반 저장소 서비스
 * S3가 비활성화되어 있을 때 사용 (개발 환경)
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "aws.s3.enabled", havingValue = "false", matchIfMissing = true)
public class LocalStorageService implements StorageService {

    private final Path rootPath;

    public LocalStorageService() {
        this(Paths.get(System.getProperty("java.io.tmpdir"), "aitimeline", "storage"));
    }

    LocalStorageService(Path rootPath) {
        this.rootPath = rootPath.toAbsolutePath().normalize();
        try {
            Files.createDirectories(rootPath);
            log.info("LocalStorageService initialized - path: {}", rootPath);
        } catch (IOException e) {
            log.error("Failed to create local storage directory", e);
        }
    }

    @Override
    public String upload(String key, byte[] data, String contentType) {
        try {
            Path filePath = getFilePath(key);
            Files.createDirectories(filePath.getParent());
            Files.write(filePath, data);
            log.info("File saved locally: {}", filePath);
            return key;
        } catch (IOException e) {
            log.error("Failed to save file locally: {}", key, e);
            throw new ApiException(ErrorCode.STORAGE_FAILED, "Local storage failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String getPublicUrl(String key) {
        return getFilePath(key).toUri().toString();
    }

    @Override
    public void delete(String key) {
        try {
            Files.deleteIfExists(getFilePath(key));
            log.info("File deleted locally: {}", key);
        } catch (IOException e) {
            log.error("Failed to delete local file: {}", key, e);
        }
    }

    @Override
    public boolean isEnabled() {
        return false;
    }

    private Path getFilePath(String key) {
        Path path = rootPath.resolve(key).normalize();
        if (!path.startsWith(rootPath)) {
            throw new SecurityException("Storage key escapes root: " + key);
        }
        return path;
    }
}
