package com.aitimeline.api.service.storage;

import com.aitimeline.api.config.S3Config;
import com.aitimeline.common.exception.ApiException;
import com.aitimeline.common.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetUrlRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

/**
 * AWS S3 기반 파일 저장소 서비스
 * 프레임 이미지는 provider 가 직접 읽어야 하므로 공개 URL 로 노출한다.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "aws.s3.enabled", havingValue = "true")
public class S3StorageService implements StorageService {

    private final S3Client s3Client;
    private final S3Config s3Config;

    public S3StorageService(S3Client s3Client, S3Config s3Config) {
        this.s3Client = s3Client;
        this.s3Config = s3Config;
        log.info("S3StorageService initialized - bucket: {}, region: {}",
                s3Config.getBucket(), s3Config.getRegion());
    }

    @Override
    public String upload(String key, byte[] data, String contentType) {
        try {
            PutObjectRequest request = PutObjectRequest.builder()
                    .bucket(s3Config.getBucket())
                    .key(key)
                    .contentType(contentType)
                    .build();

            s3Client.putObject(request, RequestBody.fromBytes(data));

            log.info("File uploaded to S3: {}/{} (size: {} bytes)", s3Config.getBucket(), key, data.length);
            return key;
        } catch (S3Exception e) {
            log.error("Failed to upload file to S3: {}", key, e);
            throw new ApiException(ErrorCode.STORAGE_FAILED, "S3 upload failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String getPublicUrl(String key) {
        String publicBaseUrl = s3Config.getPublicBaseUrl();
        if (publicBaseUrl != null && !publicBaseUrl.isBlank()) {
            return publicBaseUrl.endsWith("/") ? publicBaseUrl + key : publicBaseUrl + "/" + key;
        }
        GetUrlRequest request = GetUrlRequest.builder()
                .bucket(s3Config.getBucket())
                .key(key)
                .build();
        return s3Client.utilities().getUrl(request).toExternalForm();
    }

    @Override
    public void delete(String key) {
        try {
            DeleteObjectRequest request = DeleteObjectRequest.builder()
                    .bucket(s3Config.getBucket())
                    .key(key)
                    .build();

            s3Client.deleteObject(request);
            log.info("File deleted from S3: {}", key);
        } catch (S3Exception e) {
            log.error("Failed to delete file from S3: {}", key, e);
            throw new ApiException(ErrorCode.STORAGE_FAILED, "S3 delete failed: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean isEnabled() {
        return true;
    }
}
