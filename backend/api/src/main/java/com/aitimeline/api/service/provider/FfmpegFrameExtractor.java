package com.aitimeline.api.service.provider;

import com.aitimeline.api.service.storage.StorageKeys;
import com.aitimeline.api.service.storage.StorageService;
import com.aitimeline.api.util.CommandRunner;
import com.aitimeline.common.exception.ApiException;
import com.aitimeline.common.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeoutException;
import java.util.stream.Stream;

/**
 * FFmpeg 프레임 추출
 * 첫 프레임: -frames:v 1, 마지막 프레임: -sseof -1 -update 1
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FfmpegFrameExtractor implements FrameExtractor {

    private static final String JPEG = "image/jpeg";

    private final StorageService storageService;

    @Value("${frame-extraction.ffmpeg-path:ffmpeg}")
    private String ffmpegPath;

    @Value("${frame-extraction.work-dir:${java.io.tmpdir}/aitimeline/frames}")
    private String workDir;

    @Value("${frame-extraction.timeout-seconds:120}")
    private long timeoutSeconds;

    @Override
    public ExtractedFrames extract(String videoUrl, Long userId, Long timelineId, Long segmentId) {
        Path dir = Paths.get(workDir, segmentId + "_" + UUID.randomUUID());
        try {
            Files.createDirectories(dir);
            Path first = dir.resolve("first.jpg");
            Path last = dir.resolve("last.jpg");

            Duration timeout = Duration.ofSeconds(timeoutSeconds);
            CommandRunner.run(List.of(
                    ffmpegPath, "-y", "-i", videoUrl,
                    "-frames:v", "1", "-q:v", "2", first.toString()
            ), dir.resolve("first.log"), "FirstFrame-" + segmentId, timeout);

            CommandRunner.run(List.of(
                    ffmpegPath, "-y", "-sseof", "-1", "-i", videoUrl,
                    "-update", "1", "-q:v", "2", last.toString()
            ), dir.resolve("last.log"), "LastFrame-" + segmentId, timeout);

            String firstKey = storageService.upload(
                    StorageKeys.firstFrame(userId, timelineId, segmentId), Files.readAllBytes(first), JPEG);
            String lastKey = storageService.upload(
                    StorageKeys.lastFrame(userId, timelineId, segmentId), Files.readAllBytes(last), JPEG);

            ExtractedFrames frames = new ExtractedFrames(
                    storageService.getPublicUrl(firstKey), storageService.getPublicUrl(lastKey));
            log.info("[Frame] segment {} frames extracted - last: {}", segmentId, frames.lastFrameUrl());
            return frames;

        } catch (IOException e) {
            log.error("[Frame] segment {} extraction failed: {}", segmentId, e.getMessage());
            throw new ApiException(ErrorCode.FRAME_EXTRACTION_FAILED,
                    "프레임 추출 실패: " + e.getMessage(), e);
        } catch (TimeoutException e) {
            log.error("[Frame] segment {} extraction timed out", segmentId);
            throw new ApiException(ErrorCode.FRAME_EXTRACTION_FAILED, "프레임 추출 시간 초과", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ApiException(ErrorCode.FRAME_EXTRACTION_FAILED, "프레임 추출이 중단되었습니다", e);
        } finally {
            cleanup(dir);
        }
    }

    private void cleanup(Path dir) {
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    log.warn("[Frame] Failed to delete temp file: {}", path);
                }
            });
        } catch (IOException e) {
            log.warn("[Frame] Failed to clean work dir {}: {}", dir, e.getMessage());
        }
    }
}
