package com.aitimeline.api.service.timeline;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 진행 중인 타임라인 생성의 취소 토큰
 * 취소는 협조적이다: 현재 세그먼트가 끝난 뒤 다음 세그먼트를 시작하지 않는다.
 */
@Slf4j
@Component
public class GenerationCancellationRegistry {

    private final Map<Long, CancellationToken> tokens = new ConcurrentHashMap<>();

    public CancellationToken register(Long timelineId) {
        CancellationToken token = new CancellationToken();
        tokens.put(timelineId, token);
        return token;
    }

    /**
     * @return 진행 중인 생성이 있어 취소 요청이 전달되었으면 true
     */
    public boolean cancel(Long timelineId) {
        CancellationToken token = tokens.get(timelineId);
        if (token == null) {
            return false;
        }
        token.cancel();
        log.info("[Cancel] timeline {} cancellation requested", timelineId);
        return true;
    }

    public void release(Long timelineId, CancellationToken token) {
        tokens.remove(timelineId, token);
    }

    public boolean isRunning(Long timelineId) {
        return tokens.containsKey(timelineId);
    }

    public static class CancellationToken {

        private final AtomicBoolean cancelled = new AtomicBoolean(false);

        public void cancel() {
            cancelled.set(true);
        }

        public boolean isCancelled() {
            return cancelled.get();
        }
    }
}
