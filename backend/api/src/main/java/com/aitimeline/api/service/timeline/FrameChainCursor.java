package com.aitimeline.api.service.timeline;

/**
 * 순차 생성 중 직전 세그먼트의 마지막 프레임을 들고 다닌다.
 */
public class FrameChainCursor {

    private String lastFrameUrl;

    public String lastFrameUrl() {
        return lastFrameUrl;
    }

    public void advance(String lastFrameUrl) {
        this.lastFrameUrl = lastFrameUrl;
    }
}
