package com.aitimeline.api.service.storage;

/**
 * 파일 저장소 서비스 인터페이스
 * S3 또는 로컬 파일 시스템을 추상화
 */
public interface StorageService {

    /**
     * 파일 업로드
     * @param key 저장 키 (StorageKeys 참고)
     * @param data 파일 데이터
     * @param contentType MIME 타입
     * @return 저장된 키
     */
    String upload(String key, byte[] data, String contentType);

    /**
     * 외부 provider 가 접근할 수 있는 URL
     * 프레임 체이닝 시 다음 세그먼트의 image_url 로 전달된다.
     */
    String getPublicUrl(String key);

    /**
     * 파일 삭제
     */
    void delete(String key);

    /**
     * S3가 활성화되어 있는지 확인
     */
    boolean isEnabled();
}
