package com.newsenricher.core.cache;

import com.newsenricher.core.error.CacheUnavailableException;
import com.newsenricher.core.model.CacheStats;
import com.newsenricher.core.model.ContentRecord;
import com.newsenricher.core.model.ResolutionRecord;

import java.util.List;
import java.util.Optional;

/**
 * 해석 결과/추출 결과 영속 캐시. 두 테이블의 유일한 쓰기 주체.
 * 저장소 접근 실패는 {@link CacheUnavailableException}으로 올라오며,
 * 호출 측은 읽기 실패를 캐시 미스로, 쓰기 실패를 로그 후 무시로 처리한다.
 */
public interface CacheStore extends AutoCloseable {

    /** success=true 인 기록만 반환. 실패 기록은 미스로 취급(재해석 유도) */
    Optional<ResolutionRecord> getResolution(String indirectUrl);

    /** attempts=1, resolved_at=now 로 upsert (마지막 쓰기가 이긴다) */
    void saveResolution(String indirectUrl, String directUrl, String method, boolean success);

    /** 성공 여부와 무관하게 조회 */
    Optional<ContentRecord> getContent(String url);

    /** content_hash를 content에서 계산해 cached_at=now 로 upsert */
    void saveContent(String url, ContentRecord data);

    /**
     * 기준일보다 오래된 두 테이블의 행 삭제.
     * @return 삭제한 행 수 합계
     */
    int cleanup(int olderThanDays);

    CacheStats stats();

    /** 성공한 해석 기록 전체(최신순). 중단된 실행의 결과 복구용 */
    List<ResolutionRecord> successfulResolutions();

    @Override default void close() {}

    /** 캐시 비활성 시 사용하는 항상-미스 구현 */
    static CacheStore none() { return NoOpCacheStore.INSTANCE; }
}
