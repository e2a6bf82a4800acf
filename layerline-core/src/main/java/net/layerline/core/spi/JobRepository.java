package net.layerline.core.spi;

import net.layerline.core.model.Job;
import net.layerline.core.model.JobStatus;
import net.layerline.core.model.ResourceKey;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface JobRepository {

    /**
     * 조건부 생성: 같은 resourceKey 로 PENDING/PROCESSING 인 Job 이 없을 때만 INSERT.
     * 이미 있으면 기존 Job 을 created=false 로 반환한다.
     */
    CreateOutcome createIfNoActive(Job candidate) throws Exception;

    Optional<Job> findById(String id) throws Exception;

    Optional<Job> findActiveByResourceKey(ResourceKey key) throws Exception;

    /**
     * 낙관적 갱신: expectedVersion 이 일치하고 비종결 상태일 때만 반영.
     * 반영되면 true. 종결 Job 또는 경합에서 진 쓰기는 false (no-op).
     */
    boolean update(Job next, long expectedVersion) throws Exception;

    /**
     * (updatedAt, id) 가 (since, afterId) 보다 뒤인 행. (updatedAt, id) 오름차순 keyset 페이지.
     * afterId 가 빈 문자열이면 updatedAt == since 인 행도 모두 포함한다.
     */
    List<Job> findUpdatedAfter(Instant since, String afterId, int limit) throws Exception;

    /** 해당 상태에서 updatedAt < threshold 인 행 (updatedAt 오름차순) */
    List<Job> findByStatusOlderThan(JobStatus status, Instant threshold, int limit) throws Exception;

    record CreateOutcome(Job job, boolean created) {}
}
