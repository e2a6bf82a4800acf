package net.layerline.core.model;

/** submit 결과: 캐시 적중 또는 (신규/진행 중) Job id */
public sealed interface Submission permits Submission.Cached, Submission.Accepted {

    record Cached(ArtifactRef artifact) implements Submission {}

    /** attached=true 이면 이미 진행 중인 Job 에 합류한 것. 새 제출이 아니라 구독 대상 */
    record Accepted(String jobId, boolean attached) implements Submission {}
}
