package net.schedra.core.model;

/** once 시각을 (재시작 등으로) 유예 구간 밖에서 처음 보았을 때의 처리 */
public enum OnceMissedPolicy {
    /** 발화하지 않고 만족 처리 */
    SKIP,
    /** 늦게라도 한 번 발화 */
    RUN_LATE
}
