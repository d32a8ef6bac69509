package net.schedra.core.service;

/**
 * 관리 명령 결과.
 *
 * @param data 목록/다음 실행 시각 등 조회 결과 (없으면 null)
 */
public record AdminResult(boolean result, String comment, Object data) {
    public static AdminResult ok(String comment) { return new AdminResult(true, comment, null); }
    public static AdminResult ok(String comment, Object data) { return new AdminResult(true, comment, data); }
    public static AdminResult fail(String comment) { return new AdminResult(false, comment, null); }
}
