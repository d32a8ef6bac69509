package net.schedra.core.service;

/** 스케줄러 기반(start-up 복원 등)의 복구 불가 실패 */
public class SchedulerException extends RuntimeException {
    public SchedulerException(String message, Throwable cause) {
        super(message, cause);
    }
}
