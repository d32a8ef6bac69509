package net.schedra.core.spi;

import net.schedra.core.model.JobResult;

/** 잡 실행 결과를 외부로 내보내는 경계. 실패는 스케줄러로 전파되지 않는다. */
@FunctionalInterface
public interface Returner {
    void report(String jobName, JobResult result) throws Exception;
}
