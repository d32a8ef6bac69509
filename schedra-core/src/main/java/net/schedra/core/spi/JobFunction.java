package net.schedra.core.spi;

import java.util.List;
import java.util.Map;

/** 잡이 호출하는 실행 모듈 함수 (module.function 이름으로 등록) */
@FunctionalInterface
public interface JobFunction {
    Object invoke(List<Object> args, Map<String, Object> kwargs) throws Exception;
}
