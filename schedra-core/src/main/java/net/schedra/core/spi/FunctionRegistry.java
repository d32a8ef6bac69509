package net.schedra.core.spi;

import java.util.Map;
import java.util.TreeMap;

/** 함수 이름 → 호출 대상 해석 (플러그인 로더 경계) */
public interface FunctionRegistry {
    JobFunction resolve(String name) throws FunctionNotFoundException;

    boolean contains(String name);

    static FunctionRegistry of(Map<String, ? extends JobFunction> functions) {
        var copy = new TreeMap<String, JobFunction>(functions);
        return new FunctionRegistry() {
            @Override
            public JobFunction resolve(String name) throws FunctionNotFoundException {
                JobFunction fn = name == null ? null : copy.get(name);
                if (fn == null) throw new FunctionNotFoundException(name);
                return fn;
            }

            @Override
            public boolean contains(String name) { return name != null && copy.containsKey(name); }
        };
    }
}
