package net.schedra.app;

import net.schedra.core.model.JobResult;
import net.schedra.core.spi.JobFunction;
import net.schedra.core.spi.Returner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

/** 기본 제공 함수와 returner. 빈 이름이 잡 설정의 function/returner 이름이다. */
@Configuration(proxyBeanMethods = false)
public class BuiltinFunctions {
    private static final Logger log = LoggerFactory.getLogger(BuiltinFunctions.class);

    @Bean("test.ping")
    public JobFunction ping() {
        return (args, kwargs) -> true;
    }

    @Bean("test.echo")
    public JobFunction echo() {
        return (args, kwargs) -> {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("args", args);
            out.put("kwargs", kwargs);
            return out;
        };
    }

    @Bean("log")
    public Returner logReturner() {
        return (jobName, result) -> log.info("Job {} finished: {}", jobName, describe(result));
    }

    private static String describe(JobResult result) {
        return "success=" + result.success() + " retcode=" + result.retcode() + " return=" + result.returnValue();
    }
}
