package net.schedra.integration.spring;

import net.schedra.core.spi.Clock;
import net.schedra.core.spi.FunctionRegistry;
import net.schedra.core.spi.JobFunction;
import net.schedra.core.spi.Returner;
import net.schedra.core.spi.ReturnerRegistry;
import net.schedra.core.store.JobStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

/**
 * 컨텍스트의 빈을 코어 경계로 연결한다.
 * {@link JobFunction}/{@link Returner} 빈은 빈 이름(예: {@code "test.ping"})으로 등록된다.
 */
@Configuration
public class SchedraSpringConfig {
    private static final Logger log = LoggerFactory.getLogger(SchedraSpringConfig.class);

    @Bean public Clock systemClock() { return Clock.system(); }

    @Bean public JobStateStore jobStateStore() { return new JobStateStore(); }

    @Bean
    public FunctionRegistry functionRegistry(ListableBeanFactory beans) {
        Map<String, JobFunction> functions = beans.getBeansOfType(JobFunction.class);
        log.info("Registered job functions: {}", functions.keySet());
        return FunctionRegistry.of(functions);
    }

    @Bean
    public ReturnerRegistry returnerRegistry(ListableBeanFactory beans) {
        Map<String, Returner> returners = beans.getBeansOfType(Returner.class);
        if (!returners.isEmpty()) log.info("Registered returners: {}", returners.keySet());
        return ReturnerRegistry.of(returners);
    }
}
