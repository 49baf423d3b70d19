package com.withretries.autoconfig;

import com.withretries.core.metric.RetryMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

import java.util.List;
import java.util.stream.Collectors;

@AutoConfiguration(afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass(MeterRegistry.class)
public class RetryCallMetricsAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public RetryMetrics retryMetrics(ObjectProvider<MeterRegistry> discovered) {
        List<MeterRegistry> registries = discovered.orderedStream().collect(Collectors.toList());
        // 只有一个注册表时直接使用
        if (registries.size() == 1) {
            return RetryMetrics.create(registries.get(0));
        }
        // 保底 Simple, 并合入业务接入的注册表
        CompositeMeterRegistry composite = new CompositeMeterRegistry();
        if (registries.isEmpty()) {
            composite.add(new SimpleMeterRegistry());
        }
        registries.forEach(composite::add);
        return RetryMetrics.create(composite);
    }
}
