package com.tsquery.api.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.tsquery.backend.integral.IntegralSpec;
import com.tsquery.backend.query.Executor;

/**
 * 由 {@code tsquery.integral.*} 属性装配算子配置与执行器。
 */
@Configuration
@EnableConfigurationProperties(IntegralProperties.class)
public class EngineConfiguration {

    private static final Logger LOGGER = LoggerFactory.getLogger(EngineConfiguration.class);

    @Bean
    public IntegralSpec integralSpec(IntegralProperties properties) {
        IntegralSpec spec = properties.toSpec();
        spec.validate();
        LOGGER.info("Integral configured: {}", spec);
        return spec;
    }

    @Bean
    public Executor integralExecutor(IntegralSpec integralSpec, IntegralProperties properties) {
        return new Executor(integralSpec, properties.getMaxGroups());
    }
}
