package com.cred.freestyle.ordersaga.config;

import io.micrometer.cloudwatch2.CloudWatchMeterRegistry;
import io.micrometer.core.instrument.Clock;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.config.MeterFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.cloudwatch.CloudWatchAsyncClient;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Ships saga metrics to AWS CloudWatch.
 *
 * Only meters under the {@code ordersaga.} prefix leave the process; JVM and
 * client meters stay local. Every shipped meter is tagged with the application
 * name so both participants can share one namespace.
 *
 * Enabled with {@code ordersaga.metrics.cloudwatch.enabled=true}; otherwise
 * Spring Boot's default registry is used.
 *
 * @author Order Saga Team
 */
@Configuration
@ConditionalOnProperty(name = "ordersaga.metrics.cloudwatch.enabled", havingValue = "true")
public class CloudWatchConfig {

    private static final Logger logger = LoggerFactory.getLogger(CloudWatchConfig.class);

    static final String SAGA_METER_PREFIX = "ordersaga.";

    @Value("${cloud.aws.region:us-east-1}")
    private String awsRegion;

    @Value("${ordersaga.metrics.cloudwatch.namespace:OrderSaga}")
    private String namespace;

    @Value("${ordersaga.metrics.cloudwatch.batch-size:20}")
    private int batchSize;

    @Value("${ordersaga.metrics.cloudwatch.step:PT1M}")
    private Duration step;

    @Value("${spring.application.name:order-saga}")
    private String applicationName;

    @Bean(destroyMethod = "close")
    public CloudWatchAsyncClient cloudWatchAsyncClient() {
        return CloudWatchAsyncClient.builder()
                .region(Region.of(awsRegion))
                .credentialsProvider(DefaultCredentialsProvider.create())
                .build();
    }

    /**
     * CloudWatch registry restricted to saga meters.
     *
     * @param cloudWatchAsyncClient CloudWatch client
     * @return MeterRegistry
     */
    @Bean
    public MeterRegistry meterRegistry(CloudWatchAsyncClient cloudWatchAsyncClient) {
        Map<String, String> settings = new HashMap<>();
        settings.put("cloudwatch.namespace", namespace);
        settings.put("cloudwatch.batchSize", String.valueOf(batchSize));
        settings.put("cloudwatch.step", step.toString());

        io.micrometer.cloudwatch2.CloudWatchConfig cloudWatchConfig = settings::get;

        CloudWatchMeterRegistry registry =
                new CloudWatchMeterRegistry(cloudWatchConfig, Clock.SYSTEM, cloudWatchAsyncClient);
        registry.config()
                .commonTags("application", applicationName)
                .meterFilter(MeterFilter.acceptNameStartsWith(SAGA_METER_PREFIX))
                .meterFilter(MeterFilter.deny());

        logger.info("CloudWatch metrics enabled: namespace {}, region {}, step {}", namespace, awsRegion, step);
        return registry;
    }
}
