package com.example.jobscheduler.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

@Configuration
public class HttpClientConfig {

    /**
     * 派发用 RestTemplate，必须带超时，避免一个挂起的协作服务拖死派发池。
     */
    @Bean("jobRestTemplate")
    public RestTemplate jobRestTemplate(RestTemplateBuilder builder, SchedulerProperties props) {
        return builder
                .setConnectTimeout(props.getDispatch().getConnectTimeout())
                .setReadTimeout(props.getDispatch().getReadTimeout())
                .build();
    }

    @Bean
    public Clock schedulerClock() {
        return Clock.systemUTC();
    }
}
