package com.example.jobscheduler.config;

import com.example.jobscheduler.service.UnknownServiceException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ServiceDirectoryTest {

    private static ServiceDirectory directory(String name, String url) {
        SchedulerProperties props = new SchedulerProperties();
        props.getServices().put(name, url);
        return new ServiceDirectory(props);
    }

    @Test
    void resolvesEndpointAgainstBaseUrl() {
        ServiceDirectory dir = directory("user-service", "http://user-service:8080//");

        assertThat(dir.resolve("user-service", "/api/jobs/process-deletions"))
                .isEqualTo("http://user-service:8080/api/jobs/process-deletions");
        assertThat(dir.resolve("user-service", "api/jobs/run"))
                .isEqualTo("http://user-service:8080/api/jobs/run");
        assertThat(dir.contains("user-service")).isTrue();
    }

    @Test
    void unconfiguredServiceFailsInsteadOfGuessing() {
        ServiceDirectory dir = directory("user-service", "http://user-service:8080");

        assertThat(dir.contains("email-service")).isFalse();
        assertThatThrownBy(() -> dir.baseUrl("email-service"))
                .isInstanceOf(UnknownServiceException.class)
                .hasMessageContaining("email-service");
    }

    @Test
    void relativeBaseUrlIsRejectedAtStartup() {
        assertThatThrownBy(() -> directory("user-service", "user-service:8080"))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> directory("user-service", " "))
                .isInstanceOf(IllegalStateException.class);
    }
}
