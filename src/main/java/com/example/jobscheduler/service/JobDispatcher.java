package com.example.jobscheduler.service;

import com.example.jobscheduler.config.ServiceDirectory;
import com.example.jobscheduler.domain.*;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.*;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.Optional;

/**
 * 一次作业执行：开单 → POST 到协作服务 → 收尾回写。
 * 网络/超时/非 2xx/响应体错误都转成 FAILED 记录 + ExecutionOutcome，不向上抛；
 * 只有台账本身写不进去才抛 ExecutionLedgerException。
 */
@Slf4j
@Service
public class JobDispatcher {

    public static final String EXECUTION_ID_HEADER = "X-Scheduler-Execution-Id";

    private final JobRegistry registry;
    private final ExecutionLedger ledger;
    private final ServiceDirectory services;
    private final RestTemplate restTemplate;
    private final ObjectMapper mapper;
    private final IdentityResolver identityResolver;
    private final Clock clock;

    public JobDispatcher(JobRegistry registry,
                         ExecutionLedger ledger,
                         ServiceDirectory services,
                         @Qualifier("jobRestTemplate") RestTemplate restTemplate,
                         ObjectMapper mapper,
                         IdentityResolver identityResolver,
                         Clock clock) {
        this.registry = registry;
        this.ledger = ledger;
        this.services = services;
        this.restTemplate = restTemplate;
        this.mapper = mapper;
        this.identityResolver = identityResolver;
        this.clock = clock;
    }

    public ExecutionOutcome execute(String jobName, TriggerSource triggeredBy, String triggeredByUser) {
        JobDefinition job = registry.require(jobName);
        TriggerSource source = triggeredBy == null ? TriggerSource.SCHEDULER : triggeredBy;
        String internalUser = source == TriggerSource.SCHEDULER ? null : resolveUser(triggeredByUser);

        JobExecution record = openRecord(job, source, internalUser);
        String executionId = record.getId();
        log.info("Start job execution: job={}, service={}, endpoint={}, executionId={}, triggeredBy={}",
                job.getName(), job.getService(), job.getEndpoint(), executionId, source.wireName());

        JobResult result = null;
        String error;
        try {
            result = post(job, executionId, source, internalUser);
            error = null;
        } catch (HttpStatusCodeException ex) {
            error = "HTTP " + ex.getRawStatusCode() + ": " + ex.getStatusText();
        } catch (ResourceAccessException ex) {
            // 连接失败 / 读超时
            error = "Request failed: " + ex.getMessage();
        } catch (RestClientException | UnknownServiceException ex) {
            error = ex.getMessage();
        } catch (JsonProcessingException ex) {
            error = "Malformed job result: " + ex.getOriginalMessage();
        } catch (NonSuccessStatusException ex) {
            error = ex.getMessage();
        } catch (RuntimeException ex) {
            // 开单之后的任何异常都必须落成 FAILED
            log.error("Unexpected dispatch error: job={}, executionId={}", job.getName(), executionId, ex);
            error = "Dispatch error: " + ex;
        }

        if (error != null) {
            return finishFailed(job, record, source, trimErr(error));
        }
        return finishCompleted(job, record, source, result);
    }

    /**
     * 派发池拒绝时直接记一条 FAILED，不在调用线程上执行派发。
     */
    public ExecutionOutcome recordRejected(String jobName, TriggerSource triggeredBy, String reason) {
        JobDefinition job = registry.require(jobName);
        TriggerSource source = triggeredBy == null ? TriggerSource.SCHEDULER : triggeredBy;
        JobExecution record = openRecord(job, source, null);
        return finishFailed(job, record, source, trimErr(reason));
    }

    private JobResult post(JobDefinition job, String executionId, TriggerSource source, String internalUser)
            throws JsonProcessingException, NonSuccessStatusException {
        // endpoint 按字面路径处理，不做 URI 模板展开
        URI url = UriComponentsBuilder.fromHttpUrl(services.resolve(job.getService(), job.getEndpoint()))
                .build()
                .encode()
                .toUri();

        JobContext context = JobContext.builder()
                .jobName(job.getName())
                .config(job.getConfig() == null ? Collections.emptyMap() : job.getConfig())
                .executionId(executionId)
                .triggeredBy(source)
                .triggeredByUser(internalUser)
                .build();

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(Collections.singletonList(MediaType.APPLICATION_JSON));
        headers.set(EXECUTION_ID_HEADER, executionId);

        log.debug("Calling {} for job={}", url, job.getName());
        ResponseEntity<String> response = restTemplate.exchange(
                url, HttpMethod.POST, new HttpEntity<>(context, headers), String.class);

        int code = response.getStatusCodeValue();
        if (code < 200 || code > 299) {
            throw new NonSuccessStatusException("HTTP " + code);
        }
        String body = response.getBody();
        if (!StringUtils.hasText(body)) {
            throw new NonSuccessStatusException("Malformed job result: empty response body");
        }
        JobResult parsed = mapper.readValue(body, JobResult.class);
        if (parsed == null) {
            throw new NonSuccessStatusException("Malformed job result: null response body");
        }
        return parsed;
    }

    private ExecutionOutcome finishCompleted(JobDefinition job, JobExecution record, TriggerSource source, JobResult result) {
        JobResult normalized = result.toBuilder()
                .itemsProcessed(result.processedOrZero())
                .itemsSucceeded(result.succeededOrZero())
                .itemsFailed(result.failedOrZero())
                .build();

        Optional<JobExecution> done = finishRecord(record, () -> ledger.complete(record.getId(), normalized));
        long duration = done.map(JobExecution::getDurationMs).orElseGet(() -> elapsed(record));

        log.info("Job completed: job={}, executionId={}, duration={}ms, processed={}, succeeded={}, failed={}",
                job.getName(), record.getId(), duration,
                normalized.getItemsProcessed(), normalized.getItemsSucceeded(), normalized.getItemsFailed());
        if (!normalized.isSuccess()) {
            log.warn("Job {} reported success=false, executionId={}, error={}",
                    job.getName(), record.getId(), normalized.getError());
        }

        return ExecutionOutcome.builder()
                .executionId(record.getId())
                .jobName(job.getName())
                .triggeredBy(source)
                .status(ExecutionStatus.COMPLETED)
                .durationMs(duration)
                .result(normalized)
                .build();
    }

    private ExecutionOutcome finishFailed(JobDefinition job, JobExecution record, TriggerSource source, String error) {
        Optional<JobExecution> done = finishRecord(record, () -> ledger.fail(record.getId(), error));
        long duration = done.map(JobExecution::getDurationMs).orElseGet(() -> elapsed(record));

        log.error("Job failed: job={}, executionId={}, duration={}ms, error={}",
                job.getName(), record.getId(), duration, error);

        return ExecutionOutcome.builder()
                .executionId(record.getId())
                .jobName(job.getName())
                .triggeredBy(source)
                .status(ExecutionStatus.FAILED)
                .durationMs(duration)
                .result(JobResult.failure(error))
                .build();
    }

    /**
     * 身份解析失败只记 WARN，执行照常进行（triggeredByUser = null）。
     */
    private String resolveUser(String externalUserId) {
        if (!StringUtils.hasText(externalUserId)) return null;
        try {
            Optional<String> id = identityResolver.resolveInternalId(externalUserId);
            if (!id.isPresent()) {
                log.warn("Could not resolve user id {}", externalUserId);
            }
            return id.orElse(null);
        } catch (RuntimeException e) {
            log.warn("Error resolving user id {}: {}", externalUserId, e.toString());
            return null;
        }
    }

    private JobExecution openRecord(JobDefinition job, TriggerSource source, String user) {
        try {
            return ledger.open(job, source, user);
        } catch (RuntimeException e) {
            log.error("Failed to create execution record for job={}", job.getName(), e);
            throw new ExecutionLedgerException("Failed to create execution record for job " + job.getName(), e);
        }
    }

    private Optional<JobExecution> finishRecord(JobExecution record, LedgerWrite write) {
        try {
            return write.run();
        } catch (RuntimeException e) {
            log.error("Failed to update execution record id={}, job={}", record.getId(), record.getJobName(), e);
            throw new ExecutionLedgerException("Failed to update execution record " + record.getId(), e);
        }
    }

    private long elapsed(JobExecution record) {
        return Math.max(0L, Duration.between(record.getStartedAt(), clock.instant()).toMillis());
    }

    private static String trimErr(String m) {
        if (m == null) return "Unknown error";
        m = m.replaceAll("\\s+", " ").trim();
        return m.length() > 1900 ? m.substring(0, 1900) : m;
    }

    @FunctionalInterface
    private interface LedgerWrite {
        Optional<JobExecution> run();
    }

    private static final class NonSuccessStatusException extends Exception {
        NonSuccessStatusException(String message) {
            super(message);
        }
    }
}
