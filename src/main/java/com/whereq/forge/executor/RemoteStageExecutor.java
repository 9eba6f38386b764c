package com.whereq.forge.executor;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stage executor that delegates to an HTTP generation service.
 * <p>
 * The service receives the job input, the stage parameters and all prior stage data,
 * and answers with a JSON object that becomes the stage data. HTTP errors surface as
 * {@code WebClientResponseException} and are classified by status code.
 */
@Slf4j
public class RemoteStageExecutor implements StageExecutor {

    private static final ParameterizedTypeReference<Map<String, Object>> RESPONSE_TYPE =
        new ParameterizedTypeReference<>() {
        };

    private final String executorKey;
    private final String endpoint;
    private final WebClient webClient;
    private final Duration timeout;

    public RemoteStageExecutor(String executorKey, String endpoint, WebClient webClient, Duration timeout) {
        this.executorKey = executorKey;
        this.endpoint = endpoint;
        this.webClient = webClient;
        this.timeout = timeout;
    }

    @Override
    public StageResult execute(StageContext context) {
        log.info("Calling {} at {} for stage {} (attempt {})",
            executorKey, endpoint, context.getStageName(), context.getAttempt());

        Map<String, Object> response = webClient.post()
            .uri(endpoint)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(buildPayload(context))
            .retrieve()
            .bodyToMono(RESPONSE_TYPE)
            .timeout(timeout)
            .block();

        Map<String, Object> data = response != null ? new LinkedHashMap<>(response) : new LinkedHashMap<>();
        return StageResult.builder()
            .data(data)
            .outputRef(outputRefOf(data))
            .build();
    }

    private Map<String, Object> buildPayload(StageContext context) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("jobId", context.getJobId());
        payload.put("jobType", context.getJobType());
        payload.put("stage", context.getStageName());
        payload.put("attempt", context.getAttempt());
        payload.put("input", context.getInput());
        payload.put("params", context.getParams());
        payload.put("previousStages", context.getPriorStageData());
        return payload;
    }

    private static String outputRefOf(Map<String, Object> data) {
        Object ref = data.containsKey("outputRef") ? data.get("outputRef") : data.get("output_ref");
        return ref != null ? ref.toString() : null;
    }
}
