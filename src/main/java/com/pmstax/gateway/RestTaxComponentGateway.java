package com.pmstax.gateway;

import com.pmstax.domain.enums.ComponentKind;
import com.pmstax.domain.model.ComponentKey;
import com.pmstax.exception.ComponentValidationException;
import com.pmstax.exception.GatewayException;
import com.pmstax.mapper.JsonHelper;
import com.pmstax.revision.ComponentUpdateRequest;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Gateway backed by the payroll back end's taxation API.
 *
 * <pre>
 * GET {base}/taxation/component/{employeeId}/{taxYear}/{segment}
 * PUT {base}/taxation/{segment}
 * </pre>
 *
 * GET responses may wrap the record in {@code component_data}; both shapes are accepted.
 * A 4xx on PUT carries {@code detail} as a string or a list of {@code {msg}} objects and
 * becomes a {@link ComponentValidationException}; everything else is a {@link GatewayException}.
 */
public class RestTaxComponentGateway implements TaxComponentGateway {

    private static final Logger log = LoggerFactory.getLogger(RestTaxComponentGateway.class);

    private static final ParameterizedTypeReference<Map<String, Object>> MAP_TYPE =
            new ParameterizedTypeReference<>() {};

    private final RestTemplate restTemplate;
    private final String baseUrl;

    public RestTaxComponentGateway(RestTemplate restTemplate, String baseUrl) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    @Override
    @SuppressWarnings("unchecked")
    public Optional<Map<String, Object>> getComponent(ComponentKey key) {
        String url = baseUrl + "/taxation/component/{employeeId}/{taxYear}/{segment}";
        try {
            ResponseEntity<Map<String, Object>> response = restTemplate.exchange(
                    url,
                    HttpMethod.GET,
                    null,
                    MAP_TYPE,
                    key.getEmployeeId(),
                    key.getTaxYear().toString(),
                    key.getKind().getPathSegment());
            Map<String, Object> body = response.getBody();
            if (body == null) {
                return Optional.empty();
            }
            Object componentData = body.get("component_data");
            if (componentData instanceof Map<?, ?> data) {
                return Optional.of(new LinkedHashMap<>((Map<String, Object>) data));
            }
            return Optional.of(body);
        } catch (HttpClientErrorException e) {
            if (e.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
                log.info("No {} component stored for {}", key.getKind(), key);
                return Optional.empty();
            }
            log.warn("Loading {} failed with {}", key, e.getStatusCode());
            throw new GatewayException("Failed to load " + key.getKind().getLabel() + " data", e);
        } catch (RestClientException e) {
            log.error("Loading {} failed", key, e);
            throw new GatewayException("Failed to load " + key.getKind().getLabel() + " data", e);
        }
    }

    @Override
    public Map<String, Object> updateComponent(ComponentKind kind, ComponentUpdateRequest request) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<Map<String, Object>> entity = new HttpEntity<>(request.toBody(), headers);
        try {
            ResponseEntity<Map<String, Object>> response = restTemplate.exchange(
                    baseUrl + "/taxation/{segment}", HttpMethod.PUT, entity, MAP_TYPE, kind.getPathSegment());
            log.info(
                    "Saved {} for employee {} ({}, new revision: {})",
                    kind,
                    request.getEmployeeId(),
                    request.getTaxYear(),
                    request.isForceNewRevision());
            return response.getBody() != null ? response.getBody() : Map.of();
        } catch (HttpClientErrorException e) {
            List<String> messages = detailMessages(e.getResponseBodyAsString());
            log.warn("{} save rejected with {}: {}", kind, e.getStatusCode(), messages);
            throw new ComponentValidationException(messages.isEmpty() ? List.of(e.getStatusText()) : messages);
        } catch (RestClientException e) {
            log.error("{} save failed", kind, e);
            throw new GatewayException("Failed to save " + kind.getLabel() + " data", e);
        }
    }

    /** Extracts {@code detail} as a string, or the {@code msg} of each item of a detail list. */
    static List<String> detailMessages(String body) {
        List<String> messages = new ArrayList<>();
        Map<String, Object> parsed;
        try {
            parsed = JsonHelper.toMap(body);
        } catch (IllegalArgumentException e) {
            log.debug("Error body is not JSON: {}", body);
            return messages;
        }
        Object detail = parsed.get("detail");
        if (detail instanceof String text) {
            messages.add(text);
        } else if (detail instanceof List<?> items) {
            for (Object item : items) {
                if (item instanceof Map<?, ?> map && map.get("msg") != null) {
                    messages.add(String.valueOf(map.get("msg")));
                } else if (item != null) {
                    messages.add(String.valueOf(item));
                }
            }
        }
        return messages;
    }
}
