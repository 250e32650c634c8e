package com.herzen.irt.estimation;

import com.fasterxml.jackson.databind.JsonNode;
import com.herzen.irt.domain.ResponseModels.ResponseMatrix;
import com.herzen.irt.estimation.EstimationModels.FitReport;
import com.herzen.irt.estimation.EstimationModels.GoodnessOfFit;
import com.herzen.irt.estimation.EstimationModels.ItemCoefficients;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Client of the remote estimation service. The service fits the model and reports coefficient
 * tables and fit statistics; curves are evaluated locally by {@link LogisticFittedModel}.
 */
@Component
public class RemoteEstimationClient implements ModelEstimationClient {
    private static final Logger log = LoggerFactory.getLogger(RemoteEstimationClient.class);

    private final RestTemplate restTemplate;

    public RemoteEstimationClient(@Qualifier("estimationRestTemplate") RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    @Override
    public FittedModel fit(ResponseMatrix matrix, ModelType modelType, long seed, int iterationBudget) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("responses", matrix.rows());
        body.put("item_type", modelType.label());
        body.put("seed", seed);
        body.put("max_cycles", iterationBudget);

        JsonNode response;
        try {
            ResponseEntity<JsonNode> entity = restTemplate.postForEntity("/fit", body, JsonNode.class);
            response = entity.getBody();
        } catch (RestClientException e) {
            throw new EstimationException("Estimation service call failed: " + e.getMessage(), e);
        }

        if (response == null || response.isNull()) {
            throw new EstimationException("Estimation service returned an empty response");
        }
        if ("error".equals(response.path("status").asText())) {
            throw new EstimationException("Estimation service reported an error: " + response.path("error").asText("unknown error"));
        }
        return toModel(response, modelType, matrix.itemCount());
    }

    @Override
    public boolean isAvailable() {
        try {
            return restTemplate.getForEntity("/health", JsonNode.class).getStatusCode().is2xxSuccessful();
        } catch (RestClientException e) {
            log.warn("Estimation service health check failed: {}", e.getMessage());
            return false;
        }
    }

    private FittedModel toModel(JsonNode response, ModelType modelType, int itemCount) {
        JsonNode items = response.path("items");
        if (!items.isArray() || items.size() != itemCount) {
            throw new EstimationException("Estimation service returned " + (items.isArray() ? items.size() : 0)
                    + " item rows; expected " + itemCount);
        }

        List<ItemCoefficients> coefficients = table(items);
        JsonNode seNode = response.path("standard_errors");
        List<ItemCoefficients> standardErrors = seNode.isArray() ? table(seNode) : null;

        JsonNode fit = response.path("fit");
        GoodnessOfFit goodnessOfFit = fit.isObject()
                ? new GoodnessOfFit(number(fit.path("m2")), integer(fit.path("df")), number(fit.path("p")),
                number(fit.path("tli")), number(fit.path("rmsea")))
                : null;

        Double logLikelihood = number(response.path("log_likelihood"));
        Integer iterations = integer(response.path("iterations"));
        FitReport report = new FitReport(
                bool(response.path("converged")),
                iterations == null ? 0 : iterations,
                logLikelihood == null ? Double.NaN : logLikelihood,
                goodnessOfFit,
                number(response.path("reliability")),
                number(response.path("aic")),
                number(response.path("bic")));
        return new LogisticFittedModel(modelType, coefficients, standardErrors, report);
    }

    private List<ItemCoefficients> table(JsonNode rows) {
        List<ItemCoefficients> out = new ArrayList<>(rows.size());
        rows.forEach(row -> out.add(new ItemCoefficients(number(row.path("a")), number(row.path("b")), number(row.path("g")))));
        return out;
    }

    // the service serializes scalars from R and may wrap them as [value] or [[value]]
    private JsonNode unwrap(JsonNode node) {
        JsonNode current = node;
        while (current.isArray() && current.size() > 0) {
            current = current.get(0);
        }
        return current;
    }

    private Double number(JsonNode node) {
        JsonNode value = unwrap(node);
        if (value.isNumber()) return value.doubleValue();
        if (value.isTextual()) {
            String text = value.asText().trim();
            if (text.equalsIgnoreCase("NaN") || text.equalsIgnoreCase("NA") || text.isEmpty()) return null;
            if (text.matches("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?")) return Double.parseDouble(text);
        }
        return null;
    }

    private Integer integer(JsonNode node) {
        Double value = number(node);
        return value == null ? null : (int) Math.round(value);
    }

    private boolean bool(JsonNode node) {
        JsonNode value = unwrap(node);
        return value.isBoolean() ? value.booleanValue() : "true".equalsIgnoreCase(value.asText());
    }
}
