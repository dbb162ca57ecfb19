package com.flagship.mobile_payments.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * HTTP client for the mobile-money gateway.
 *
 * Push: POST {base}{stk-path} with {phone, amount, callback_url, reference}.
 * The gateway answers 200 in three shapes:
 * <ul>
 *   <li>message "callback received successfully" with data: already paid</li>
 *   <li>data.CheckoutRequestID: prompt sent, outcome follows later</li>
 *   <li>anything else: not sent, message carries the reason</li>
 * </ul>
 * Status: GET {base}{status-path} with the remote checkout id.
 * <p>
 * 5xx, 408, 429 and I/O failures are {@link GatewayUnavailableException}; any
 * other 4xx or an unreadable body is {@link GatewayRejectedException}.
 */
@Component
@Slf4j
public class HttpMobileMoneyGateway implements MobileMoneyGateway {

    static final String INSTANT_SUCCESS_MESSAGE = "callback received successfully";

    private static final List<String> REMOTE_ID_FIELDS = List.of("CheckoutRequestID", "checkout_request_id", "checkoutRequestId");
    private static final List<String> REFERENCE_FIELDS = List.of("reference", "refference", "MpesaReceiptNumber");
    private static final List<String> OUTCOME_FIELDS = List.of("status", "outcome", "ResultStatus");
    private static final List<String> MESSAGE_FIELDS = List.of("message", "reason", "ResultDesc");

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String apiKey;
    private final String callbackUrl;
    private final String stkPath;
    private final String statusPath;

    public HttpMobileMoneyGateway(@Qualifier("gatewayRestTemplate") RestTemplate restTemplate,
                                  ObjectMapper objectMapper,
                                  @Value("${gateway.base-url}") String baseUrl,
                                  @Value("${gateway.api-key:}") String apiKey,
                                  @Value("${gateway.callback-url}") String callbackUrl,
                                  @Value("${gateway.stk-path:/request/stk}") String stkPath,
                                  @Value("${gateway.status-path:/request/status/{remoteCheckoutId}}") String statusPath) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.apiKey = apiKey;
        this.callbackUrl = callbackUrl;
        this.stkPath = stkPath;
        this.statusPath = statusPath;
    }

    @Override
    public GatewayAcknowledgement initiatePush(PushRequest request) {
        ObjectNode body = objectMapper.createObjectNode();
        if (request.getMsisdn() != null) {
            body.put("phone", request.getMsisdn());
        }
        body.put("amount", new BigDecimal(request.getAmount().stripTrailingZeros().toPlainString()));
        body.put("callback_url", callbackUrl);
        body.put("reference", request.getCheckoutId());

        log.info("Sending push request for checkoutId={}", request.getCheckoutId());

        String responseBody = exchange(baseUrl + stkPath, HttpMethod.POST, new HttpEntity<>(body, headers()));
        JsonNode root = parse(responseBody, "push acknowledgement");

        String message = firstText(root, MESSAGE_FIELDS);
        JsonNode data = root.path("data");

        if (INSTANT_SUCCESS_MESSAGE.equalsIgnoreCase(message == null ? "" : message.trim())
                && data.isObject() && !data.isEmpty()) {
            return GatewayAcknowledgement.completed(
                    firstText(data, REMOTE_ID_FIELDS), firstText(data, REFERENCE_FIELDS), message);
        }

        String remoteCheckoutId = data.isObject() ? firstText(data, REMOTE_ID_FIELDS) : null;
        if (remoteCheckoutId == null) {
            remoteCheckoutId = firstText(root, REMOTE_ID_FIELDS);
        }
        if (remoteCheckoutId != null) {
            return GatewayAcknowledgement.accepted(remoteCheckoutId, message);
        }

        return GatewayAcknowledgement.failed(message != null ? message : "payment request was not accepted");
    }

    @Override
    public GatewayStatus queryStatus(String remoteCheckoutId) {
        String url = baseUrl + statusPath.replace("{remoteCheckoutId}", remoteCheckoutId);
        String responseBody = exchange(url, HttpMethod.GET, new HttpEntity<>(headers()));
        JsonNode root = parse(responseBody, "status response");

        JsonNode node = root.path("data").isObject() ? root.path("data") : root;
        GatewayOutcome outcome = readOutcome(node)
                .orElseThrow(() -> new GatewayRejectedException(
                        "Unrecognised status for remote checkout " + remoteCheckoutId));

        return new GatewayStatus(outcome, firstText(node, REFERENCE_FIELDS), firstText(node, MESSAGE_FIELDS));
    }

    private Optional<GatewayOutcome> readOutcome(JsonNode node) {
        JsonNode success = node.get("success");
        if (success != null && success.isBoolean()) {
            return Optional.of(success.asBoolean() ? GatewayOutcome.COMPLETED : GatewayOutcome.FAILED);
        }
        return GatewayOutcome.fromWire(firstText(node, OUTCOME_FIELDS));
    }

    private String exchange(String url, HttpMethod method, HttpEntity<?> entity) {
        try {
            ResponseEntity<String> response = restTemplate.exchange(url, method, entity, String.class);
            if (!response.getStatusCode().is2xxSuccessful()) {
                throw new GatewayRejectedException("Unexpected gateway status " + response.getStatusCode());
            }
            return response.getBody();
        } catch (HttpClientErrorException e) {
            if (isTransient(e.getStatusCode())) {
                log.warn("Gateway throttled or timed out {} {}: {}", method, url, e.getStatusCode());
                throw new GatewayUnavailableException("Gateway busy: " + e.getStatusCode(), e);
            }
            log.warn("Gateway rejected {} {}: {}", method, url, e.getStatusCode());
            throw new GatewayRejectedException("Gateway rejected request: " + e.getStatusCode(), e);
        } catch (HttpServerErrorException e) {
            log.warn("Gateway server error on {} {}: {}", method, url, e.getStatusCode());
            throw new GatewayUnavailableException("Gateway server error: " + e.getStatusCode(), e);
        } catch (ResourceAccessException e) {
            log.warn("Gateway unreachable on {} {}: {}", method, url, e.getMessage());
            throw new GatewayUnavailableException("Gateway unreachable: " + e.getMessage(), e);
        }
    }

    // 408 and 429 say "try again later", not "this request is wrong".
    private static boolean isTransient(HttpStatusCode status) {
        return status.value() == HttpStatus.REQUEST_TIMEOUT.value()
                || status.value() == HttpStatus.TOO_MANY_REQUESTS.value();
    }

    private JsonNode parse(String body, String what) {
        if (body == null || body.isBlank()) {
            throw new GatewayRejectedException("Empty " + what);
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            if (!root.isObject()) {
                throw new GatewayRejectedException("Malformed " + what + ": not a JSON object");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new GatewayRejectedException("Malformed " + what, e);
        }
    }

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (apiKey != null && !apiKey.isBlank()) {
            headers.setBearerAuth(apiKey);
        }
        return headers;
    }

    private static String firstText(JsonNode node, List<String> fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && !value.isNull() && value.isValueNode()) {
                String text = value.asText();
                if (!text.isBlank()) {
                    return text;
                }
            }
        }
        return null;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
