package com.tsc.payment.gateway;

import java.math.BigDecimal;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tsc.config.SslCommerzProperties;

import lombok.extern.slf4j.Slf4j;

/**
 * SSLCommerz hosted checkout.
 *
 * Session API: form POST, JSON answer with {@code status=SUCCESS} and {@code GatewayPageURL}.
 * Validation API: GET with {@code val_id}, JSON answer with {@code status} VALID or VALIDATED.
 */
@Component
@Slf4j
public class SslCommerzGateway implements PaymentGateway {

    private static final String STATUS_SUCCESS = "SUCCESS";
    private static final String STATUS_VALID = "VALID";
    private static final String STATUS_VALIDATED = "VALIDATED";

    private final SslCommerzProperties properties;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    public SslCommerzGateway(SslCommerzProperties properties,
                             @Qualifier("gatewayRestTemplate") RestTemplate restTemplate,
                             ObjectMapper objectMapper) {
        this.properties = properties;
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public String providerId() {
        return "sslcommerz";
    }

    @Override
    public GatewayInitiation initiate(GatewayPaymentRequest request) {
        log.info("Initiating SSLCommerz session for transaction: {} amount: {} {}",
                request.getTransactionId(), request.getAmount(), request.getCurrency());

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        HttpEntity<MultiValueMap<String, String>> entity = new HttpEntity<>(buildSessionForm(request), headers);

        String body;
        try {
            ResponseEntity<String> response = restTemplate.postForEntity(properties.resolveApiUrl(), entity, String.class);
            body = response.getBody();
        } catch (RestClientException e) {
            log.error("SSLCommerz session request failed for transaction {}: {}", request.getTransactionId(), e.getMessage(), e);
            return GatewayInitiation.failure("Connection error: " + e.getMessage(), null);
        }

        JsonNode json = parse(body);
        if (json == null) {
            log.error("SSLCommerz returned an unreadable session response for transaction {}", request.getTransactionId());
            return GatewayInitiation.failure("Unreadable gateway response", body);
        }

        String status = json.path("status").asText("");
        String gatewayUrl = json.path("GatewayPageURL").asText("");
        if (STATUS_SUCCESS.equalsIgnoreCase(status) && !gatewayUrl.isBlank()) {
            log.info("SSLCommerz session opened for transaction: {}", request.getTransactionId());
            return GatewayInitiation.success(gatewayUrl, body);
        }

        String reason = json.path("failedreason").asText("Payment initiation failed");
        log.warn("SSLCommerz rejected session for transaction {}: {}", request.getTransactionId(), reason);
        return GatewayInitiation.failure(reason, body);
    }

    @Override
    public GatewayValidation validate(String validationId, String transactionId) {
        if (validationId == null || validationId.isBlank()) {
            log.warn("Missing val_id for transaction {}", transactionId);
            return GatewayValidation.invalid("Missing validation id", null);
        }

        String url = UriComponentsBuilder.fromHttpUrl(properties.resolveValidationUrl())
                .queryParam("val_id", validationId)
                .queryParam("store_id", properties.getStoreId())
                .queryParam("store_passwd", properties.getStorePassword())
                .queryParam("format", "json")
                .encode()
                .toUriString();

        String body;
        try {
            ResponseEntity<String> response = restTemplate.getForEntity(url, String.class);
            body = response.getBody();
        } catch (RestClientException e) {
            log.error("SSLCommerz validation request failed for transaction {}: {}", transactionId, e.getMessage(), e);
            return GatewayValidation.invalid("Connection error: " + e.getMessage(), null);
        }

        JsonNode json = parse(body);
        if (json == null) {
            log.error("SSLCommerz returned an unreadable validation response for transaction {}", transactionId);
            return GatewayValidation.invalid("Unreadable gateway response", body);
        }

        String status = json.path("status").asText("");
        if (!STATUS_VALID.equalsIgnoreCase(status) && !STATUS_VALIDATED.equalsIgnoreCase(status)) {
            log.warn("SSLCommerz validation returned status '{}' for transaction {}", status, transactionId);
            return GatewayValidation.invalid("Payment validation failed", body);
        }

        String validatedTransactionId = json.path("tran_id").asText(null);
        if (validatedTransactionId != null && !validatedTransactionId.equals(transactionId)) {
            log.warn("SSLCommerz validation for val_id {} belongs to transaction {}, not {}",
                    validationId, validatedTransactionId, transactionId);
            return GatewayValidation.invalid("Validation does not match transaction", body);
        }

        return GatewayValidation.valid(transactionId, parseAmount(json.path("amount").asText(null)),
                json.path("currency_type").asText(null), body);
    }

    private MultiValueMap<String, String> buildSessionForm(GatewayPaymentRequest request) {
        GatewayCustomer customer = request.getCustomer();
        CallbackUrls urls = request.getCallbackUrls();

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("store_id", properties.getStoreId());
        form.add("store_passwd", properties.getStorePassword());

        form.add("total_amount", request.getAmount().toPlainString());
        form.add("currency", request.getCurrency());
        form.add("tran_id", request.getTransactionId());

        form.add("success_url", urls.getSuccessUrl());
        form.add("fail_url", urls.getFailUrl());
        form.add("cancel_url", urls.getCancelUrl());

        form.add("cus_name", customer.getName());
        form.add("cus_email", customer.getEmail());
        form.add("cus_add1", customer.getAddress() != null ? customer.getAddress() : "");
        form.add("cus_city", "Dhaka");
        form.add("cus_country", "Bangladesh");
        form.add("cus_phone", customer.getPhone());

        form.add("product_name", request.getProductName());
        form.add("product_category", "Workshop Registration");
        form.add("product_profile", "general");

        // Required by the API even though nothing is shipped
        form.add("shipping_method", "NO");
        form.add("num_of_item", "1");

        form.add("value_a", request.getRegistrationNumber());
        if (request.getWorkshopId() != null) {
            form.add("value_b", String.valueOf(request.getWorkshopId()));
        }
        return form;
    }

    private JsonNode parse(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.warn("Could not parse SSLCommerz response: {}", e.getOriginalMessage());
            return null;
        }
    }

    private BigDecimal parseAmount(String amount) {
        if (amount == null || amount.isBlank()) {
            return null;
        }
        try {
            return new BigDecimal(amount.trim());
        } catch (NumberFormatException e) {
            log.warn("SSLCommerz reported a non-numeric amount: {}", amount);
            return null;
        }
    }
}
