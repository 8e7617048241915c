package com.example.billingautomation.client;

import com.example.billingautomation.client.ClientModels.Invoice;
import com.example.billingautomation.client.ClientModels.InvoiceStatusUpdate;
import com.example.billingautomation.client.ClientModels.Lease;
import com.example.billingautomation.client.ClientModels.NotificationRequest;
import com.example.billingautomation.client.ClientModels.UserAccount;
import com.example.billingautomation.domain.enums.InvoiceStatus;
import com.example.billingautomation.exception.ExternalServiceException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.function.Supplier;

/**
 * Client for the property management API (leases, invoices, users, notifications).
 * <p>
 * Uses:
 * - Resilience4j Circuit Breaker for fault tolerance
 * - Retry with exponential backoff on reads
 * - WebClient for HTTP calls, blocking at the edge since every caller runs on a worker thread
 */
@Slf4j
@Component
public class PropertyApiClient {

    private static final String SERVICE_NAME = "Property API";

    private final WebClient webClient;

    public PropertyApiClient(@Qualifier("propertyServiceWebClient") WebClient webClient) {
        this.webClient = webClient;
    }

    /**
     * Get all active leases
     *
     * @return active leases, never null
     * @throws ExternalServiceException if the API call fails
     */
    @CircuitBreaker(name = "propertyService")
    @Retry(name = "propertyService")
    public List<Lease> getActiveLeases() {
        log.debug("Fetching active leases");

        return call("fetch active leases", () -> webClient.get()
                .uri(uriBuilder -> uriBuilder.path("/api/leases").queryParam("status", "active").build())
                .retrieve()
                .onStatus(HttpStatusCode::isError, response ->
                        response.bodyToMono(String.class)
                                .flatMap(body -> Mono.error(
                                        new ExternalServiceException(SERVICE_NAME, response.statusCode().value(), body))))
                .bodyToFlux(Lease.class)
                .collectList()
                .timeout(Duration.ofSeconds(30))
                .block());
    }

    /**
     * Create an invoice
     *
     * @param invoice the invoice to store
     * @return the stored invoice, as returned by the API
     * @throws ExternalServiceException if the API call fails
     */
    @CircuitBreaker(name = "propertyService", fallbackMethod = "createInvoiceFallback")
    public Invoice createInvoice(Invoice invoice) {
        log.info("Creating invoice {} for tenant {}", invoice.getInvoiceNumber(), invoice.getTenantId());

        return call("create invoice " + invoice.getInvoiceNumber(), () -> webClient.post()
                .uri("/api/invoices")
                .bodyValue(invoice)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response ->
                        response.bodyToMono(String.class)
                                .flatMap(body -> Mono.error(
                                        new ExternalServiceException(SERVICE_NAME, response.statusCode().value(), body))))
                .bodyToMono(Invoice.class)
                .timeout(Duration.ofSeconds(30))
                .block());
    }

    /**
     * Fallback method when circuit breaker is open for invoice creation
     */
    @SuppressWarnings("unused")
    private Invoice createInvoiceFallback(Invoice invoice, Exception e) {
        log.warn("Circuit breaker open for Property API, invoice: {}, error: {}", invoice.getInvoiceNumber(), e.getMessage());
        throw new ExternalServiceException(SERVICE_NAME, "Service temporarily unavailable (circuit breaker open)", e);
    }

    /**
     * Get invoices in the given status
     */
    @CircuitBreaker(name = "propertyService")
    @Retry(name = "propertyService")
    public List<Invoice> getInvoicesByStatus(InvoiceStatus status) {
        log.debug("Fetching {} invoices", status.getCode());

        return call("fetch " + status.getCode() + " invoices", () -> webClient.get()
                .uri(uriBuilder -> uriBuilder.path("/api/invoices").queryParam("status", status.getCode()).build())
                .retrieve()
                .onStatus(HttpStatusCode::isError, response ->
                        response.bodyToMono(String.class)
                                .flatMap(body -> Mono.error(
                                        new ExternalServiceException(SERVICE_NAME, response.statusCode().value(), body))))
                .bodyToFlux(Invoice.class)
                .collectList()
                .timeout(Duration.ofSeconds(30))
                .block());
    }

    /**
     * Update the status of a single invoice
     */
    @CircuitBreaker(name = "propertyService")
    public void updateInvoiceStatus(String invoiceId, InvoiceStatus status) {
        log.debug("Updating invoice {} to {}", invoiceId, status.getCode());

        call("update invoice " + invoiceId, () -> webClient.patch()
                .uri("/api/invoices/{invoiceId}", invoiceId)
                .bodyValue(InvoiceStatusUpdate.builder().status(status).build())
                .retrieve()
                .onStatus(HttpStatusCode::isError, response ->
                        response.bodyToMono(String.class)
                                .flatMap(body -> Mono.error(
                                        new ExternalServiceException(SERVICE_NAME, response.statusCode().value(), body))))
                .toBodilessEntity()
                .timeout(Duration.ofSeconds(10))
                .block());
    }

    /**
     * Get all users with the given role
     */
    @CircuitBreaker(name = "propertyService")
    @Retry(name = "propertyService")
    public List<UserAccount> getUsersByRole(String role) {
        log.debug("Fetching users with role {}", role);

        return call("fetch users with role " + role, () -> webClient.get()
                .uri(uriBuilder -> uriBuilder.path("/api/users").queryParam("role", role).build())
                .retrieve()
                .onStatus(HttpStatusCode::isError, response ->
                        response.bodyToMono(String.class)
                                .flatMap(body -> Mono.error(
                                        new ExternalServiceException(SERVICE_NAME, response.statusCode().value(), body))))
                .bodyToFlux(UserAccount.class)
                .collectList()
                .timeout(Duration.ofSeconds(10))
                .block());
    }

    /**
     * Store an in-app notification for a user
     */
    @CircuitBreaker(name = "propertyService")
    public void createNotification(NotificationRequest request) {
        log.debug("Creating notification \"{}\" for user {}", request.getTitle(), request.getUserId());

        call("notify user " + request.getUserId(), () -> webClient.post()
                .uri("/api/notifications")
                .bodyValue(request)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response ->
                        response.bodyToMono(String.class)
                                .flatMap(body -> Mono.error(
                                        new ExternalServiceException(SERVICE_NAME, response.statusCode().value(), body))))
                .toBodilessEntity()
                .timeout(Duration.ofSeconds(10))
                .block());
    }

    private <T> T call(String operation, Supplier<T> request) {
        try {
            return request.get();
        } catch (ExternalServiceException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to {}: {}", operation, e.getMessage());
            throw new ExternalServiceException(SERVICE_NAME, e);
        }
    }
}
