package com.example.billingautomation.service.invoice;

import com.example.billingautomation.client.ClientModels.Invoice;
import com.example.billingautomation.config.BillingAutomationProperties;
import com.example.billingautomation.domain.enums.InvoiceStatus;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Writes a JSON copy of each generated invoice batch to the export directory.
 */
@Slf4j
@Service
public class InvoiceExportService {

    private final ObjectMapper objectMapper;
    private final BillingAutomationProperties properties;
    private final Clock clock;

    public InvoiceExportService(ObjectMapper objectMapper, BillingAutomationProperties properties, Clock clock) {
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Export a batch as {@code monthly-invoices-<date>.json}. Failures are logged and reported as empty.
     *
     * @return the written file, or empty when export is disabled or failed
     */
    public Optional<Path> exportMonthlyBatch(List<Invoice> invoices) {
        if (!properties.getExport().isEnabled()) {
            log.debug("Invoice export disabled, skipping {} invoices", invoices.size());
            return Optional.empty();
        }

        var today = LocalDate.now(clock);
        var file = Path.of(properties.getExport().getDirectory()).resolve("monthly-invoices-" + today + ".json");

        try {
            Files.createDirectories(file.getParent());
            objectMapper.writeValue(file.toFile(), buildExport(invoices));
            log.info("Invoices exported to JSON: {}", file);
            return Optional.of(file);
        } catch (IOException e) {
            log.error("Error exporting {} invoices to {}: {}", invoices.size(), file, e.getMessage(), e);
            return Optional.empty();
        }
    }

    InvoiceExport buildExport(List<Invoice> invoices) {
        var total = invoices.stream()
                .map(Invoice::getAmount)
                .filter(amount -> amount != null)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        return InvoiceExport.builder()
                .exportDate(Instant.now(clock))
                .totalInvoices(invoices.size())
                .summary(ExportSummary.builder()
                        .totalAmount(total)
                        .pendingCount(countByStatus(invoices, InvoiceStatus.PENDING))
                        .paidCount(countByStatus(invoices, InvoiceStatus.PAID))
                        .overdueCount(countByStatus(invoices, InvoiceStatus.OVERDUE))
                        .build())
                .invoices(invoices)
                .build();
    }

    private long countByStatus(List<Invoice> invoices, InvoiceStatus status) {
        return invoices.stream().filter(invoice -> invoice.getStatus() == status).count();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    static class InvoiceExport {
        @JsonProperty("export_date")
        private Instant exportDate;
        @JsonProperty("total_invoices")
        private int totalInvoices;
        private ExportSummary summary;
        private List<Invoice> invoices;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    static class ExportSummary {
        @JsonProperty("total_amount")
        private BigDecimal totalAmount;
        @JsonProperty("pending_count")
        private long pendingCount;
        @JsonProperty("paid_count")
        private long paidCount;
        @JsonProperty("overdue_count")
        private long overdueCount;
    }
}
