package com.example.billingautomation.service.invoice;

import com.example.billingautomation.client.ClientModels.Invoice;
import com.example.billingautomation.client.ClientModels.Lease;
import com.example.billingautomation.client.PropertyApiClient;
import com.example.billingautomation.domain.enums.InvoiceStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Produces rent invoices and tracks their overdue state on the property management API.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InvoiceGenerationService {

    private static final DateTimeFormatter INVOICE_NUMBER_FORMAT = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    private final PropertyApiClient propertyApiClient;
    private final InvoiceExportService invoiceExportService;
    private final Clock clock;

    /**
     * Create this month's invoice for every active lease and export the batch.
     * A lease whose invoice cannot be created is logged and skipped.
     *
     * @return invoices that were stored
     * @throws com.example.billingautomation.exception.ExternalServiceException if leases cannot be fetched
     */
    public List<Invoice> generateMonthlyInvoices() {
        var leases = propertyApiClient.getActiveLeases();
        var now = LocalDateTime.now(clock);
        var stamp = now.format(INVOICE_NUMBER_FORMAT);
        var invoices = new ArrayList<Invoice>();

        for (var i = 0; i < leases.size(); i++) {
            var lease = leases.get(i);
            try {
                var draft = buildInvoice(lease, now.toLocalDate(), String.format("INV-%s-%03d", stamp, i + 1));
                var saved = propertyApiClient.createInvoice(draft);
                invoices.add(saved != null ? saved : draft);
            } catch (Exception e) {
                log.error("Failed to generate invoice for tenant {}: {}", lease.getTenantId(), e.getMessage());
            }
        }

        log.info("Generated {} invoices for {} active leases", invoices.size(), leases.size());

        if (!invoices.isEmpty()) {
            invoiceExportService.exportMonthlyBatch(invoices);
        }
        return invoices;
    }

    /**
     * Mark pending invoices past their due date as overdue.
     *
     * @return invoices newly marked overdue, followed by those that already were
     */
    public List<Invoice> processOverdueInvoices() {
        var today = LocalDate.now(clock);
        var overdue = new ArrayList<Invoice>();

        for (var invoice : propertyApiClient.getInvoicesByStatus(InvoiceStatus.PENDING)) {
            if (invoice.getDueDate() == null || !invoice.getDueDate().isBefore(today)) {
                continue;
            }
            try {
                propertyApiClient.updateInvoiceStatus(invoice.getId(), InvoiceStatus.OVERDUE);
                invoice.setStatus(InvoiceStatus.OVERDUE);
                overdue.add(invoice);
            } catch (Exception e) {
                log.error("Failed to mark invoice {} overdue: {}", invoice.getId(), e.getMessage());
            }
        }
        var newlyOverdue = overdue.size();
        var seen = overdue.stream().map(Invoice::getId).collect(Collectors.toSet());

        // the overdue listing already contains the invoices marked above
        propertyApiClient.getInvoicesByStatus(InvoiceStatus.OVERDUE).stream()
                .filter(invoice -> invoice.getDueDate() != null)
                .filter(invoice -> seen.add(invoice.getId()))
                .forEach(overdue::add);

        log.info("{} invoices newly overdue, {} overdue in total", newlyOverdue, overdue.size());
        return overdue;
    }

    public List<Invoice> getPendingInvoices() {
        return propertyApiClient.getInvoicesByStatus(InvoiceStatus.PENDING);
    }

    Invoice buildInvoice(Lease lease, LocalDate today, String invoiceNumber) {
        var monthName = today.getMonth().getDisplayName(TextStyle.FULL, Locale.ENGLISH);

        return Invoice.builder()
                .invoiceNumber(invoiceNumber)
                .tenantId(lease.getTenantId())
                .tenantName(lease.getTenantName())
                .propertyId(lease.getPropertyId())
                .propertyAddress(lease.getPropertyAddress())
                .amount(lease.getMonthlyRent())
                .dueDate(today.plusMonths(1).withDayOfMonth(1))
                .issueDate(today)
                .status(InvoiceStatus.PENDING)
                .description(String.format("Monthly rent for %s %d", monthName, today.getYear()))
                .month(monthName)
                .year(today.getYear())
                .build();
    }
}
