package com.example.billingautomation.service.notification;

import com.example.billingautomation.client.ClientModels.Invoice;
import com.example.billingautomation.client.ClientModels.NotificationRequest;
import com.example.billingautomation.client.PropertyApiClient;
import com.example.billingautomation.config.BillingAutomationProperties;
import com.example.billingautomation.config.MetricsConfig;
import com.example.billingautomation.service.alert.SlackAlertService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.text.NumberFormat;
import java.util.Currency;
import java.util.Locale;

/**
 * Delivers billing notifications as in-app notifications on the property management API.
 * <p>
 * Tenant-facing sends throw on failure so the calling sweep can count and skip
 * that tenant. Manager-facing broadcasts isolate each manager and report how
 * many were reached.
 */
@Slf4j
@Service
public class NotificationService {

    static final String MANAGER_SUMMARY_TITLE = "Automated Invoice System";

    private final PropertyApiClient propertyApiClient;
    private final ManagerDirectoryService managerDirectoryService;
    private final SlackAlertService slackAlertService;
    private final MetricsConfig metricsConfig;
    private final Locale locale;
    private final Currency currency;

    public NotificationService(PropertyApiClient propertyApiClient,
                               ManagerDirectoryService managerDirectoryService,
                               SlackAlertService slackAlertService,
                               MetricsConfig metricsConfig,
                               BillingAutomationProperties properties) {
        this.propertyApiClient = propertyApiClient;
        this.managerDirectoryService = managerDirectoryService;
        this.slackAlertService = slackAlertService;
        this.metricsConfig = metricsConfig;
        this.locale = Locale.forLanguageTag(properties.getLocale());
        this.currency = Currency.getInstance(properties.getCurrency());
    }

    /**
     * Remind a tenant that rent is due
     */
    public void sendRentReminder(Invoice invoice) {
        var message = String.format("Hi %s! Your rent of %s is due on %s",
                invoice.getTenantName(), formatAmount(invoice.getAmount()), invoice.getDueDate());

        deliver("rent-reminder", invoice.getTenantId(), "Rent Reminder", message);
    }

    /**
     * Tell a tenant their payment is overdue
     */
    public void sendOverdueAlert(Invoice invoice, long daysPastDue) {
        var message = String.format("%s is %d days overdue. Amount: %s",
                invoice.getTenantName(), daysPastDue, formatAmount(invoice.getAmount()));

        deliver("overdue-alert", invoice.getTenantId(), "Overdue Payment Alert", message);
    }

    /**
     * Escalate to every manager and to the on-call Slack channel.
     *
     * @throws RuntimeException if no manager could be reached
     */
    public void sendEscalation(String title, String message) {
        slackAlertService.sendEscalationAlert(title, message);

        var reached = broadcastToManagers("escalation", "Escalation Alert", title + ": " + message);
        if (reached == 0) {
            throw new IllegalStateException("Escalation \"" + title + "\" reached no manager");
        }
    }

    /**
     * Send a system notification to every manager. Never throws.
     *
     * @return number of managers notified
     */
    public int notifyManagers(String message) {
        try {
            return broadcastToManagers("system", MANAGER_SUMMARY_TITLE, message);
        } catch (Exception e) {
            log.error("Failed to notify managers: {}", e.getMessage(), e);
            return 0;
        }
    }

    private int broadcastToManagers(String type, String title, String message) {
        var managers = managerDirectoryService.listManagers();
        var reached = 0;

        for (var manager : managers) {
            try {
                deliver(type, manager.getId(), title, message);
                reached++;
            } catch (Exception e) {
                log.error("Failed to notify manager {}: {}", manager.getId(), e.getMessage());
            }
        }

        log.debug("Notified {}/{} managers: {}", reached, managers.size(), title);
        return reached;
    }

    private void deliver(String type, String userId, String title, String message) {
        var request = NotificationRequest.builder()
                .userId(userId)
                .title(title)
                .message(message)
                .type(type)
                .read(false)
                .build();

        try {
            propertyApiClient.createNotification(request);
            metricsConfig.recordNotification(type, true);
        } catch (RuntimeException e) {
            metricsConfig.recordNotification(type, false);
            throw e;
        }
    }

    public String formatAmount(BigDecimal amount) {
        var format = NumberFormat.getCurrencyInstance(locale);
        format.setCurrency(currency);
        return format.format(amount != null ? amount : BigDecimal.ZERO);
    }
}
