package com.example.billingautomation.service.billing;

import com.example.billingautomation.client.ClientModels.Invoice;
import com.example.billingautomation.config.BillingAutomationProperties;
import com.example.billingautomation.domain.enums.AutomationTaskType;
import com.example.billingautomation.domain.model.AutomationConfig;
import com.example.billingautomation.domain.model.ScheduleExpression;
import com.example.billingautomation.domain.model.ScheduledTask;
import com.example.billingautomation.domain.model.TaskAction;
import com.example.billingautomation.dto.AutomationStatus;
import com.example.billingautomation.dto.TriggerResult;
import com.example.billingautomation.dto.UpdateAutomationConfigRequest;
import com.example.billingautomation.service.alert.SlackAlertService;
import com.example.billingautomation.service.invoice.InvoiceGenerationService;
import com.example.billingautomation.service.notification.NotificationService;
import com.example.billingautomation.service.scheduler.RecurringTaskScheduler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Coordinates the three billing tasks on top of the {@link RecurringTaskScheduler}.
 * <p>
 * Responsibilities:
 * - Registering monthly invoice generation and the daily overdue and reminder sweeps
 * - Holding the live {@link AutomationConfig} and keeping task activity in line with its master switch
 * - Running any of the three actions on demand
 * <p>
 * Every sweep isolates failures per tenant or invoice: one bad record is logged
 * and skipped, the rest of the batch still runs.
 */
@Slf4j
@Service
public class BillingAutomationService {

    private static final long DAY_MILLIS = Duration.ofDays(1).toMillis();

    private static final Set<String> BILLING_TASK_IDS = Arrays.stream(AutomationTaskType.values())
            .map(AutomationTaskType::getTaskId)
            .collect(Collectors.toUnmodifiableSet());

    static final String ESCALATION_TITLE = "Payment Overdue";

    private final RecurringTaskScheduler scheduler;
    private final InvoiceGenerationService invoiceGenerationService;
    private final NotificationService notificationService;
    private final SlackAlertService slackAlertService;
    private final Clock clock;

    private AutomationConfig config;

    public BillingAutomationService(RecurringTaskScheduler scheduler,
                                    InvoiceGenerationService invoiceGenerationService,
                                    NotificationService notificationService,
                                    SlackAlertService slackAlertService,
                                    Clock clock,
                                    BillingAutomationProperties properties) {
        this.scheduler = scheduler;
        this.invoiceGenerationService = invoiceGenerationService;
        this.notificationService = notificationService;
        this.slackAlertService = slackAlertService;
        this.clock = clock;
        this.config = defaultsFrom(properties);
    }

    /**
     * Register the three billing tasks with the scheduler, active when automation is enabled.
     * Calling it again replaces the registrations and keeps their last-run times.
     */
    public void initialize() {
        var enabled = getConfig().isEnabled();

        register(AutomationTaskType.INVOICES, ScheduleExpression.MONTHLY, enabled, this::runScheduledInvoiceGeneration);
        register(AutomationTaskType.OVERDUE, ScheduleExpression.DAILY, enabled, this::checkOverduePayments);
        register(AutomationTaskType.REMINDERS, ScheduleExpression.DAILY, enabled, this::sendPaymentReminders);

        log.info("Automated invoice system initialized (enabled: {})", enabled);
    }

    private void register(AutomationTaskType type, String schedule, boolean active, TaskAction action) {
        scheduler.addTask(ScheduledTask.builder()
                .id(type.getTaskId())
                .name(type.getDisplayName())
                .schedule(schedule)
                .active(active)
                .action(action)
                .build());
    }

    // === Actions ===

    /**
     * Scheduled entry point for invoice generation. Does nothing unless today is the configured generate day.
     */
    void runScheduledInvoiceGeneration() {
        var today = LocalDate.now(clock).getDayOfMonth();
        var generateDay = getConfig().getGenerateDay();

        if (today != generateDay) {
            log.debug("Today is day {}, invoices are generated on day {}", today, generateDay);
            return;
        }
        generateMonthlyInvoices();
    }

    /**
     * Generate this month's invoices, remind each tenant and send managers a summary.
     * A failure of the whole run is reported to managers and Slack rather than thrown.
     *
     * @return number of invoices created
     */
    public int generateMonthlyInvoices() {
        log.info("Starting automated monthly invoice generation...");

        try {
            var invoices = invoiceGenerationService.generateMonthlyInvoices();

            for (var invoice : invoices) {
                try {
                    notificationService.sendRentReminder(invoice);
                } catch (Exception e) {
                    log.error("Failed to send invoice notification to tenant {}: {}", invoice.getTenantId(), e.getMessage());
                }
            }

            notificationService.notifyManagers(
                    String.format("Monthly invoice generation completed. %d invoices created.", invoices.size()));

            log.info("Generated {} monthly invoices", invoices.size());
            return invoices.size();
        } catch (Exception e) {
            log.error("Error in monthly invoice generation: {}", e.getMessage(), e);

            notificationService.notifyManagers("Error in monthly invoice generation: " + e.getMessage());
            slackAlertService.sendErrorAlert("Monthly invoice generation failed", e.getMessage(), e.getClass().getSimpleName());
            return 0;
        }
    }

    /**
     * Mark overdue invoices, alert each tenant and escalate long-overdue accounts to managers.
     *
     * @return number of overdue invoices processed
     */
    public int checkOverduePayments() {
        log.info("Checking for overdue payments...");

        var escalationDays = getConfig().getManagerEscalationDays();
        var now = clock.instant();
        List<Invoice> overdue;
        try {
            overdue = invoiceGenerationService.processOverdueInvoices();
        } catch (Exception e) {
            log.error("Error checking overdue payments: {}", e.getMessage(), e);
            return 0;
        }
        var escalated = 0;

        for (var invoice : overdue) {
            var daysPastDue = daysPastDue(invoice, now);
            try {
                notificationService.sendOverdueAlert(invoice, daysPastDue);
            } catch (Exception e) {
                log.error("Failed to send overdue alert for invoice {}: {}", invoice.getInvoiceNumber(), e.getMessage());
            }

            if (daysPastDue < escalationDays) {
                continue;
            }
            try {
                notificationService.sendEscalation(ESCALATION_TITLE, String.format(
                        "ESCALATION: %s payment overdue by %d days. Amount: %s. Immediate action required.",
                        invoice.getTenantName(), daysPastDue, notificationService.formatAmount(invoice.getAmount())));
                escalated++;
            } catch (Exception e) {
                log.error("Failed to escalate overdue invoice {}: {}", invoice.getInvoiceNumber(), e.getMessage());
            }
        }

        log.info("Processed {} overdue invoices, {} escalated to managers", overdue.size(), escalated);
        return overdue.size();
    }

    /**
     * Remind tenants whose pending invoice falls due in one of the configured reminder offsets.
     *
     * @return number of reminders sent
     */
    public int sendPaymentReminders() {
        log.info("Sending payment reminders...");

        var reminderDays = getConfig().getReminderDaysBefore();
        var now = clock.instant();
        List<Invoice> pending;
        try {
            pending = invoiceGenerationService.getPendingInvoices();
        } catch (Exception e) {
            log.error("Error sending payment reminders: {}", e.getMessage(), e);
            return 0;
        }
        var sent = 0;

        for (var invoice : pending) {
            if (invoice.getDueDate() == null) {
                continue;
            }
            var daysUntilDue = daysUntilDue(invoice, now);
            if (!reminderDays.contains((int) daysUntilDue)) {
                continue;
            }
            try {
                notificationService.sendRentReminder(invoice);
                sent++;
                log.debug("Reminder sent to tenant {} ({} days before due)", invoice.getTenantId(), daysUntilDue);
            } catch (Exception e) {
                log.error("Failed to send reminder for invoice {}: {}", invoice.getInvoiceNumber(), e.getMessage());
            }
        }

        log.info("Sent {} payment reminders", sent);
        return sent;
    }

    long daysPastDue(Invoice invoice, Instant now) {
        return Math.floorDiv(now.toEpochMilli() - dueInstant(invoice), DAY_MILLIS);
    }

    long daysUntilDue(Invoice invoice, Instant now) {
        return -Math.floorDiv(now.toEpochMilli() - dueInstant(invoice), DAY_MILLIS);
    }

    private long dueInstant(Invoice invoice) {
        return invoice.getDueDate().atStartOfDay(clock.getZone()).toInstant().toEpochMilli();
    }

    // === Operator API ===

    /**
     * Merge the non-null fields into the live config. A change to {@code enabled}
     * activates or deactivates every billing task whose flag differs.
     *
     * @return the config after the update
     */
    public synchronized AutomationConfig updateConfig(UpdateAutomationConfigRequest request) {
        var updated = config.copy();

        if (request.getGenerateDay() != null) {
            updated.setGenerateDay(request.getGenerateDay());
        }
        if (request.getReminderDaysBefore() != null) {
            updated.setReminderDaysBefore(new LinkedHashSet<>(request.getReminderDaysBefore()));
        }
        if (request.getOverdueCheckDays() != null) {
            updated.setOverdueCheckDays(new LinkedHashSet<>(request.getOverdueCheckDays()));
        }
        if (request.getManagerEscalationDays() != null) {
            updated.setManagerEscalationDays(request.getManagerEscalationDays());
        }
        if (request.getEnabled() != null) {
            updated.setEnabled(request.getEnabled());
        }
        config = updated;

        if (request.getEnabled() != null) {
            syncTaskActivity(request.getEnabled());
        }

        log.info("Automation config updated: {}", updated);
        return updated.copy();
    }

    private void syncTaskActivity(boolean enabled) {
        for (var type : AutomationTaskType.values()) {
            scheduler.getTask(type.getTaskId())
                    .filter(task -> task.isActive() != enabled)
                    .ifPresent(task -> scheduler.toggleTask(task.getId()));
        }
    }

    public synchronized AutomationConfig getConfig() {
        return config.copy();
    }

    /**
     * Run one billing action now, outside the scheduler. Invoice generation skips the generate-day check.
     */
    public TriggerResult manualTrigger(AutomationTaskType type) {
        log.info("Manual trigger of {}", type.getDisplayName());

        var processed = switch (type) {
            case INVOICES -> generateMonthlyInvoices();
            case OVERDUE -> checkOverduePayments();
            case REMINDERS -> sendPaymentReminders();
        };

        return TriggerResult.builder()
                .type(type.getCode())
                .taskId(type.getTaskId())
                .processed(processed)
                .build();
    }

    public AutomationStatus getStatus() {
        var tasks = scheduler.getTasks().stream()
                .filter(task -> BILLING_TASK_IDS.contains(task.getId()))
                .map(task -> AutomationStatus.TaskSummary.builder()
                        .id(task.getId())
                        .name(task.getName())
                        .active(task.isActive())
                        .lastRun(task.getLastRun())
                        .build())
                .toList();

        return AutomationStatus.builder()
                .enabled(getConfig().isEnabled())
                .tasks(tasks)
                .build();
    }

    static AutomationConfig defaultsFrom(BillingAutomationProperties properties) {
        return AutomationConfig.builder()
                .enabled(properties.isEnabled())
                .generateDay(properties.getGenerateDay())
                .reminderDaysBefore(new LinkedHashSet<>(properties.getReminderDaysBefore()))
                .overdueCheckDays(new LinkedHashSet<>(properties.getOverdueCheckDays()))
                .managerEscalationDays(properties.getManagerEscalationDays())
                .build();
    }
}
