package com.example.billingautomation.service.billing;

import com.example.billingautomation.client.ClientModels.Invoice;
import com.example.billingautomation.config.BillingAutomationProperties;
import com.example.billingautomation.domain.enums.AutomationTaskType;
import com.example.billingautomation.domain.enums.InvoiceStatus;
import com.example.billingautomation.domain.model.ScheduledTask;
import com.example.billingautomation.dto.UpdateAutomationConfigRequest;
import com.example.billingautomation.exception.ExternalServiceException;
import com.example.billingautomation.service.alert.SlackAlertService;
import com.example.billingautomation.service.invoice.InvoiceGenerationService;
import com.example.billingautomation.service.notification.NotificationService;
import com.example.billingautomation.service.scheduler.RecurringTaskScheduler;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("BillingAutomationService Tests")
class BillingAutomationServiceTest {

    @Mock
    private RecurringTaskScheduler scheduler;

    @Mock
    private InvoiceGenerationService invoiceGenerationService;

    @Mock
    private NotificationService notificationService;

    @Mock
    private SlackAlertService slackAlertService;

    @Captor
    private ArgumentCaptor<ScheduledTask> taskCaptor;

    private BillingAutomationService service(String now) {
        var clock = Clock.fixed(Instant.parse(now), ZoneOffset.UTC);
        return new BillingAutomationService(scheduler, invoiceGenerationService, notificationService,
                slackAlertService, clock, new BillingAutomationProperties());
    }

    private Invoice invoice(String tenant, LocalDate dueDate) {
        return Invoice.builder()
                .id("inv-" + tenant)
                .invoiceNumber("INV-" + tenant)
                .tenantId("tenant-" + tenant)
                .tenantName(tenant)
                .amount(new BigDecimal("8500.00"))
                .dueDate(dueDate)
                .status(InvoiceStatus.PENDING)
                .build();
    }

    private ScheduledTask registered(AutomationTaskType type, boolean active) {
        return ScheduledTask.builder()
                .id(type.getTaskId())
                .name(type.getDisplayName())
                .schedule("@daily")
                .active(active)
                .action(() -> {
                })
                .build();
    }

    @Nested
    @DisplayName("initialize Tests")
    class InitializeTests {

        @Test
        @DisplayName("Should register the three billing tasks active when enabled")
        void shouldRegisterThreeTasks() {
            service("2024-03-01T08:00:00Z").initialize();

            verify(scheduler, times(3)).addTask(taskCaptor.capture());
            assertThat(taskCaptor.getAllValues())
                    .extracting(ScheduledTask::getId, ScheduledTask::getSchedule, ScheduledTask::isActive)
                    .containsExactly(
                            tuple("monthly-invoice-generation", "@monthly", true),
                            tuple("daily-overdue-check", "@daily", true),
                            tuple("daily-reminder-check", "@daily", true));
        }

        @Test
        @DisplayName("Should register tasks inactive when automation is disabled")
        void shouldRegisterInactiveWhenDisabled() {
            var properties = new BillingAutomationProperties();
            properties.setEnabled(false);
            var clock = Clock.fixed(Instant.parse("2024-03-01T08:00:00Z"), ZoneOffset.UTC);
            new BillingAutomationService(scheduler, invoiceGenerationService, notificationService,
                    slackAlertService, clock, properties).initialize();

            verify(scheduler, times(3)).addTask(taskCaptor.capture());
            assertThat(taskCaptor.getAllValues()).noneMatch(ScheduledTask::isActive);
        }
    }

    @Nested
    @DisplayName("Monthly Generation Tests")
    class MonthlyGenerationTests {

        @Test
        @DisplayName("Should skip scheduled generation when today is not the generate day")
        void shouldSkipOffGenerateDay() {
            service("2024-03-15T08:00:00Z").runScheduledInvoiceGeneration();

            verifyNoInteractions(invoiceGenerationService, notificationService);
        }

        @Test
        @DisplayName("Should generate on the generate day")
        void shouldGenerateOnGenerateDay() {
            when(invoiceGenerationService.generateMonthlyInvoices()).thenReturn(List.of());

            service("2024-03-01T08:00:00Z").runScheduledInvoiceGeneration();

            verify(invoiceGenerationService).generateMonthlyInvoices();
            verify(notificationService).notifyManagers("Monthly invoice generation completed. 0 invoices created.");
        }

        @Test
        @DisplayName("Should bypass the generate day on manual trigger")
        void shouldBypassGenerateDayOnManualTrigger() {
            when(invoiceGenerationService.generateMonthlyInvoices())
                    .thenReturn(List.of(invoice("Thandi", LocalDate.of(2024, 4, 1))));

            var result = service("2024-03-15T08:00:00Z").manualTrigger(AutomationTaskType.INVOICES);

            assertThat(result.getProcessed()).isEqualTo(1);
            assertThat(result.getTaskId()).isEqualTo("monthly-invoice-generation");
            verify(notificationService).sendRentReminder(any());
        }

        @Test
        @DisplayName("Should keep notifying other tenants when one notification fails")
        void shouldIsolateTenantFailures() {
            var first = invoice("A", LocalDate.of(2024, 4, 1));
            var second = invoice("B", LocalDate.of(2024, 4, 1));
            var third = invoice("C", LocalDate.of(2024, 4, 1));
            when(invoiceGenerationService.generateMonthlyInvoices()).thenReturn(List.of(first, second, third));
            lenient().doThrow(new ExternalServiceException("Property API", 500, "down"))
                    .when(notificationService).sendRentReminder(second);

            var created = service("2024-03-01T08:00:00Z").generateMonthlyInvoices();

            assertThat(created).isEqualTo(3);
            verify(notificationService).sendRentReminder(first);
            verify(notificationService).sendRentReminder(third);
            verify(notificationService).notifyManagers("Monthly invoice generation completed. 3 invoices created.");
        }

        @Test
        @DisplayName("Should report a failed run to managers and Slack instead of throwing")
        void shouldReportFailedRun() {
            when(invoiceGenerationService.generateMonthlyInvoices())
                    .thenThrow(new ExternalServiceException("Property API", 503, "unavailable"));

            var created = service("2024-03-01T08:00:00Z").generateMonthlyInvoices();

            assertThat(created).isZero();
            verify(notificationService).notifyManagers(startsWith("Error in monthly invoice generation: "));
            verify(slackAlertService).sendErrorAlert(eq("Monthly invoice generation failed"), anyString(), anyString());
        }
    }

    @Nested
    @DisplayName("Overdue Sweep Tests")
    class OverdueSweepTests {

        @Test
        @DisplayName("Should not escalate at 13 days past due")
        void shouldNotEscalateBelowThreshold() {
            var invoice = invoice("Thandi", LocalDate.of(2024, 3, 2));
            when(invoiceGenerationService.processOverdueInvoices()).thenReturn(List.of(invoice));

            var processed = service("2024-03-15T08:00:00Z").checkOverduePayments();

            assertThat(processed).isEqualTo(1);
            verify(notificationService).sendOverdueAlert(invoice, 13);
            verify(notificationService, never()).sendEscalation(anyString(), anyString());
        }

        @Test
        @DisplayName("Should escalate once at 14 days past due")
        void shouldEscalateAtThreshold() {
            var invoice = invoice("Thandi", LocalDate.of(2024, 3, 1));
            when(invoiceGenerationService.processOverdueInvoices()).thenReturn(List.of(invoice));
            when(notificationService.formatAmount(invoice.getAmount())).thenReturn("R 8 500,00");

            service("2024-03-15T08:00:00Z").checkOverduePayments();

            verify(notificationService).sendOverdueAlert(invoice, 14);
            verify(notificationService, times(1)).sendEscalation(eq("Payment Overdue"),
                    eq("ESCALATION: Thandi payment overdue by 14 days. Amount: R 8 500,00. Immediate action required."));
        }

        @Test
        @DisplayName("Should keep processing when one invoice fails")
        void shouldIsolateInvoiceFailures() {
            var failing = invoice("A", LocalDate.of(2024, 3, 10));
            var healthy = invoice("B", LocalDate.of(2024, 3, 10));
            when(invoiceGenerationService.processOverdueInvoices()).thenReturn(List.of(failing, healthy));
            lenient().doThrow(new ExternalServiceException("Property API", 500, "down"))
                    .when(notificationService).sendOverdueAlert(eq(failing), anyLong());

            var processed = service("2024-03-15T08:00:00Z").checkOverduePayments();

            assertThat(processed).isEqualTo(2);
            verify(notificationService).sendOverdueAlert(healthy, 5);
        }

        @Test
        @DisplayName("Should still escalate when the tenant alert fails")
        void shouldEscalateWhenTenantAlertFails() {
            var invoice = invoice("Thandi", LocalDate.of(2024, 2, 14));
            when(invoiceGenerationService.processOverdueInvoices()).thenReturn(List.of(invoice));
            when(notificationService.formatAmount(invoice.getAmount())).thenReturn("R 8 500,00");
            doThrow(new ExternalServiceException("Property API", 404, "no such user"))
                    .when(notificationService).sendOverdueAlert(invoice, 30);

            service("2024-03-15T08:00:00Z").checkOverduePayments();

            verify(notificationService).sendEscalation(eq("Payment Overdue"), contains("overdue by 30 days"));
        }

        @Test
        @DisplayName("Should log and not throw when overdue invoices cannot be processed")
        void shouldNotThrowWhenOverdueFetchFails() {
            when(invoiceGenerationService.processOverdueInvoices())
                    .thenThrow(new ExternalServiceException("Property API", 503, "unavailable"));

            var result = service("2024-03-15T08:00:00Z").manualTrigger(AutomationTaskType.OVERDUE);

            assertThat(result.getProcessed()).isZero();
            verifyNoInteractions(notificationService);
        }
    }

    @Nested
    @DisplayName("Reminder Sweep Tests")
    class ReminderSweepTests {

        @Test
        @DisplayName("Should send one reminder for an invoice due in 7 days")
        void shouldRemindSevenDaysBefore() {
            var invoice = invoice("Thandi", LocalDate.of(2024, 4, 1));
            when(invoiceGenerationService.getPendingInvoices()).thenReturn(List.of(invoice));

            var sent = service("2024-03-25T08:00:00Z").sendPaymentReminders();

            assertThat(sent).isEqualTo(1);
            verify(notificationService, times(1)).sendRentReminder(invoice);
        }

        @Test
        @DisplayName("Should not remind when days until due is not configured")
        void shouldSkipUnconfiguredOffsets() {
            when(invoiceGenerationService.getPendingInvoices())
                    .thenReturn(List.of(invoice("Thandi", LocalDate.of(2024, 3, 29))));

            var sent = service("2024-03-25T08:00:00Z").sendPaymentReminders();

            assertThat(sent).isZero();
            verify(notificationService, never()).sendRentReminder(any());
        }

        @Test
        @DisplayName("Should round partial days up")
        void shouldRoundPartialDaysUp() {
            var invoice = invoice("Thandi", LocalDate.of(2024, 3, 26));
            when(invoiceGenerationService.getPendingInvoices()).thenReturn(List.of(invoice));

            service("2024-03-25T08:00:00Z").sendPaymentReminders();

            verify(notificationService).sendRentReminder(invoice);
        }

        @Test
        @DisplayName("Should log and not throw when pending invoices cannot be fetched")
        void shouldNotThrowWhenPendingFetchFails() {
            when(invoiceGenerationService.getPendingInvoices())
                    .thenThrow(new ExternalServiceException("Property API", 503, "unavailable"));

            assertThat(service("2024-03-25T08:00:00Z").sendPaymentReminders()).isZero();
            verifyNoInteractions(notificationService);
        }
    }

    @Nested
    @DisplayName("Config Tests")
    class ConfigTests {

        @Test
        @DisplayName("Should start from the configured defaults")
        void shouldStartFromDefaults() {
            var config = service("2024-03-01T08:00:00Z").getConfig();

            assertThat(config.isEnabled()).isTrue();
            assertThat(config.getGenerateDay()).isEqualTo(1);
            assertThat(config.getReminderDaysBefore()).containsExactly(7, 3, 1);
            assertThat(config.getOverdueCheckDays()).containsExactly(1, 3, 7, 14);
            assertThat(config.getManagerEscalationDays()).isEqualTo(14);
        }

        @Test
        @DisplayName("Should merge only the provided fields")
        void shouldMergeProvidedFields() {
            var service = service("2024-03-01T08:00:00Z");

            var updated = service.updateConfig(UpdateAutomationConfigRequest.builder().generateDay(5).build());

            assertThat(updated.getGenerateDay()).isEqualTo(5);
            assertThat(updated.isEnabled()).isTrue();
            assertThat(updated.getManagerEscalationDays()).isEqualTo(14);
            verifyNoInteractions(scheduler);
        }

        @Test
        @DisplayName("Should deactivate every active billing task when disabled")
        void shouldDeactivateTasksWhenDisabled() {
            when(scheduler.getTask("monthly-invoice-generation"))
                    .thenReturn(Optional.of(registered(AutomationTaskType.INVOICES, true)));
            when(scheduler.getTask("daily-overdue-check"))
                    .thenReturn(Optional.of(registered(AutomationTaskType.OVERDUE, true)));
            when(scheduler.getTask("daily-reminder-check"))
                    .thenReturn(Optional.of(registered(AutomationTaskType.REMINDERS, false)));

            var updated = service("2024-03-01T08:00:00Z")
                    .updateConfig(UpdateAutomationConfigRequest.builder().enabled(false).build());

            assertThat(updated.isEnabled()).isFalse();
            verify(scheduler).toggleTask("monthly-invoice-generation");
            verify(scheduler).toggleTask("daily-overdue-check");
            verify(scheduler, never()).toggleTask("daily-reminder-check");
        }

        @Test
        @DisplayName("Should not expose the live config to callers")
        void shouldReturnCopy() {
            var service = service("2024-03-01T08:00:00Z");

            service.getConfig().setReminderDaysBefore(Set.of(30));

            assertThat(service.getConfig().getReminderDaysBefore()).containsExactly(7, 3, 1);
        }
    }

    @Nested
    @DisplayName("Status Tests")
    class StatusTests {

        @Test
        @DisplayName("Should report only the billing tasks")
        void shouldReportBillingTasks() {
            var other = ScheduledTask.builder().id("other").name("Other").schedule("@hourly").active(true).build();
            when(scheduler.getTasks()).thenReturn(List.of(
                    registered(AutomationTaskType.INVOICES, true),
                    other,
                    registered(AutomationTaskType.OVERDUE, false)));

            var status = service("2024-03-01T08:00:00Z").getStatus();

            assertThat(status.isEnabled()).isTrue();
            assertThat(status.getTasks())
                    .extracting("id")
                    .containsExactly("monthly-invoice-generation", "daily-overdue-check");
        }
    }
}
