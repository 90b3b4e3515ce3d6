package org.iceforge.freeagent.client;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.net.URI;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * FreeAgent v2 entities. Only the fields this client reads or writes are mapped; anything else in a
 * response is ignored.
 * <p>
 * Every entity is identified by its {@code url}; the id used in paths and cache keys is its last segment.
 */
public final class FreeAgentModels {
    private FreeAgentModels() {}

    /** Last path segment of an entity url, e.g. {@code 42} for {@code .../v2/contacts/42}. */
    public static String idOf(URI url) {
        if (url == null) {
            throw new IllegalArgumentException("entity has no url");
        }
        String path = url.getPath();
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("entity url has no path: " + url);
        }
        String trimmed = path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
        String id = trimmed.substring(trimmed.lastIndexOf('/') + 1);
        if (id.isBlank()) {
            throw new IllegalArgumentException("entity url has no id: " + url);
        }
        return id;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Contact(
            URI url,
            @JsonProperty("first_name") String firstName,
            @JsonProperty("last_name") String lastName,
            @JsonProperty("organisation_name") String organisationName,
            String email,
            @JsonProperty("phone_number") String phoneNumber,
            String status,
            @JsonProperty("active_projects_count") Integer activeProjectsCount,
            @JsonProperty("created_at") Instant createdAt,
            @JsonProperty("updated_at") Instant updatedAt
    ) {
        @JsonIgnore
        public String id() { return idOf(url); }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Project(
            URI url,
            String name,
            URI contact,
            String status,
            String currency,
            @JsonProperty("budget_units") String budgetUnits,
            BigDecimal budget,
            @JsonProperty("normal_billing_rate") BigDecimal normalBillingRate,
            @JsonProperty("billing_period") String billingPeriod,
            @JsonProperty("is_ir35") Boolean isIr35,
            @JsonProperty("starts_on") LocalDate startsOn,
            @JsonProperty("ends_on") LocalDate endsOn,
            @JsonProperty("created_at") Instant createdAt,
            @JsonProperty("updated_at") Instant updatedAt
    ) {
        @JsonIgnore
        public String id() { return idOf(url); }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TaskItem(
            URI url,
            URI project,
            String name,
            @JsonProperty("is_billable") Boolean isBillable,
            @JsonProperty("billing_rate") BigDecimal billingRate,
            @JsonProperty("billing_period") String billingPeriod,
            String status,
            @JsonProperty("created_at") Instant createdAt,
            @JsonProperty("updated_at") Instant updatedAt
    ) {
        @JsonIgnore
        public String id() { return idOf(url); }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Timeslip(
            URI url,
            URI user,
            URI project,
            URI task,
            @JsonProperty("dated_on") LocalDate datedOn,
            BigDecimal hours,
            String comment,
            Timer timer,
            @JsonProperty("created_at") Instant createdAt,
            @JsonProperty("updated_at") Instant updatedAt
    ) {
        @JsonIgnore
        public String id() { return idOf(url); }

        @JsonIgnore
        public boolean isRunning() {
            return timer != null && Boolean.TRUE.equals(timer.running());
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Timer(
            Boolean running,
            @JsonProperty("start_from") Instant startFrom
    ) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record User(
            URI url,
            @JsonProperty("first_name") String firstName,
            @JsonProperty("last_name") String lastName,
            String email,
            String role,
            Boolean hidden,
            @JsonProperty("permission_level") Integer permissionLevel,
            @JsonProperty("created_at") Instant createdAt,
            @JsonProperty("updated_at") Instant updatedAt
    ) {
        @JsonIgnore
        public String id() { return idOf(url); }

        @JsonIgnore
        public String fullName() {
            String first = firstName == null ? "" : firstName;
            String last = lastName == null ? "" : lastName;
            return (first + " " + last).trim();
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Invoice(
            URI url,
            URI contact,
            URI project,
            String reference,
            @JsonProperty("dated_on") LocalDate datedOn,
            @JsonProperty("due_on") LocalDate dueOn,
            @JsonProperty("payment_terms_in_days") Integer paymentTermsInDays,
            String currency,
            String status,
            @JsonProperty("net_value") BigDecimal netValue,
            @JsonProperty("total_value") BigDecimal totalValue,
            @JsonProperty("due_value") BigDecimal dueValue,
            String comments,
            @JsonProperty("invoice_items") List<InvoiceItem> invoiceItems,
            @JsonProperty("created_at") Instant createdAt,
            @JsonProperty("updated_at") Instant updatedAt
    ) {
        @JsonIgnore
        public String id() { return idOf(url); }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record InvoiceItem(
            URI url,
            @JsonProperty("item_type") String itemType,
            BigDecimal quantity,
            BigDecimal price,
            String description,
            @JsonProperty("sales_tax_rate") BigDecimal salesTaxRate
    ) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record BankAccount(
            URI url,
            String type,
            String name,
            @JsonProperty("nominal_code") String nominalCode,
            @JsonProperty("account_number") String accountNumber,
            @JsonProperty("sort_code") String sortCode,
            String iban,
            String bic,
            @JsonProperty("opening_balance") BigDecimal openingBalance,
            @JsonProperty("current_balance") BigDecimal currentBalance,
            @JsonProperty("bank_name") String bankName,
            String currency,
            @JsonProperty("is_primary") Boolean isPrimary,
            @JsonProperty("is_personal") Boolean isPersonal,
            String status,
            @JsonProperty("created_at") Instant createdAt,
            @JsonProperty("updated_at") Instant updatedAt
    ) {
        @JsonIgnore
        public String id() { return idOf(url); }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record BankTransaction(
            URI url,
            @JsonProperty("bank_account") URI bankAccount,
            @JsonProperty("dated_on") LocalDate datedOn,
            BigDecimal amount,
            @JsonProperty("unexplained_amount") BigDecimal unexplainedAmount,
            String description,
            @JsonProperty("is_manual") Boolean isManual,
            @JsonProperty("created_at") Instant createdAt,
            @JsonProperty("updated_at") Instant updatedAt
    ) {
        @JsonIgnore
        public String id() { return idOf(url); }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Expense(
            URI url,
            URI user,
            URI project,
            URI category,
            @JsonProperty("dated_on") LocalDate datedOn,
            @JsonProperty("gross_value") BigDecimal grossValue,
            String currency,
            String description,
            @JsonProperty("sales_tax_rate") BigDecimal salesTaxRate,
            @JsonProperty("created_at") Instant createdAt,
            @JsonProperty("updated_at") Instant updatedAt
    ) {
        @JsonIgnore
        public String id() { return idOf(url); }
    }
}
