package org.iceforge.freeagent.client.resources;

import org.iceforge.freeagent.cache.ListFilter;
import org.iceforge.freeagent.cache.ResourceCache;
import org.iceforge.freeagent.client.FreeAgentHttp;
import org.iceforge.freeagent.client.FreeAgentModels.Invoice;
import org.springframework.http.HttpMethod;

import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

public class Invoices extends ResourceClient<Invoice> {

    public static final String RESOURCE = "invoices";
    public static final String DEFAULT_VIEW = "all";

    public Invoices(FreeAgentHttp http, ResourceCache cache) {
        super(http, cache, "/v2/invoices", "invoice", "invoices", Invoice.class);
    }

    public List<Invoice> getAll() {
        return getAll(null, null, null, null, null);
    }

    /**
     * @param view         {@code all}, {@code recent_open_or_overdue}, {@code open}, {@code overdue}, {@code draft},
     *                     {@code scheduled_to_email}, {@code thank_you_emails}, {@code reminder_emails} or
     *                     {@code last_N_months}; {@code null} means {@code all}
     * @param sort         {@code created_at}, {@code updated_at}, prefixed with {@code -} for descending
     * @param contact      restricts to one contact's invoices
     * @param project      restricts to one project's invoices
     * @param updatedSince only invoices changed after this instant
     */
    public List<Invoice> getAll(String view, String sort, URI contact, URI project, Instant updatedSince) {
        return list(ListFilter.builder()
                .withDefault("view", view, DEFAULT_VIEW)
                .with("sort", sort)
                .with("contact", contact)
                .with("project", project)
                .with("updated_since", updatedSince)
                .build());
    }

    public List<Invoice> getAllByStatus(String view) {
        Objects.requireNonNull(view, "view");
        return getAll(view, null, null, null, null);
    }

    public List<Invoice> getAllByContact(URI contact) {
        Objects.requireNonNull(contact, "contact");
        return getAll(null, null, contact, null, null);
    }

    public List<Invoice> getAllByProject(URI project) {
        Objects.requireNonNull(project, "project");
        return getAll(null, null, null, project, null);
    }

    public Invoice markAsSent(String id) {
        return transition(id, HttpMethod.PUT, "transitions/mark_as_sent");
    }

    public Invoice markAsDraft(String id) {
        return transition(id, HttpMethod.PUT, "transitions/mark_as_draft");
    }

    public Invoice markAsCancelled(String id) {
        return transition(id, HttpMethod.PUT, "transitions/mark_as_cancelled");
    }

    public Invoice markAsScheduled(String id) {
        return transition(id, HttpMethod.PUT, "transitions/mark_as_scheduled");
    }
}
