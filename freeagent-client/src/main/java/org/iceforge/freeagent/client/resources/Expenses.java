package org.iceforge.freeagent.client.resources;

import org.iceforge.freeagent.cache.ListFilter;
import org.iceforge.freeagent.cache.ResourceCache;
import org.iceforge.freeagent.client.FreeAgentHttp;
import org.iceforge.freeagent.client.FreeAgentModels.Expense;

import java.net.URI;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

public class Expenses extends ResourceClient<Expense> {

    public static final String RESOURCE = "expenses";

    public Expenses(FreeAgentHttp http, ResourceCache cache) {
        super(http, cache, "/v2/expenses", "expense", "expenses", Expense.class);
    }

    public List<Expense> getAll() {
        return getAll(null, null, null, null, null);
    }

    /** @param view {@code recent} or {@code recurring}; {@code null} for every expense */
    public List<Expense> getAll(String view, LocalDate fromDate, LocalDate toDate, Instant updatedSince, URI project) {
        if (fromDate != null && toDate != null && fromDate.isAfter(toDate)) {
            throw new IllegalArgumentException("fromDate " + fromDate + " is after toDate " + toDate);
        }
        return list(ListFilter.builder()
                .with("view", view)
                .with("from_date", fromDate)
                .with("to_date", toDate)
                .with("updated_since", updatedSince)
                .with("project", project)
                .build());
    }
}
