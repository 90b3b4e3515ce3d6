package org.iceforge.freeagent.client.resources;

import org.iceforge.freeagent.cache.ListFilter;

import java.net.URI;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Filters accepted by {@code GET /v2/timeslips}. Unset fields are left out of both the request and the cache key.
 *
 * @param view   {@code all}, {@code unbilled} or {@code running}
 * @param nested when true, user, project and task are returned inline
 */
public record TimeslipQuery(
        LocalDate fromDate,
        LocalDate toDate,
        Instant updatedSince,
        String view,
        Boolean nested,
        URI user,
        URI task,
        URI project
) {
    public static TimeslipQuery all() {
        return new TimeslipQuery(null, null, null, null, null, null, null, null);
    }

    public TimeslipQuery between(LocalDate from, LocalDate to) {
        if (from != null && to != null && from.isAfter(to)) {
            throw new IllegalArgumentException("fromDate " + from + " is after toDate " + to);
        }
        return new TimeslipQuery(from, to, updatedSince, view, nested, user, task, project);
    }

    public TimeslipQuery withView(String view) {
        return new TimeslipQuery(fromDate, toDate, updatedSince, view, nested, user, task, project);
    }

    public TimeslipQuery withUser(URI user) {
        return new TimeslipQuery(fromDate, toDate, updatedSince, view, nested, user, task, project);
    }

    public TimeslipQuery withProject(URI project) {
        return new TimeslipQuery(fromDate, toDate, updatedSince, view, nested, user, task, project);
    }

    public TimeslipQuery withTask(URI task) {
        return new TimeslipQuery(fromDate, toDate, updatedSince, view, nested, user, task, project);
    }

    public TimeslipQuery updatedSince(Instant since) {
        return new TimeslipQuery(fromDate, toDate, since, view, nested, user, task, project);
    }

    public TimeslipQuery nested(boolean nested) {
        return new TimeslipQuery(fromDate, toDate, updatedSince, view, nested, user, task, project);
    }

    ListFilter toFilter() {
        return ListFilter.builder()
                .with("from_date", fromDate)
                .with("to_date", toDate)
                .with("updated_since", updatedSince)
                .withDefault("view", view, "all")
                .withDefault("nested", nested, false)
                .with("user", user)
                .with("task", task)
                .with("project", project)
                .build();
    }
}
