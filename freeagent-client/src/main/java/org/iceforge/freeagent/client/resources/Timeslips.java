package org.iceforge.freeagent.client.resources;

import org.iceforge.freeagent.cache.ResourceCache;
import org.iceforge.freeagent.client.FreeAgentHttp;
import org.iceforge.freeagent.client.FreeAgentModels.Timeslip;
import org.springframework.http.HttpMethod;

import java.net.URI;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

public class Timeslips extends ResourceClient<Timeslip> {

    public static final String RESOURCE = "timeslips";

    public Timeslips(FreeAgentHttp http, ResourceCache cache) {
        super(http, cache, "/v2/timeslips", "timeslip", "timeslips", Timeslip.class);
    }

    public List<Timeslip> getAll() {
        return getAll(TimeslipQuery.all());
    }

    public List<Timeslip> getAll(TimeslipQuery query) {
        Objects.requireNonNull(query, "query");
        return list(query.toFilter());
    }

    public List<Timeslip> getByProject(URI project) {
        Objects.requireNonNull(project, "project");
        return getAll(TimeslipQuery.all().withProject(project));
    }

    public List<Timeslip> getAllByUserAndDateRange(URI user, LocalDate from, LocalDate to) {
        Objects.requireNonNull(user, "user");
        return getAll(TimeslipQuery.all().withUser(user).between(from, to));
    }

    /** Creates several timeslips in one request. */
    public List<Timeslip> createBatch(List<Timeslip> timeslips) {
        if (timeslips.isEmpty()) {
            return List.of();
        }
        return createAll(timeslips);
    }

    public Timeslip update(Timeslip timeslip) {
        return update(timeslip.id(), timeslip);
    }

    public Timeslip startTimer(String id) {
        return transition(id, HttpMethod.POST, "timer");
    }

    public Timeslip stopTimer(String id) {
        return transition(id, HttpMethod.DELETE, "timer");
    }
}
