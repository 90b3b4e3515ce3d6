package org.iceforge.freeagent.client.resources;

import org.iceforge.freeagent.cache.ListFilter;
import org.iceforge.freeagent.cache.ResourceCache;
import org.iceforge.freeagent.client.FreeAgentHttp;
import org.iceforge.freeagent.client.FreeAgentModels.Project;

import java.net.URI;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

public class Projects extends ResourceClient<Project> {

    public static final String RESOURCE = "projects";

    public Projects(FreeAgentHttp http, ResourceCache cache) {
        super(http, cache, "/v2/projects", "project", "projects", Project.class);
    }

    public List<Project> getAll() {
        return getAll(null, null);
    }

    public List<Project> getAllActive() {
        return getAll("active", null);
    }

    /**
     * @param view    {@code active}, {@code completed}, {@code cancelled} or {@code inactive}; {@code null} for all
     * @param contact restricts to one contact's projects
     */
    public List<Project> getAll(String view, URI contact) {
        return list(ListFilter.builder()
                .with("view", view)
                .with("contact", contact)
                .build());
    }

    /** Case-insensitive match on project name; blank names are rejected. */
    public Optional<Project> getByName(String name) {
        String wanted = requireLookup(name, "name");
        String key = cache.listKey(ListFilter.of("name", wanted.toLowerCase(Locale.ROOT)));
        return cache.getOrFetch(key, () -> fetchList(ListFilter.none()).stream()
                .filter(p -> p.name() != null && p.name().trim().equalsIgnoreCase(wanted))
                .findFirst());
    }
}
