package org.iceforge.freeagent.client.resources;

import org.iceforge.freeagent.cache.ListFilter;
import org.iceforge.freeagent.cache.ResourceCache;
import org.iceforge.freeagent.client.FreeAgentHttp;
import org.iceforge.freeagent.client.FreeAgentModels.Contact;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

public class Contacts extends ResourceClient<Contact> {

    public static final String RESOURCE = "contacts";
    public static final String DEFAULT_VIEW = "active";

    public Contacts(FreeAgentHttp http, ResourceCache cache) {
        super(http, cache, "/v2/contacts", "contact", "contacts", Contact.class);
    }

    public List<Contact> getAll() {
        return getAll(null);
    }

    /**
     * @param view one of FreeAgent's contact views ({@code all}, {@code active}, {@code clients},
     *             {@code suppliers}, {@code active_projects}...); {@code null} means {@code active}
     */
    public List<Contact> getAll(String view) {
        return list(viewFilter(view));
    }

    public List<Contact> getAllWithActiveProjects() {
        return getAll("active_projects");
    }

    /**
     * Case-insensitive match on organisation name among the active contacts. A miss is cached like a hit
     * until the next contact mutation.
     *
     * @throws IllegalArgumentException when the name is blank
     */
    public Optional<Contact> getByOrganisationName(String organisationName) {
        String wanted = requireLookup(organisationName, "organisationName");
        String key = cache.listKey(ListFilter.of("organisation_name", wanted.toLowerCase(Locale.ROOT)));
        return cache.getOrFetch(key, () -> fetchList(activeFilter()).stream()
                .filter(c -> c.organisationName() != null && c.organisationName().trim().equalsIgnoreCase(wanted))
                .findFirst());
    }

    private static ListFilter activeFilter() {
        return viewFilter(null);
    }

    private static ListFilter viewFilter(String view) {
        return ListFilter.builder().withDefault("view", view, DEFAULT_VIEW).build();
    }
}
