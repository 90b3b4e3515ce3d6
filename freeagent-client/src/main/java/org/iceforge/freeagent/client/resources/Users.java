package org.iceforge.freeagent.client.resources;

import org.iceforge.freeagent.cache.ListFilter;
import org.iceforge.freeagent.cache.ResourceCache;
import org.iceforge.freeagent.client.FreeAgentHttp;
import org.iceforge.freeagent.client.FreeAgentModels.User;

import java.util.Comparator;
import java.util.List;

public class Users extends ResourceClient<User> {

    public static final String RESOURCE = "users";
    public static final String ME = "me";

    private static final Comparator<User> BY_LAST_NAME = Comparator
            .comparing(User::lastName, Comparator.nullsLast(String.CASE_INSENSITIVE_ORDER))
            .thenComparing(User::firstName, Comparator.nullsLast(String.CASE_INSENSITIVE_ORDER));

    public Users(FreeAgentHttp http, ResourceCache cache) {
        super(http, cache, "/v2/users", "user", "users", User.class);
    }

    public List<User> getAll() {
        return getAll(null);
    }

    /**
     * @param view {@code all}, {@code staff}, {@code active_staff}, {@code advisors} or {@code active_advisors};
     *             {@code null} means {@code all}
     */
    public List<User> getAll(String view) {
        return list(viewFilter(view));
    }

    /** Visible users with the Employee role, ordered by last name. */
    public List<User> getAllActiveEmployees() {
        return visibleWithRole("Employee");
    }

    public List<User> getAllDirectors() {
        return visibleWithRole("Director");
    }

    /** The user the access token belongs to, cached under {@code users_me}. */
    public User getMe() {
        return getById(ME);
    }

    /** Also drops {@code users_me}, which may be the same user under another key. */
    @Override
    public User update(String id, User user) {
        User updated = super.update(id, user);
        cache.invalidate(List.of(cache.entityKey(ME)));
        return updated;
    }

    @Override
    public void delete(String id) {
        super.delete(id);
        cache.invalidate(List.of(cache.entityKey(ME)));
    }

    private List<User> visibleWithRole(String role) {
        String key = cache.listKey(ListFilter.builder()
                .with("role", role)
                .with("hidden", false)
                .build());
        return cache.getOrFetch(key, () -> fetchList(viewFilter(null)).stream()
                .filter(u -> !Boolean.TRUE.equals(u.hidden()))
                .filter(u -> role.equalsIgnoreCase(u.role()))
                .sorted(BY_LAST_NAME)
                .toList());
    }

    private static ListFilter viewFilter(String view) {
        return ListFilter.builder().withDefault("view", view, "all").build();
    }
}
