package org.iceforge.freeagent.client.resources;

import org.iceforge.freeagent.cache.ListFilter;
import org.iceforge.freeagent.cache.ResourceCache;
import org.iceforge.freeagent.client.FreeAgentHttp;
import org.iceforge.freeagent.client.FreeAgentModels.TaskItem;

import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public class Tasks extends ResourceClient<TaskItem> {

    public static final String RESOURCE = "tasks";

    public Tasks(FreeAgentHttp http, ResourceCache cache) {
        super(http, cache, "/v2/tasks", "task", "tasks", TaskItem.class);
    }

    public List<TaskItem> getAll() {
        return getAll(null, null, null);
    }

    /**
     * @param project      restricts to one project's tasks
     * @param view         {@code all}, {@code active}, {@code completed} or {@code hidden}
     * @param updatedSince only tasks changed after this instant
     */
    public List<TaskItem> getAll(URI project, String view, Instant updatedSince) {
        return list(ListFilter.builder()
                .with("project", project)
                .with("view", view)
                .with("updated_since", updatedSince)
                .build());
    }

    public List<TaskItem> getAllByProject(URI project) {
        Objects.requireNonNull(project, "project");
        return getAll(project, null, null);
    }

    /** Tasks are always created under a project. */
    public TaskItem create(URI project, TaskItem task) {
        Objects.requireNonNull(project, "project");
        return createWith(Map.of("project", project.toString()), task);
    }

    @Override
    public TaskItem create(TaskItem task) {
        Objects.requireNonNull(task, "task");
        if (task.project() == null) {
            throw new IllegalArgumentException("task has no project; use create(project, task)");
        }
        return create(task.project(), task);
    }
}
