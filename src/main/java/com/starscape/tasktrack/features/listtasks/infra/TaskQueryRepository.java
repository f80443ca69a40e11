package com.starscape.tasktrack.features.listtasks.infra;

import com.starscape.tasktrack.features.createtask.domain.Task;
import com.starscape.tasktrack.features.createtask.domain.TaskVisibility;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.TypedQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-side query for task listing with offset pagination.
 * Soft-deleted tasks are always excluded. Results are ordered by task ID so
 * pages are stable while the data is unchanged.
 */
@Repository
public class TaskQueryRepository {
    
    private static final Logger log = LoggerFactory.getLogger(TaskQueryRepository.class);
    
    @PersistenceContext
    private EntityManager entityManager;
    
    public List<Task> findVisible(TaskFilter filter, int skip, int limit) {
        StringBuilder jpql = new StringBuilder("SELECT t FROM Task t WHERE t.visibility = :visibility");
        Map<String, Object> params = new HashMap<>();
        params.put("visibility", TaskVisibility.ACTIVE);
        
        if (filter.completed() != null) {
            jpql.append(" AND t.completed = :completed");
            params.put("completed", filter.completed());
        }
        if (filter.priority() != null) {
            jpql.append(" AND t.priority = :priority");
            params.put("priority", filter.priority());
        }
        
        // One EXISTS per name gives AND semantics across tags
        List<String> tagNames = filter.tagNames();
        for (int i = 0; i < tagNames.size(); i++) {
            String param = "tag" + i;
            jpql.append(" AND EXISTS (SELECT tt.taskId FROM TaskTag tt, Tag g")
                .append(" WHERE tt.taskId = t.taskId AND tt.tagId = g.tagId AND g.name = :")
                .append(param)
                .append(")");
            params.put(param, tagNames.get(i));
        }
        
        jpql.append(" ORDER BY t.taskId ASC");
        
        TypedQuery<Task> query = entityManager.createQuery(jpql.toString(), Task.class);
        params.forEach(query::setParameter);
        query.setFirstResult(skip);
        query.setMaxResults(limit);
        
        log.debug("Listing tasks: filter={}, skip={}, limit={}", filter, skip, limit);
        return query.getResultList();
    }
}
