package com.nayem.revision.session;

import java.util.Set;

/**
 * Receives raw entity lifecycle notifications, in the order the enclosing
 * transaction observed them.
 */
public interface LifecycleListener {

    void onInsert(Object entity);

    /**
     * @param changedAttributes names of the attributes with pending changes
     */
    void onUpdate(Object entity, Set<String> changedAttributes);

    void onDelete(Object entity);
}
