package io.github.hunghhdev.cohortttl.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

final class DocumentHookDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(DocumentHookDispatcher.class);

    private final List<DocumentHook> hooks = new CopyOnWriteArrayList<>();

    void add(DocumentHook hook) {
        if (hook != null) {
            hooks.add(hook);
        }
    }

    void remove(DocumentHook hook) {
        hooks.remove(hook);
    }

    void fireAfterInsert(String resource, Document document) {
        for (DocumentHook hook : hooks) {
            try {
                hook.afterInsert(resource, document);
            } catch (Exception e) {
                logger.warn("DocumentHook.afterInsert failed for '{}:{}': {}", resource, document.getId(), e.getMessage());
            }
        }
    }

    void fireAfterUpdate(String resource, Document document) {
        for (DocumentHook hook : hooks) {
            try {
                hook.afterUpdate(resource, document);
            } catch (Exception e) {
                logger.warn("DocumentHook.afterUpdate failed for '{}:{}': {}", resource, document.getId(), e.getMessage());
            }
        }
    }

    void fireAfterDelete(String resource, String id) {
        for (DocumentHook hook : hooks) {
            try {
                hook.afterDelete(resource, id);
            } catch (Exception e) {
                logger.warn("DocumentHook.afterDelete failed for '{}:{}': {}", resource, id, e.getMessage());
            }
        }
    }
}
