package com.pulsesentinel.core.notify;

import com.pulsesentinel.core.model.Template;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Notification templates by id. Callers always receive copies.
 */
public class TemplateRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(TemplateRegistry.class);

    private final Map<String, Template> templates = new LinkedHashMap<>();

    /**
     * Insert or replace a template.
     *
     * @throws IllegalArgumentException if the template has no id
     */
    public synchronized Template save(Template template) {
        Objects.requireNonNull(template, "template must not be null");
        if (template.getId() == null || template.getId().isBlank()) {
            throw new IllegalArgumentException("Template id is required");
        }
        Template copy = new Template(template);
        templates.put(copy.getId(), copy);
        LOG.info("Saved template [{}]", copy.getId());
        return new Template(copy);
    }

    public synchronized boolean remove(String id) {
        return templates.remove(id) != null;
    }

    public synchronized Optional<Template> get(String id) {
        return Optional.ofNullable(templates.get(id)).map(Template::new);
    }

    public synchronized List<Template> list() {
        return templates.values().stream().map(Template::new).toList();
    }

    public synchronized void replaceAll(Collection<Template> replacement) {
        templates.clear();
        for (Template t : replacement) {
            if (t.getId() != null && !t.getId().isBlank()) {
                templates.put(t.getId(), new Template(t));
            }
        }
        LOG.info("Template set replaced with {} template(s)", templates.size());
    }
}
