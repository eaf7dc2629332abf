package com.flamingo.ai.deckplanner.service.template.model;

import java.util.List;

/**
 * All layouts of a template, keyed by a caller-chosen template identity.
 *
 * @param templateId stable identity used for caching analysis results
 * @param layouts layout geometries in template order
 */
public record TemplateGeometry(String templateId, List<LayoutGeometry> layouts) {}
