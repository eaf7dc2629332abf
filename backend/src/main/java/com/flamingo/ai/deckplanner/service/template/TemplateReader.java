package com.flamingo.ai.deckplanner.service.template;

import com.flamingo.ai.deckplanner.service.template.model.TemplateGeometry;

/**
 * Supplies the placeholder geometry of a template's layouts.
 *
 * <p>Implementations read the binary template document; this module never parses one itself.
 */
public interface TemplateReader {

  /**
   * Reads all layouts of a template.
   *
   * @param templateId identity of the template to read
   * @return layouts with their raw placeholder shapes, in template order
   */
  TemplateGeometry read(String templateId);
}
