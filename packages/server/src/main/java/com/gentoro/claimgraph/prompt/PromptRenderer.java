package com.gentoro.claimgraph.prompt;

import com.gentoro.claimgraph.exception.ConfigException;
import io.pebbletemplates.pebble.PebbleEngine;
import io.pebbletemplates.pebble.error.PebbleException;
import io.pebbletemplates.pebble.loader.ClasspathLoader;
import io.pebbletemplates.pebble.template.PebbleTemplate;
import java.io.IOException;
import java.io.StringWriter;
import java.util.Map;

/**
 * Renders Pebble prompt templates stored on the classpath under {@code prompts/}. Templates are
 * plain text, so autoescaping is off; unknown variables fail the render.
 */
public class PromptRenderer {
  private final PebbleEngine engine;

  public PromptRenderer() {
    ClasspathLoader loader = new ClasspathLoader();
    loader.setPrefix("prompts");
    loader.setSuffix(".peb");
    this.engine =
        new PebbleEngine.Builder()
            .loader(loader)
            .autoEscaping(false)
            .strictVariables(true)
            .newLineTrimming(false)
            .build();
  }

  public String render(String name, Map<String, Object> variables) {
    try {
      PebbleTemplate template = engine.getTemplate(name);
      StringWriter writer = new StringWriter();
      template.evaluate(writer, variables);
      return writer.toString().trim();
    } catch (PebbleException | IOException e) {
      throw new ConfigException("Failed to render prompt template " + name, e);
    }
  }
}
