package io.netloom.templates;

/**
 * Output of one template evaluation. {@code entity} is {@code null} for node-level templates.
 */
public record RenderedTemplate(TemplateId templateId, OutputPath outputPath, String entity, String content) {

    public String relativePath() {
        return outputPath.resolve(entity);
    }
}
