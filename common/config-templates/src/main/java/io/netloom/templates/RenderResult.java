package io.netloom.templates;

import java.util.List;

public record RenderResult(List<RenderedTemplate> rendered, List<TemplateException> failures) {
    public RenderResult {
        rendered = rendered == null ? List.of() : List.copyOf(rendered);
        failures = failures == null ? List.of() : List.copyOf(failures);
    }
}
