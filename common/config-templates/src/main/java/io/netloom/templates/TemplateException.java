package io.netloom.templates;

/**
 * Rendering one template for one node failed. Other templates and nodes are not affected.
 */
public class TemplateException extends RuntimeException {

    private final String nodeName;
    private final TemplateId templateId;

    public TemplateException(String nodeName, TemplateId templateId, String message, Throwable cause) {
        super("Template " + templateId + " failed for node '" + nodeName + "': " + message, cause);
        this.nodeName = nodeName;
        this.templateId = templateId;
    }

    public String nodeName() {
        return nodeName;
    }

    public TemplateId templateId() {
        return templateId;
    }
}
