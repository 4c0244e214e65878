package com.rvctrl.generator.model;

/**
 * The two source artifacts generated for a control signal.
 */
public enum ArtifactKind {
    /**
     * Enumeration-like object extending CtrlEnum.
     */
    CTRL("/templates/ctrl.scala.tmpl", ""),

    /**
     * Decode-table object extending DecodeField.
     */
    FIELD("/templates/field.scala.tmpl", "Field");

    private final String defaultTemplateResource;
    private final String fileSuffix;

    ArtifactKind(String defaultTemplateResource, String fileSuffix) {
        this.defaultTemplateResource = defaultTemplateResource;
        this.fileSuffix = fileSuffix;
    }

    public String getDefaultTemplateResource() {
        return defaultTemplateResource;
    }

    /**
     * Appended to the signal name when the artifact is saved to a file.
     */
    public String getFileSuffix() {
        return fileSuffix;
    }
}
