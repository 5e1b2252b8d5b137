package com.lorastudio.dto;

/**
 * Body of {@code POST /api/captions/accept}: save a previewed caption.
 */
public class AcceptCaptionRequest {

    private String imagePath;
    private String caption;

    /** Optional; when set, cached listings of this project are refreshed */
    private String projectRoot;

    public String getImagePath() {
        return imagePath;
    }

    public void setImagePath(String imagePath) {
        this.imagePath = imagePath;
    }

    public String getCaption() {
        return caption;
    }

    public void setCaption(String caption) {
        this.caption = caption;
    }

    public String getProjectRoot() {
        return projectRoot;
    }

    public void setProjectRoot(String projectRoot) {
        this.projectRoot = projectRoot;
    }
}
