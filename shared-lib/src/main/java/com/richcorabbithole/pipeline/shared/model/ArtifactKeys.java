package com.richcorabbithole.pipeline.shared.model;

/**
 * Blob keys for pipeline artifacts. Keys depend only on the task id so anyone holding a
 * task record can locate its artifact.
 */
public final class ArtifactKeys {

    public static final String RESEARCH_PREFIX = "research/";
    public static final String MARKDOWN_EXTENSION = ".md";
    public static final String MARKDOWN_CONTENT_TYPE = "text/markdown";

    private ArtifactKeys() {
    }

    public static String researchKey(String taskId) {
        return RESEARCH_PREFIX + taskId + MARKDOWN_EXTENSION;
    }
}
