package com.richcorabbithole.pipeline.research;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One typed segment of a provider response. Only text blocks carry research content;
 * other types (tool_use, thinking, ...) are kept so callers can skip them.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ContentBlock {

    public static final String TYPE_TEXT = "text";

    private final String type;
    private final String text;

    @JsonCreator
    public ContentBlock(
            @JsonProperty("type") String type,
            @JsonProperty("text") String text) {
        this.type = type;
        this.text = text;
    }

    public static ContentBlock text(String text) {
        return new ContentBlock(TYPE_TEXT, text);
    }

    public boolean isText() {
        return TYPE_TEXT.equals(type) && text != null;
    }

    public String getType() {
        return type;
    }

    public String getText() {
        return text;
    }

    @Override
    public String toString() {
        return "ContentBlock{type='" + type + "'}";
    }
}
