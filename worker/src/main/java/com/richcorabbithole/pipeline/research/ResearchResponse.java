package com.richcorabbithole.pipeline.research;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

@JsonIgnoreProperties(ignoreUnknown = true)
public class ResearchResponse {

    private final List<ContentBlock> content;
    private final String stopReason;

    @JsonCreator
    public ResearchResponse(
            @JsonProperty("content") List<ContentBlock> content,
            @JsonProperty("stop_reason") String stopReason) {
        this.content = content != null ? List.copyOf(content) : List.of();
        this.stopReason = stopReason;
    }

    public static ResearchResponse of(ContentBlock... blocks) {
        return new ResearchResponse(List.of(blocks), "end_turn");
    }

    public List<ContentBlock> getContent() {
        return content;
    }

    public String getStopReason() {
        return stopReason;
    }

    /**
     * Text of the first text-typed block, skipping any other block types before it.
     */
    public Optional<String> firstText() {
        return content.stream()
                .filter(ContentBlock::isText)
                .map(ContentBlock::getText)
                .findFirst();
    }
}
