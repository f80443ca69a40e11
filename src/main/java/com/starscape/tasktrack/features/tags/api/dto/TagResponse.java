package com.starscape.tasktrack.features.tags.api.dto;

import com.starscape.tasktrack.features.tags.domain.Tag;

public record TagResponse(
    Long id,
    String name
) {
    public static TagResponse from(Tag tag) {
        return new TagResponse(tag.getTagId(), tag.getName());
    }
}
