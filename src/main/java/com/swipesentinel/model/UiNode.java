package com.swipesentinel.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One element of the accessibility tree, in document order.
 *
 * @param ordinal     1-based position in the tree walk; unique within one observation only
 * @param className   Android widget class (role), may be null
 * @param resourceId  view identifier such as {@code co.hinge.app:id/message_input}, may be null
 * @param text        visible text, may be null
 * @param contentDesc accessibility label, may be null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UiNode(
        int ordinal,
        @JsonProperty("class_name") String className,
        @JsonProperty("resource_id") String resourceId,
        String text,
        @JsonProperty("content_desc") String contentDesc,
        boolean clickable,
        boolean enabled,
        Bounds bounds) {

    /** Content-desc when present (more likely to name an affordance), otherwise text. */
    public String label() {
        if (contentDesc != null && !contentDesc.isBlank()) return contentDesc.trim();
        if (text != null && !text.isBlank()) return text.trim();
        return "";
    }

    public boolean hasResourceId() {
        return resourceId != null && !resourceId.isBlank();
    }
}
