package com.keywatch.shared.model;

import java.util.List;

/** Media carried by a source message; forwarded as-is, only the kinds are kept for the payload. */
public record MediaAttachment(List<String> kinds) {

    public MediaAttachment {
        kinds = List.copyOf(kinds);
    }
}
