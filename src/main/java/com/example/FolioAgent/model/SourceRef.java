package com.example.FolioAgent.model;

/**
 * Citation returned to the caller.
 */
public record SourceRef(
        Long id,
        String type,
        double score,
        String method,
        String preview
) {
    private static final int PREVIEW_CHARS = 200;

    public static SourceRef from(RetrievalResult result) {
        KbDocument doc = result.document();
        String content = doc.getContent();
        String preview;
        if (content == null) {
            preview = "";
        } else if (content.length() > PREVIEW_CHARS) {
            preview = content.substring(0, PREVIEW_CHARS) + "...";
        } else {
            preview = content;
        }
        return new SourceRef(doc.getId(), doc.getDocType(), result.score(), result.method().name(), preview);
    }
}
