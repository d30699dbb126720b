package com.flamingo.ai.knowledge.service.knowledgebase;

import com.flamingo.ai.knowledge.domain.enums.DocumentType;
import lombok.Builder;

/**
 * Document to add to a knowledge base, with its already extracted text.
 *
 * @param contentRef file path or URL the text was extracted from
 */
@Builder
public record NewDocument(
    DocumentType type,
    String title,
    String filename,
    String mimeType,
    String contentRef,
    String content) {}
