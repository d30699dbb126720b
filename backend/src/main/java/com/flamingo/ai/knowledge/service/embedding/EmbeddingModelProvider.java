package com.flamingo.ai.knowledge.service.embedding;

import dev.langchain4j.model.embedding.EmbeddingModel;

/** Builds the LangChain4j model for an embedding model name. */
@FunctionalInterface
public interface EmbeddingModelProvider {

  EmbeddingModel create(String modelName);
}
