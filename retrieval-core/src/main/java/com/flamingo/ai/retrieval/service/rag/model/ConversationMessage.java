package com.flamingo.ai.retrieval.service.rag.model;

/**
 * One turn of a conversation transcript.
 *
 * @param role speaker role, e.g. {@code user} or {@code assistant}
 * @param content message text
 */
public record ConversationMessage(String role, String content) {}
